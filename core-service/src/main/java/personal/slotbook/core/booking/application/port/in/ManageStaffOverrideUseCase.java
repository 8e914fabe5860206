package personal.slotbook.core.booking.application.port.in;

import personal.slotbook.core.booking.domain.model.StaffAvailabilityOverride;

import java.time.LocalDate;

/**
 * Manage Staff Override UseCase (Input Port)
 */
public interface ManageStaffOverrideUseCase {

    /**
     * 직원 + 날짜 기준 upsert. 소속 업체의 캐시 무효화
     *
     * @throws personal.slotbook.core.booking.domain.exception.StaffNotFoundException 직원이 없을 때
     */
    StaffAvailabilityOverride setStaffOverride(SetStaffOverrideCommand command);

    void removeStaffOverride(Long staffId, LocalDate date);
}
