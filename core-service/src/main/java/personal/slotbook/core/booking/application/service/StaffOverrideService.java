package personal.slotbook.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.slotbook.core.booking.application.port.in.ManageStaffOverrideUseCase;
import personal.slotbook.core.booking.application.port.in.SetStaffOverrideCommand;
import personal.slotbook.core.booking.application.port.out.StaffOverrideRepository;
import personal.slotbook.core.booking.application.port.out.StaffRepository;
import personal.slotbook.core.booking.domain.exception.StaffNotFoundException;
import personal.slotbook.core.booking.domain.model.Staff;
import personal.slotbook.core.booking.domain.model.StaffAvailabilityOverride;

import java.time.LocalDate;

/**
 * Staff Override Application Service
 * 직원 근무 예외 변경 시 직원 소속 업체의 캐시 무효화
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaffOverrideService implements ManageStaffOverrideUseCase {

    private final AvailabilityResolver availabilityResolver;
    private final StaffRepository staffRepository;
    private final StaffOverrideRepository staffOverrideRepository;

    @Override
    public StaffAvailabilityOverride setStaffOverride(SetStaffOverrideCommand command) {
        log.info("Setting staff override: staffId={}, date={}, available={}",
                command.staffId(), command.date(), command.available());

        StaffAvailabilityOverride override = command.toOverride();

        Staff staff = StoreOperations.execute("setStaffOverride", () -> findStaff(command.staffId()));
        StaffAvailabilityOverride saved = StoreOperations.execute("setStaffOverride",
                () -> staffOverrideRepository.save(override));

        availabilityResolver.invalidate(staff.businessId());
        return saved;
    }

    @Override
    public void removeStaffOverride(Long staffId, LocalDate date) {
        log.info("Removing staff override: staffId={}, date={}", staffId, date);

        Staff staff = StoreOperations.execute("removeStaffOverride", () -> {
            Staff found = findStaff(staffId);
            staffOverrideRepository.deleteByStaffIdAndDate(staffId, date);
            return found;
        });

        availabilityResolver.invalidate(staff.businessId());
    }

    private Staff findStaff(Long staffId) {
        return staffRepository.findById(staffId)
                .orElseThrow(() -> new StaffNotFoundException(staffId));
    }
}
