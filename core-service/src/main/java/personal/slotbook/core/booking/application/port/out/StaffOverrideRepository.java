package personal.slotbook.core.booking.application.port.out;

import personal.slotbook.core.booking.domain.model.StaffAvailabilityOverride;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Staff Override Repository (Output Port)
 */
public interface StaffOverrideRepository {

    Optional<StaffAvailabilityOverride> findByStaffIdAndDate(Long staffId, LocalDate date);

    /**
     * 직원 + 날짜 기준 upsert
     */
    StaffAvailabilityOverride save(StaffAvailabilityOverride override);

    boolean deleteByStaffIdAndDate(Long staffId, LocalDate date);
}
