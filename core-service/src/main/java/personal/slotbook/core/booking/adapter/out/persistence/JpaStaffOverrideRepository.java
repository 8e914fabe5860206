package personal.slotbook.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Spring Data JPA Repository for StaffAvailabilityOverride
 */
public interface JpaStaffOverrideRepository extends JpaRepository<StaffOverrideEntity, Long> {

    Optional<StaffOverrideEntity> findByStaffIdAndOverrideDate(Long staffId, LocalDate overrideDate);
}
