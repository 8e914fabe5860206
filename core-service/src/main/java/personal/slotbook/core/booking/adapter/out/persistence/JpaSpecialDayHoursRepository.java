package personal.slotbook.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Spring Data JPA Repository for SpecialDayHours
 */
public interface JpaSpecialDayHoursRepository extends JpaRepository<SpecialDayHoursEntity, Long> {

    Optional<SpecialDayHoursEntity> findByBusinessIdAndSpecialDate(Long businessId, LocalDate specialDate);
}
