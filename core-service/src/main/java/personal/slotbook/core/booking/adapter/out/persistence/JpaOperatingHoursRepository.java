package personal.slotbook.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for OperatingHours
 */
public interface JpaOperatingHoursRepository extends JpaRepository<OperatingHoursEntity, Long> {

    List<OperatingHoursEntity> findByBusinessId(Long businessId);

    Optional<OperatingHoursEntity> findByBusinessIdAndDayOfWeek(Long businessId, DayOfWeek dayOfWeek);
}
