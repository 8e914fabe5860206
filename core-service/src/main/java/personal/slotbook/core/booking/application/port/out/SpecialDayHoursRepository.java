package personal.slotbook.core.booking.application.port.out;

import personal.slotbook.core.booking.domain.model.SpecialDayHours;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Special Day Hours Repository (Output Port)
 */
public interface SpecialDayHoursRepository {

    Optional<SpecialDayHours> findByBusinessIdAndDate(Long businessId, LocalDate date);

    /**
     * 업체 + 날짜 기준 upsert
     */
    SpecialDayHours save(SpecialDayHours specialDayHours);

    /**
     * @return 삭제된 기록이 있으면 true
     */
    boolean deleteByBusinessIdAndDate(Long businessId, LocalDate date);
}
