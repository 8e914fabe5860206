package personal.slotbook.core.booking.application.port.out;

import personal.slotbook.core.booking.domain.model.DailyHours;
import personal.slotbook.core.booking.domain.model.OperatingSchedule;

import java.time.DayOfWeek;
import java.util.Optional;

/**
 * Operating Schedule Repository (Output Port)
 * 요일별 영업 시간 저장소
 */
public interface OperatingScheduleRepository {

    /**
     * 업체의 주간 영업 시간표 조회 (등록되지 않은 요일은 포함하지 않음)
     */
    OperatingSchedule findByBusinessId(Long businessId);

    Optional<DailyHours> findByBusinessIdAndDayOfWeek(Long businessId, DayOfWeek dayOfWeek);

    /**
     * 요일 영업 시간 저장 (업체 + 요일 기준 upsert)
     */
    DailyHours save(Long businessId, DailyHours dailyHours);
}
