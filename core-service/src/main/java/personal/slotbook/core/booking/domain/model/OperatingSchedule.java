package personal.slotbook.core.booking.domain.model;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 업체의 주간 영업 시간표
 * 항목이 없는 요일은 휴무로 취급
 */
public record OperatingSchedule(
        Long businessId,
        Map<DayOfWeek, DailyHours> days) {

    public OperatingSchedule {
        days = days == null || days.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(days));
    }

    public Optional<DailyHours> hoursFor(DayOfWeek dayOfWeek) {
        return Optional.ofNullable(days.get(dayOfWeek));
    }
}
