package personal.slotbook.core.booking.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import personal.slotbook.core.booking.domain.model.DailyHours;
import personal.slotbook.core.booking.domain.model.OperatingSchedule;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.DayOfWeek;
import java.util.List;

/**
 * 주간 영업 시간표 응답 DTO (요일 순)
 */
public record OperatingScheduleResponse(
        Long businessId,
        List<Day> days
) {
    public static OperatingScheduleResponse from(OperatingSchedule schedule) {
        return new OperatingScheduleResponse(
                schedule.businessId(),
                schedule.days().values().stream().map(Day::from).toList()
        );
    }

    public record Day(
            DayOfWeek dayOfWeek,
            @JsonProperty("isOpen") boolean isOpen,
            String openTime,
            String closeTime,
            List<Break> breaks
    ) {
        public static Day from(DailyHours hours) {
            return new Day(
                    hours.dayOfWeek(),
                    hours.open(),
                    TimeRange.format(hours.openTime()),
                    TimeRange.format(hours.closeTime()),
                    hours.breaks().stream().map(Break::from).toList()
            );
        }
    }

    public record Break(String startTime, String endTime) {
        static Break from(TimeRange range) {
            return new Break(TimeRange.format(range.startTime()), TimeRange.format(range.endTime()));
        }
    }
}
