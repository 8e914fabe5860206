package personal.slotbook.core.booking.domain.model;

import personal.slotbook.core.booking.domain.exception.InvalidScheduleException;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Comparator;
import java.util.List;

/**
 * 요일별 영업 시간 (OperatingSchedule의 한 항목)
 * 영업일이면 openTime < closeTime, 휴게 시간은 [openTime, closeTime) 안에 있고 서로 겹치지 않음
 */
public record DailyHours(
        DayOfWeek dayOfWeek,
        boolean open,
        LocalTime openTime,
        LocalTime closeTime,
        List<TimeRange> breaks) {

    public DailyHours {
        if (dayOfWeek == null) {
            throw new InvalidScheduleException("Day of week cannot be null");
        }
        breaks = breaks == null ? List.of() : breaks.stream()
                .sorted(Comparator.comparing(TimeRange::startTime))
                .toList();
        if (open) {
            if (openTime == null || closeTime == null || !openTime.isBefore(closeTime)) {
                throw new InvalidScheduleException(
                        String.format("Open time must be before close time: day=%s, open=%s, close=%s",
                                dayOfWeek, openTime, closeTime));
            }
            TimeRange window = new TimeRange(openTime, closeTime);
            for (int i = 0; i < breaks.size(); i++) {
                TimeRange current = breaks.get(i);
                if (!window.contains(current)) {
                    throw new InvalidScheduleException(
                            String.format("Break %s lies outside operating hours %s: day=%s", current, window, dayOfWeek));
                }
                if (i > 0 && breaks.get(i - 1).overlaps(current)) {
                    throw new InvalidScheduleException(
                            String.format("Breaks overlap: %s, %s, day=%s", breaks.get(i - 1), current, dayOfWeek));
                }
            }
        }
    }

    public static DailyHours closed(DayOfWeek dayOfWeek) {
        return new DailyHours(dayOfWeek, false, null, null, List.of());
    }

    public static DailyHours open(DayOfWeek dayOfWeek, LocalTime openTime, LocalTime closeTime,
                                  List<TimeRange> breaks) {
        return new DailyHours(dayOfWeek, true, openTime, closeTime, breaks);
    }

    public TimeRange window() {
        return open ? new TimeRange(openTime, closeTime) : null;
    }
}
