package personal.slotbook.core.booking.domain.model;

import personal.slotbook.core.booking.domain.exception.InvalidIntervalException;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/**
 * 같은 날짜 위의 반개구간 [startTime, endTime)
 * 모든 겹침 판단은 {@link #overlaps(TimeRange)} 하나로 수행
 */
public record TimeRange(
        LocalTime startTime,
        LocalTime endTime) {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final int MINUTES_PER_DAY = 24 * 60;

    public TimeRange {
        if (startTime == null || endTime == null) {
            throw new InvalidIntervalException("Start time and end time are required");
        }
        if (!startTime.isBefore(endTime)) {
            throw new InvalidIntervalException(
                    String.format("Start time must be before end time: %s-%s", format(startTime), format(endTime)));
        }
    }

    public static TimeRange of(String startTime, String endTime) {
        return new TimeRange(parseTime(startTime), parseTime(endTime));
    }

    /**
     * 자정 기준 분(minute) 값으로 구간 생성
     */
    public static TimeRange ofMinutes(int startMinute, int endMinute) {
        if (startMinute < 0 || endMinute >= MINUTES_PER_DAY) {
            throw new InvalidIntervalException(
                    String.format("Interval exceeds the day bounds: %d-%d", startMinute, endMinute));
        }
        return new TimeRange(LocalTime.of(startMinute / 60, startMinute % 60),
                LocalTime.of(endMinute / 60, endMinute % 60));
    }

    /**
     * a.start < b.end AND b.start < a.end
     * 맞닿은 구간(a.end == b.start)은 겹치지 않음
     */
    public boolean overlaps(TimeRange other) {
        return startTime.isBefore(other.endTime) && other.startTime.isBefore(endTime);
    }

    public boolean contains(TimeRange other) {
        return !other.startTime.isBefore(startTime) && !other.endTime.isAfter(endTime);
    }

    /**
     * 두 구간의 교집합. 겹치지 않으면 empty
     */
    public Optional<TimeRange> intersection(TimeRange other) {
        if (!overlaps(other)) {
            return Optional.empty();
        }
        LocalTime start = startTime.isAfter(other.startTime) ? startTime : other.startTime;
        LocalTime end = endTime.isBefore(other.endTime) ? endTime : other.endTime;
        return Optional.of(new TimeRange(start, end));
    }

    public int startMinute() {
        return toMinutes(startTime);
    }

    public int endMinute() {
        return toMinutes(endTime);
    }

    public int durationMinutes() {
        return endMinute() - startMinute();
    }

    public static int toMinutes(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }

    /**
     * "HH:MM" (24시간제) 엄격 파싱
     */
    public static LocalTime parseTime(String hhmm) {
        if (hhmm == null || hhmm.isBlank()) {
            throw new InvalidIntervalException("Time is required (HH:MM)");
        }
        try {
            return LocalTime.parse(hhmm.trim(), HH_MM);
        } catch (DateTimeParseException e) {
            throw new InvalidIntervalException("Invalid time (HH:MM): " + hhmm);
        }
    }

    public static String format(LocalTime time) {
        return time == null ? null : time.format(HH_MM);
    }

    @Override
    public String toString() {
        return "[" + format(startTime) + "," + format(endTime) + ")";
    }
}
