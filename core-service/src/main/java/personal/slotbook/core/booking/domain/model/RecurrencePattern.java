package personal.slotbook.core.booking.domain.model;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;

import java.util.Locale;

/**
 * 차단 시간 반복 규칙
 */
public enum RecurrencePattern {
    DAILY,
    WEEKLY,
    /**
     * 기준일과 같은 일(day-of-month). 해당 월에 그 날짜가 없으면 건너뜀
     */
    MONTHLY;

    public static RecurrencePattern from(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return RecurrencePattern.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Unknown recurrence pattern: " + value);
        }
    }
}
