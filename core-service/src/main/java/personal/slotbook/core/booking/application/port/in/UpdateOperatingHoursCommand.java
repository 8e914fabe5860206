package personal.slotbook.core.booking.application.port.in;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;
import personal.slotbook.core.booking.domain.model.DailyHours;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;

/**
 * Update Operating Hours Command
 * 요일별 영업 시간 변경 커맨드
 */
public record UpdateOperatingHoursCommand(
        Long businessId,
        DayOfWeek dayOfWeek,
        boolean open,
        LocalTime openTime,
        LocalTime closeTime,
        List<TimeRange> breaks
) {
    public UpdateOperatingHoursCommand {
        if (businessId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Business ID cannot be null");
        }
        if (dayOfWeek == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Day of week cannot be null");
        }
    }

    /**
     * @throws personal.slotbook.core.booking.domain.exception.InvalidScheduleException 영업 시간 규칙 위반
     */
    public DailyHours toDailyHours() {
        return open
                ? DailyHours.open(dayOfWeek, openTime, closeTime, breaks)
                : DailyHours.closed(dayOfWeek);
    }
}
