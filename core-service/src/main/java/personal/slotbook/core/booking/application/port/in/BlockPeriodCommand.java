package personal.slotbook.core.booking.application.port.in;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;
import personal.slotbook.core.booking.domain.model.RecurrencePattern;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Block Period Command
 * 차단 시간 생성 커맨드
 *
 * @param staffId    특정 직원만 차단할 때 지정 (null이면 업체 전체)
 * @param recurrence 반복 규칙 (null이면 단건)
 */
public record BlockPeriodCommand(
        Long businessId,
        Long staffId,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        String reason,
        RecurrencePattern recurrence
) {
    public BlockPeriodCommand {
        if (businessId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Business ID cannot be null");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Date cannot be null");
        }
    }

    public TimeRange timeRange() {
        return new TimeRange(startTime, endTime);
    }
}
