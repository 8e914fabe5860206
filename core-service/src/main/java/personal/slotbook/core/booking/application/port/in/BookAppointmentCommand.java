package personal.slotbook.core.booking.application.port.in;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Book Appointment Command
 * 예약 생성 커맨드
 */
public record BookAppointmentCommand(
        Long businessId,
        Long customerId,
        Long staffId,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime
) {
    public BookAppointmentCommand {
        if (businessId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Business ID cannot be null");
        }
        if (customerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer ID cannot be null");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Date cannot be null");
        }
    }

    /**
     * @throws personal.slotbook.core.booking.domain.exception.InvalidIntervalException 시작 >= 종료
     */
    public TimeRange timeRange() {
        return new TimeRange(startTime, endTime);
    }
}
