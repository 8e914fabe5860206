package personal.slotbook.core.booking.application.port.in;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Reschedule Appointment Command
 */
public record RescheduleAppointmentCommand(
        Long appointmentId,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime
) {
    public RescheduleAppointmentCommand {
        if (appointmentId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Appointment ID cannot be null");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Date cannot be null");
        }
    }

    public TimeRange timeRange() {
        return new TimeRange(startTime, endTime);
    }
}
