package personal.slotbook.core.booking.domain.exception;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;
import personal.slotbook.core.booking.domain.model.AppointmentStatus;

/**
 * Invalid Appointment State Exception
 * 허용되지 않는 상태 전이를 시도한 경우 발생
 */
public class InvalidAppointmentStateException extends BusinessException {
    public InvalidAppointmentStateException(AppointmentStatus current, AppointmentStatus target) {
        super(ErrorCode.INVALID_APPOINTMENT_STATE,
                String.format("Cannot change appointment status: %s -> %s", current, target));
    }

    public InvalidAppointmentStateException(AppointmentStatus current, String action) {
        super(ErrorCode.INVALID_APPOINTMENT_STATE,
                String.format("Cannot %s appointment in %s status", action, current));
    }
}
