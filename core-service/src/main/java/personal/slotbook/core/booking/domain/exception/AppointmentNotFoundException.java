package personal.slotbook.core.booking.domain.exception;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;

/**
 * Appointment Not Found Exception
 */
public class AppointmentNotFoundException extends BusinessException {
    public AppointmentNotFoundException(Long appointmentId) {
        super(ErrorCode.APPOINTMENT_NOT_FOUND,
                String.format("Appointment not found: appointmentId=%d", appointmentId));
    }
}
