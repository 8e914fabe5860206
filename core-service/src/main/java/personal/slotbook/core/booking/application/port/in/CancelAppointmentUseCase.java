package personal.slotbook.core.booking.application.port.in;

import personal.slotbook.core.booking.domain.model.Appointment;

/**
 * Cancel Appointment UseCase (Input Port)
 */
public interface CancelAppointmentUseCase {

    /**
     * 예약 취소. 취소된 예약은 더 이상 시간을 점유하지 않음
     *
     * @throws personal.slotbook.core.booking.domain.exception.AppointmentNotFoundException 예약이 없을 때
     * @throws personal.slotbook.core.booking.domain.exception.InvalidAppointmentStateException 이미 종료된 예약일 때
     */
    Appointment cancelAppointment(Long appointmentId);
}
