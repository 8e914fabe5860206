package personal.slotbook.core.booking.application.port.in;

import personal.slotbook.core.booking.domain.model.Appointment;
import personal.slotbook.core.booking.domain.model.AppointmentStatus;

/**
 * Change Appointment Status UseCase (Input Port)
 * 취소를 제외한 예약 상태 전이 (확정, 시작, 완료, 노쇼)
 */
public interface ChangeAppointmentStatusUseCase {

    /**
     * @param target 목표 상태 (CANCELLED는 CancelAppointmentUseCase 사용)
     * @throws personal.slotbook.core.booking.domain.exception.InvalidAppointmentStateException 허용되지 않는 전이
     */
    Appointment changeStatus(Long appointmentId, AppointmentStatus target);

    default Appointment confirm(Long appointmentId) {
        return changeStatus(appointmentId, AppointmentStatus.CONFIRMED);
    }

    default Appointment start(Long appointmentId) {
        return changeStatus(appointmentId, AppointmentStatus.IN_PROGRESS);
    }

    default Appointment complete(Long appointmentId) {
        return changeStatus(appointmentId, AppointmentStatus.COMPLETED);
    }

    default Appointment markNoShow(Long appointmentId) {
        return changeStatus(appointmentId, AppointmentStatus.NO_SHOW);
    }
}
