package personal.slotbook.core.booking.application.port.in;

import personal.slotbook.core.booking.domain.model.Appointment;

/**
 * Reschedule Appointment UseCase (Input Port)
 */
public interface RescheduleAppointmentUseCase {

    /**
     * 예약 일정 변경
     * 예약 생성과 같은 업체 잠금 + 충돌 검사를 거치며, 자기 자신의 기존 구간은 충돌에서 제외
     *
     * @throws personal.slotbook.core.booking.domain.exception.SlotConflictException 새 구간이 다른 일정과 겹칠 때
     * @throws personal.slotbook.core.booking.domain.exception.InvalidAppointmentStateException SCHEDULED/CONFIRMED가 아닐 때
     */
    Appointment rescheduleAppointment(RescheduleAppointmentCommand command);
}
