package personal.slotbook.core.booking.application.port.out;

import personal.slotbook.core.booking.domain.model.Appointment;
import personal.slotbook.core.booking.domain.model.AppointmentEventType;

/**
 * Appointment Event Port
 * 예약 이벤트 기록 책임 (Outbox 패턴, 호출한 트랜잭션에 참여)
 */
public interface AppointmentEventPort {

    /**
     * @param appointment 이벤트 대상 예약 (저장 후 상태)
     * @param eventType   이벤트 종류
     */
    void publishAppointmentEvent(Appointment appointment, AppointmentEventType eventType);
}
