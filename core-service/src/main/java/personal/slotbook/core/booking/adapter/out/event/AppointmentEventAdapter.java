package personal.slotbook.core.booking.adapter.out.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.slotbook.core.booking.adapter.out.persistence.JpaOutboxEventRepository;
import personal.slotbook.core.booking.adapter.out.persistence.OutboxEventEntity;
import personal.slotbook.core.booking.adapter.out.persistence.OutboxEventFactory;
import personal.slotbook.core.booking.application.port.out.AppointmentEventPort;
import personal.slotbook.core.booking.domain.model.Appointment;
import personal.slotbook.core.booking.domain.model.AppointmentEventType;

/**
 * Appointment Event Adapter
 * Outbox 패턴을 사용한 예약 이벤트 기록 구현체
 * 호출한 트랜잭션 안에서 저장되므로 예약 저장과 원자적으로 커밋/롤백됨
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AppointmentEventAdapter implements AppointmentEventPort {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;
    private final OutboxEventFactory outboxEventFactory;

    @Override
    public void publishAppointmentEvent(Appointment appointment, AppointmentEventType eventType) {
        OutboxEventEntity outboxEvent = outboxEventFactory.createAppointmentEvent(appointment, eventType);
        jpaOutboxEventRepository.save(outboxEvent);
        log.debug("Appointment event recorded: appointmentId={}, type={}", appointment.id(), eventType);
    }
}
