package personal.slotbook.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.slotbook.core.booking.application.port.in.PublishPendingEventsUseCase;
import personal.slotbook.core.booking.application.port.out.AppointmentEventPublisher;
import personal.slotbook.core.booking.application.port.out.OutboxEventRepository;
import personal.slotbook.core.booking.domain.model.AppointmentEventType;
import personal.slotbook.core.booking.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Service
 * 대기 중인 예약 이벤트를 Kafka로 발행하는 도메인 서비스
 * 발행 실패 건은 재시도 횟수를 늘리고, 최대 횟수 도달 시 FAILED로 남김
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxEventService implements PublishPendingEventsUseCase {

    private final OutboxEventRepository outboxEventRepository;
    private final AppointmentEventPublisher eventPublisher;

    @Override
    @Transactional
    public int publishPendingEvents() {
        List<OutboxEvent> pendingEvents = outboxEventRepository.findPendingEvents();
        int publishedCount = 0;

        for (OutboxEvent event : pendingEvents) {
            try {
                String topic = AppointmentEventType.valueOf(event.eventType()).topic();

                // Key: appointmentId (같은 예약의 이벤트 순서 보장)
                String key = String.valueOf(event.aggregateId());

                log.debug("Publishing event: id={}, type={}, topic={}", event.id(), event.eventType(), topic);
                eventPublisher.publishRaw(topic, key, event.payload());

                outboxEventRepository.save(event.markAsPublished());
                publishedCount++;

            } catch (Exception e) {
                log.error("Failed to publish event: id={}, type={}, retryCount={}",
                        event.id(), event.eventType(), event.retryCount(), e);
                outboxEventRepository.save(event.recordFailure());
            }
        }
        return publishedCount;
    }
}
