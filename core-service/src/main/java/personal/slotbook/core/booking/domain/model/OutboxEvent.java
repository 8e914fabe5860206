package personal.slotbook.core.booking.domain.model;

import java.time.LocalDateTime;

/**
 * Outbox Event Domain Model (불변)
 * 트랜잭션과 함께 저장되고 스케줄러가 Kafka로 발행
 */
public record OutboxEvent(
        Long id,
        String aggregateType,
        Long aggregateId,
        String eventType,
        String payload,
        OutboxEventStatus status,
        LocalDateTime createdAt,
        LocalDateTime publishedAt,
        int retryCount) {

    public static final int MAX_RETRY_COUNT = 3;

    public OutboxEvent markAsPublished() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                OutboxEventStatus.PUBLISHED, createdAt, LocalDateTime.now(), retryCount);
    }

    /**
     * 재시도 횟수 증가. 최대 횟수에 도달하면 FAILED
     */
    public OutboxEvent recordFailure() {
        int retried = retryCount + 1;
        OutboxEventStatus next = retried >= MAX_RETRY_COUNT ? OutboxEventStatus.FAILED : OutboxEventStatus.PENDING;
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                next, createdAt, publishedAt, retried);
    }

    public enum OutboxEventStatus {
        PENDING,
        PUBLISHED,
        FAILED
    }
}
