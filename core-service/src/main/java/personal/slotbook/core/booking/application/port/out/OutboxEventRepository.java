package personal.slotbook.core.booking.application.port.out;

import personal.slotbook.core.booking.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Repository (Output Port)
 */
public interface OutboxEventRepository {

    OutboxEvent save(OutboxEvent outboxEvent);

    /**
     * 발행 대기(PENDING) 이벤트를 생성 순으로 조회
     */
    List<OutboxEvent> findPendingEvents();
}
