package personal.slotbook.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import personal.slotbook.core.booking.domain.model.OutboxEvent.OutboxEventStatus;

import java.util.List;

/**
 * Spring Data JPA Repository for OutboxEvent
 */
public interface JpaOutboxEventRepository extends JpaRepository<OutboxEventEntity, Long> {

    /**
     * Aggregate ID로 이벤트 조회
     */
    List<OutboxEventEntity> findByAggregateTypeAndAggregateId(String aggregateType, Long aggregateId);

    /**
     * 발행 대기 중인 이벤트 조회 (재시도 횟수 제한)
     */
    List<OutboxEventEntity> findByStatusAndRetryCountLessThanOrderByCreatedAtAsc(
            OutboxEventStatus status,
            int maxRetryCount
    );
}
