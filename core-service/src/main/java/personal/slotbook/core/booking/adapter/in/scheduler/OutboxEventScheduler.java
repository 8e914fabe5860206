package personal.slotbook.core.booking.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.slotbook.core.booking.application.port.in.PublishPendingEventsUseCase;

/**
 * Outbox Event Scheduler (Driving Adapter)
 * 주기적으로 OutboxEventService를 호출하여 PENDING 상태의 예약 이벤트를 발행
 * slotbook.outbox.enabled=false면 등록되지 않음 (테스트 프로필)
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "slotbook.outbox", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OutboxEventScheduler {

    private final PublishPendingEventsUseCase publishPendingEventsUseCase;

    /**
     * 이전 작업 완료 후 fixed-delay-ms 간격으로 실행 (기본 500ms)
     */
    @Scheduled(fixedDelayString = "${slotbook.outbox.fixed-delay-ms:500}")
    public void schedulePublishing() {
        int publishedCount = publishPendingEventsUseCase.publishPendingEvents();
        if (publishedCount > 0) {
            log.debug("Scheduled publishing completed. Count: {}", publishedCount);
        }
    }
}
