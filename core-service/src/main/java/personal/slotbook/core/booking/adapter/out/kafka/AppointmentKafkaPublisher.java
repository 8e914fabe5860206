package personal.slotbook.core.booking.adapter.out.kafka;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import personal.slotbook.core.booking.application.port.out.AppointmentEventPublisher;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Appointment Kafka Publisher (Adapter Layer)
 * Kafka를 통한 예약 이벤트 발행 구현체
 * Outbox Service에 의해 호출되며, 브로커 응답을 기다려 실패를 호출자에게 전달
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AppointmentKafkaPublisher implements AppointmentEventPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 5;

    private final KafkaTemplate<String, String> kafkaTemplate;

    @Override
    public void publishRaw(String topic, String key, String payload) {
        log.debug("Publishing raw event: topic={}, key={}", topic, key);
        try {
            kafkaTemplate.send(topic, key, payload).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.debug("Raw event published: topic={}, key={}", topic, key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Kafka publish interrupted: topic=" + topic, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Kafka publish failed: topic=" + topic + ", key=" + key, e);
        }
    }
}
