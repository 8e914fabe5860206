package personal.slotbook.core.booking.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;
import personal.slotbook.core.booking.domain.model.Appointment;
import personal.slotbook.core.booking.domain.model.AppointmentEventType;
import personal.slotbook.core.booking.domain.model.TimeRange;

/**
 * Outbox Event Factory (Adapter Layer)
 * Appointment를 OutboxEventEntity로 변환하는 팩토리
 * 시각은 "HH:mm", 날짜는 ISO 형식 문자열로 직렬화
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxEventFactory {

    static final String AGGREGATE_TYPE = "APPOINTMENT";

    private final ObjectMapper objectMapper;

    public OutboxEventEntity createAppointmentEvent(Appointment appointment, AppointmentEventType eventType) {
        try {
            // DTO 생성 (Domain Model만 사용)
            AppointmentEventPayload event = new AppointmentEventPayload(
                    appointment.id(),
                    appointment.businessId(),
                    appointment.customerId(),
                    appointment.staffId(),
                    appointment.date().toString(),
                    TimeRange.format(appointment.timeRange().startTime()),
                    TimeRange.format(appointment.timeRange().endTime()),
                    appointment.status().name(),
                    appointment.updatedAt() != null ? appointment.updatedAt().toString() : null);

            String payload = objectMapper.writeValueAsString(event);

            return OutboxEventEntity.create(AGGREGATE_TYPE, appointment.id(), eventType.name(), payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to create outbox event: appointmentId={}, type={}", appointment.id(), eventType, e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to create outbox event", e);
        }
    }

    /**
     * Kafka 이벤트 DTO
     */
    public record AppointmentEventPayload(
            Long appointmentId,
            Long businessId,
            Long customerId,
            Long staffId,
            String date,
            String startTime,
            String endTime,
            String status,
            String occurredAt) {
    }
}
