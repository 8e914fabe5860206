package personal.slotbook.core.booking.domain.model;

import java.time.LocalDate;

/**
 * DayAvailability 캐시 키 (값 타입)
 */
public record AvailabilityKey(
        Long businessId,
        LocalDate date,
        int durationMinutes,
        Long staffId) {
}
