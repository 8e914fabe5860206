package personal.slotbook.core.booking.domain.model;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 다음 예약 가능 슬롯 조회 결과
 */
public record AvailableSlot(
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        Long staffId) {

    public static AvailableSlot of(LocalDate date, TimeSlot slot) {
        return new AvailableSlot(date, slot.startTime(), slot.endTime(), slot.staffId());
    }
}
