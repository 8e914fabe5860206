package personal.slotbook.core.booking.adapter.in.web.dto;

import personal.slotbook.core.booking.domain.model.AvailableSlot;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;

/**
 * 다음 예약 가능 슬롯 응답 DTO
 */
public record AvailableSlotResponse(
        LocalDate date,
        String startTime,
        String endTime,
        Long staffId
) {
    public static AvailableSlotResponse from(AvailableSlot slot) {
        return new AvailableSlotResponse(
                slot.date(),
                TimeRange.format(slot.startTime()),
                TimeRange.format(slot.endTime()),
                slot.staffId()
        );
    }
}
