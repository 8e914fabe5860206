package personal.slotbook.core.booking.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import personal.slotbook.core.booking.domain.model.BlockedInterval;
import personal.slotbook.core.booking.domain.model.DayAvailability;
import personal.slotbook.core.booking.domain.model.TimeRange;
import personal.slotbook.core.booking.domain.model.TimeSlot;

import java.time.LocalDate;
import java.util.List;

/**
 * 하루 예약 가능 정보 응답 DTO
 */
public record DayAvailabilityResponse(
        LocalDate date,
        @JsonProperty("isOpen") boolean isOpen,
        String openTime,
        String closeTime,
        List<Slot> slots,
        List<BlockedSlot> blockedSlots
) {
    public static DayAvailabilityResponse from(DayAvailability day) {
        return new DayAvailabilityResponse(
                day.date(),
                day.open(),
                TimeRange.format(day.openTime()),
                TimeRange.format(day.closeTime()),
                day.slots().stream().map(Slot::from).toList(),
                day.blockedSlots().stream().map(BlockedSlot::from).toList()
        );
    }

    public record Slot(
            String startTime,
            String endTime,
            boolean available,
            Long staffId
    ) {
        static Slot from(TimeSlot slot) {
            return new Slot(TimeRange.format(slot.startTime()), TimeRange.format(slot.endTime()),
                    slot.available(), slot.staffId());
        }
    }

    public record BlockedSlot(
            Long blockedPeriodId,
            String startTime,
            String endTime,
            String reason
    ) {
        static BlockedSlot from(BlockedInterval interval) {
            return new BlockedSlot(interval.blockedPeriodId(),
                    TimeRange.format(interval.timeRange().startTime()),
                    TimeRange.format(interval.timeRange().endTime()),
                    interval.reason());
        }
    }
}
