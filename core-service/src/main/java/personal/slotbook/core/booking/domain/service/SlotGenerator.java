package personal.slotbook.core.booking.domain.service;

import org.springframework.stereotype.Component;
import personal.slotbook.core.booking.domain.exception.InvalidIntervalException;
import personal.slotbook.core.booking.domain.model.TimeRange;
import personal.slotbook.core.booking.domain.model.TimeSlot;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Slot Generator
 * 영업 시작 시각부터 step 간격으로 [t, t+duration) 후보 슬롯을 생성
 * t+duration이 마감 시각을 넘거나 휴게 시간과 겹치는 후보는 제외 (부분 슬롯 없음)
 */
@Component
public class SlotGenerator {

    public List<TimeSlot> generate(LocalTime openTime, LocalTime closeTime, List<TimeRange> breaks,
                                   int durationMinutes, int stepMinutes) {
        if (durationMinutes <= 0) {
            throw new InvalidIntervalException("Duration must be positive: " + durationMinutes);
        }
        if (stepMinutes <= 0) {
            throw new InvalidIntervalException("Slot step must be positive: " + stepMinutes);
        }

        int open = TimeRange.toMinutes(openTime);
        int close = TimeRange.toMinutes(closeTime);

        List<TimeSlot> slots = new ArrayList<>();
        for (int start = open; start + durationMinutes <= close; start += stepMinutes) {
            TimeRange candidate = TimeRange.ofMinutes(start, start + durationMinutes);
            if (overlapsAny(candidate, breaks)) {
                continue;
            }
            slots.add(TimeSlot.available(candidate));
        }
        return slots;
    }

    private boolean overlapsAny(TimeRange candidate, List<TimeRange> breaks) {
        return breaks.stream().anyMatch(candidate::overlaps);
    }
}
