package personal.slotbook.core.booking.domain.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * Day Availability (파생 데이터, 캐시 대상)
 * 동일 키로 반복 조회하면 같은 인스턴스를 반환하므로 호출자는 참조 비교로 변경 여부를 판단할 수 있음
 */
public record DayAvailability(
        LocalDate date,
        boolean open,
        LocalTime openTime,
        LocalTime closeTime,
        List<TimeSlot> slots,
        List<BlockedInterval> blockedSlots) {

    public DayAvailability {
        slots = slots == null ? List.of() : List.copyOf(slots);
        blockedSlots = blockedSlots == null ? List.of() : List.copyOf(blockedSlots);
    }

    public static DayAvailability closed(LocalDate date) {
        return new DayAvailability(date, false, null, null, List.of(), List.of());
    }

    public Optional<TimeSlot> firstAvailableSlot() {
        return slots.stream()
                .filter(TimeSlot::available)
                .findFirst();
    }
}
