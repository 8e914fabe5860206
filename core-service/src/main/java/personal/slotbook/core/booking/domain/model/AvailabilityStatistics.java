package personal.slotbook.core.booking.domain.model;

import java.util.Collection;

/**
 * 기간 내 슬롯 이용률 통계
 * 영업일만 집계하며, 예약 불가 슬롯(예약/차단/직원 부재)은 모두 bookedSlots로 계산
 *
 * @param utilizationRate bookedSlots / totalSlots (슬롯이 없으면 0)
 */
public record AvailabilityStatistics(
        int totalSlots,
        int availableSlots,
        int bookedSlots,
        int blockedCount,
        double utilizationRate) {

    public static AvailabilityStatistics aggregate(Collection<DayAvailability> days) {
        int total = 0;
        int available = 0;
        int booked = 0;
        int blocked = 0;

        for (DayAvailability day : days) {
            if (!day.open()) {
                continue;
            }
            for (TimeSlot slot : day.slots()) {
                total++;
                if (slot.available()) {
                    available++;
                } else {
                    booked++;
                }
            }
            blocked += day.blockedSlots().size();
        }

        double rate = total > 0 ? (double) booked / total : 0.0;
        return new AvailabilityStatistics(total, available, booked, blocked, rate);
    }
}
