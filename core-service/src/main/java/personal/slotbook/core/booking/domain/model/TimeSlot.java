package personal.slotbook.core.booking.domain.model;

import java.time.LocalTime;

/**
 * 예약 후보 슬롯 (저장하지 않음, 조회 시마다 계산)
 * endTime - startTime은 요청한 서비스 소요 시간과 같음
 */
public record TimeSlot(
        LocalTime startTime,
        LocalTime endTime,
        boolean available,
        Long staffId) {

    public static TimeSlot available(TimeRange range) {
        return new TimeSlot(range.startTime(), range.endTime(), true, null);
    }

    public TimeRange timeRange() {
        return new TimeRange(startTime, endTime);
    }

    public TimeSlot withAvailability(boolean isAvailable, Long forStaffId) {
        return new TimeSlot(startTime, endTime, isAvailable, forStaffId);
    }
}
