package personal.slotbook.core.booking.domain.model;

import personal.slotbook.core.booking.domain.exception.InvalidScheduleException;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 특정 날짜의 영업 시간 예외 (공휴일 휴무, 연장 영업 등)
 * 주간 영업 시간보다 우선하며, 비어 있는 시각은 주간 영업 시간 값을 사용
 */
public record SpecialDayHours(
        Long businessId,
        LocalDate date,
        boolean open,
        LocalTime openTime,
        LocalTime closeTime,
        String note) {

    public SpecialDayHours {
        if (businessId == null || date == null) {
            throw new InvalidScheduleException("Business ID and date are required for a special day");
        }
        if (openTime != null && closeTime != null && !openTime.isBefore(closeTime)) {
            throw new InvalidScheduleException(
                    String.format("Open time must be before close time: date=%s, open=%s, close=%s",
                            date, openTime, closeTime));
        }
    }
}
