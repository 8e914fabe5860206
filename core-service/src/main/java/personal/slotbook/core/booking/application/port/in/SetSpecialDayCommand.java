package personal.slotbook.core.booking.application.port.in;

import personal.slotbook.core.booking.domain.model.SpecialDayHours;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Set Special Day Command
 * 특정 날짜 영업 시간 예외 (공휴일 휴무, 연장 영업)
 */
public record SetSpecialDayCommand(
        Long businessId,
        LocalDate date,
        boolean open,
        LocalTime openTime,
        LocalTime closeTime,
        String note
) {
    public SpecialDayHours toSpecialDayHours() {
        return new SpecialDayHours(businessId, date, open, openTime, closeTime, note);
    }
}
