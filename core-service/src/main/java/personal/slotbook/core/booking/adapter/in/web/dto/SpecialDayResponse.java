package personal.slotbook.core.booking.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import personal.slotbook.core.booking.domain.model.SpecialDayHours;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;

/**
 * 특별 영업일 응답 DTO
 */
public record SpecialDayResponse(
        Long businessId,
        LocalDate date,
        @JsonProperty("isOpen") boolean isOpen,
        String openTime,
        String closeTime,
        String note
) {
    public static SpecialDayResponse from(SpecialDayHours specialDay) {
        return new SpecialDayResponse(
                specialDay.businessId(),
                specialDay.date(),
                specialDay.open(),
                TimeRange.format(specialDay.openTime()),
                TimeRange.format(specialDay.closeTime()),
                specialDay.note()
        );
    }
}
