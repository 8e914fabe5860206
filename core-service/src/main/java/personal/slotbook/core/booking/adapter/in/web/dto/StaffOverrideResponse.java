package personal.slotbook.core.booking.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import personal.slotbook.core.booking.domain.model.StaffAvailabilityOverride;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;

/**
 * 직원 근무 예외 응답 DTO
 */
public record StaffOverrideResponse(
        Long staffId,
        LocalDate date,
        @JsonProperty("isAvailable") boolean isAvailable,
        String startTime,
        String endTime,
        String reason
) {
    public static StaffOverrideResponse from(StaffAvailabilityOverride override) {
        return new StaffOverrideResponse(
                override.staffId(),
                override.date(),
                override.available(),
                override.window() == null ? null : TimeRange.format(override.window().startTime()),
                override.window() == null ? null : TimeRange.format(override.window().endTime()),
                override.reason()
        );
    }
}
