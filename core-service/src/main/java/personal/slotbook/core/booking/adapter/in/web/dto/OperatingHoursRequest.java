package personal.slotbook.core.booking.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import personal.slotbook.core.booking.application.port.in.UpdateOperatingHoursCommand;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;

/**
 * 요일 영업 시간 변경 요청 DTO
 */
public record OperatingHoursRequest(
        @NotNull(message = "영업 여부는 필수입니다.")
        Boolean isOpen,

        @Pattern(regexp = TimeFormats.HH_MM_PATTERN, message = TimeFormats.HH_MM_MESSAGE)
        String openTime,

        @Pattern(regexp = TimeFormats.HH_MM_PATTERN, message = TimeFormats.HH_MM_MESSAGE)
        String closeTime,

        List<@Valid BreakTime> breaks
) {
    public UpdateOperatingHoursCommand toCommand(Long businessId, DayOfWeek dayOfWeek) {
        List<TimeRange> breakRanges = breaks == null ? List.of() : breaks.stream()
                .map(BreakTime::toTimeRange)
                .toList();
        return new UpdateOperatingHoursCommand(businessId, dayOfWeek, isOpen,
                parseOrNull(openTime), parseOrNull(closeTime), breakRanges);
    }

    static LocalTime parseOrNull(String hhmm) {
        return hhmm == null || hhmm.isBlank() ? null : TimeRange.parseTime(hhmm);
    }

    public record BreakTime(
            @NotBlank(message = "휴게 시작 시각은 필수입니다.")
            @Pattern(regexp = TimeFormats.HH_MM_PATTERN, message = TimeFormats.HH_MM_MESSAGE)
            String startTime,

            @NotBlank(message = "휴게 종료 시각은 필수입니다.")
            @Pattern(regexp = TimeFormats.HH_MM_PATTERN, message = TimeFormats.HH_MM_MESSAGE)
            String endTime
    ) {
        TimeRange toTimeRange() {
            return TimeRange.of(startTime, endTime);
        }
    }
}
