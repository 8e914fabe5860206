package personal.slotbook.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import personal.slotbook.core.booking.application.port.in.BlockPeriodCommand;
import personal.slotbook.core.booking.domain.model.RecurrencePattern;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;

/**
 * 차단 시간 생성 요청 DTO
 * recurrence: daily | weekly | monthly (생략 시 단건)
 */
public record BlockPeriodRequest(
        Long staffId,

        @NotNull(message = "차단 날짜는 필수입니다.")
        LocalDate date,

        @NotBlank(message = "시작 시각은 필수입니다.")
        @Pattern(regexp = TimeFormats.HH_MM_PATTERN, message = TimeFormats.HH_MM_MESSAGE)
        String startTime,

        @NotBlank(message = "종료 시각은 필수입니다.")
        @Pattern(regexp = TimeFormats.HH_MM_PATTERN, message = TimeFormats.HH_MM_MESSAGE)
        String endTime,

        @Size(max = 255, message = "사유는 255자 이하여야 합니다.")
        String reason,

        String recurrence
) {
    public BlockPeriodCommand toCommand(Long businessId) {
        return new BlockPeriodCommand(businessId, staffId, date,
                TimeRange.parseTime(startTime), TimeRange.parseTime(endTime),
                reason, RecurrencePattern.from(recurrence));
    }
}
