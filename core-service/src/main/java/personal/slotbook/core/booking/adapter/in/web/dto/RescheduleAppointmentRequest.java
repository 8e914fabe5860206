package personal.slotbook.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import personal.slotbook.core.booking.application.port.in.RescheduleAppointmentCommand;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;

/**
 * 예약 일정 변경 요청 DTO
 */
public record RescheduleAppointmentRequest(
        @NotNull(message = "변경할 날짜는 필수입니다.")
        LocalDate date,

        @NotBlank(message = "시작 시각은 필수입니다.")
        @Pattern(regexp = TimeFormats.HH_MM_PATTERN, message = TimeFormats.HH_MM_MESSAGE)
        String startTime,

        @NotBlank(message = "종료 시각은 필수입니다.")
        @Pattern(regexp = TimeFormats.HH_MM_PATTERN, message = TimeFormats.HH_MM_MESSAGE)
        String endTime
) {
    public RescheduleAppointmentCommand toCommand(Long appointmentId) {
        return new RescheduleAppointmentCommand(appointmentId, date,
                TimeRange.parseTime(startTime), TimeRange.parseTime(endTime));
    }
}
