package personal.slotbook.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import personal.slotbook.core.booking.application.port.in.BookAppointmentCommand;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;

/**
 * 예약 생성 요청 DTO
 */
public record BookAppointmentRequest(
        Long staffId,

        @NotNull(message = "예약 날짜는 필수입니다.")
        LocalDate date,

        @NotBlank(message = "시작 시각은 필수입니다.")
        @Pattern(regexp = TimeFormats.HH_MM_PATTERN, message = TimeFormats.HH_MM_MESSAGE)
        String startTime,

        @NotBlank(message = "종료 시각은 필수입니다.")
        @Pattern(regexp = TimeFormats.HH_MM_PATTERN, message = TimeFormats.HH_MM_MESSAGE)
        String endTime
) {
    public BookAppointmentCommand toCommand(Long businessId, Long customerId) {
        return new BookAppointmentCommand(businessId, customerId, staffId, date,
                TimeRange.parseTime(startTime), TimeRange.parseTime(endTime));
    }
}
