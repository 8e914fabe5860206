package personal.slotbook.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import personal.slotbook.core.booking.application.port.in.SetSpecialDayCommand;

import java.time.LocalDate;

/**
 * 특별 영업일 설정 요청 DTO
 * 시각을 생략하면 해당 요일의 주간 영업 시간을 사용
 */
public record SpecialDayRequest(
        @NotNull(message = "영업 여부는 필수입니다.")
        Boolean isOpen,

        @Pattern(regexp = TimeFormats.HH_MM_PATTERN, message = TimeFormats.HH_MM_MESSAGE)
        String openTime,

        @Pattern(regexp = TimeFormats.HH_MM_PATTERN, message = TimeFormats.HH_MM_MESSAGE)
        String closeTime,

        @Size(max = 255, message = "메모는 255자 이하여야 합니다.")
        String note
) {
    public SetSpecialDayCommand toCommand(Long businessId, LocalDate date) {
        return new SetSpecialDayCommand(businessId, date, isOpen,
                OperatingHoursRequest.parseOrNull(openTime),
                OperatingHoursRequest.parseOrNull(closeTime),
                note);
    }
}
