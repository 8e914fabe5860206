package personal.slotbook.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import personal.slotbook.core.booking.application.port.in.SetStaffOverrideCommand;

import java.time.LocalDate;

/**
 * 직원 근무 예외 설정 요청 DTO
 */
public record StaffOverrideRequest(
        @NotNull(message = "근무 가능 여부는 필수입니다.")
        Boolean isAvailable,

        @Pattern(regexp = TimeFormats.HH_MM_PATTERN, message = TimeFormats.HH_MM_MESSAGE)
        String startTime,

        @Pattern(regexp = TimeFormats.HH_MM_PATTERN, message = TimeFormats.HH_MM_MESSAGE)
        String endTime,

        @Size(max = 255, message = "사유는 255자 이하여야 합니다.")
        String reason
) {
    public SetStaffOverrideCommand toCommand(Long staffId, LocalDate date) {
        return new SetStaffOverrideCommand(staffId, date, isAvailable,
                OperatingHoursRequest.parseOrNull(startTime),
                OperatingHoursRequest.parseOrNull(endTime),
                reason);
    }
}
