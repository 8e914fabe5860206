package personal.slotbook.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.slotbook.core.booking.domain.model.AppointmentStatus;

/**
 * 예약 상태 변경 요청 DTO
 */
public record ChangeAppointmentStatusRequest(
        @NotNull(message = "변경할 상태는 필수입니다.")
        AppointmentStatus status
) {
}
