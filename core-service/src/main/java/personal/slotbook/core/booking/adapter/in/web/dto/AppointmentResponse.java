package personal.slotbook.core.booking.adapter.in.web.dto;

import personal.slotbook.core.booking.domain.model.Appointment;
import personal.slotbook.core.booking.domain.model.AppointmentStatus;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;

/**
 * 예약 생성/변경 응답 DTO
 */
public record AppointmentResponse(
        Long appointmentId,
        Long businessId,
        Long customerId,
        Long staffId,
        LocalDate date,
        String startTime,
        String endTime,
        AppointmentStatus status
) {
    public static AppointmentResponse from(Appointment appointment) {
        return new AppointmentResponse(
                appointment.id(),
                appointment.businessId(),
                appointment.customerId(),
                appointment.staffId(),
                appointment.date(),
                TimeRange.format(appointment.timeRange().startTime()),
                TimeRange.format(appointment.timeRange().endTime()),
                appointment.status()
        );
    }
}
