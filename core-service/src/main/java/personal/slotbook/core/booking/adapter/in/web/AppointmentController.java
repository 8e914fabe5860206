package personal.slotbook.core.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.slotbook.core.booking.adapter.in.web.dto.AppointmentResponse;
import personal.slotbook.core.booking.adapter.in.web.dto.BookAppointmentRequest;
import personal.slotbook.core.booking.adapter.in.web.dto.ChangeAppointmentStatusRequest;
import personal.slotbook.core.booking.adapter.in.web.dto.RescheduleAppointmentRequest;
import personal.slotbook.core.booking.application.port.in.BookAppointmentUseCase;
import personal.slotbook.core.booking.application.port.in.CancelAppointmentUseCase;
import personal.slotbook.core.booking.application.port.in.ChangeAppointmentStatusUseCase;
import personal.slotbook.core.booking.application.port.in.RescheduleAppointmentUseCase;
import personal.slotbook.core.booking.domain.model.Appointment;

/**
 * Appointment API Controller
 * 예약 생성/취소/상태 변경/일정 변경 REST API
 * 인증/권한은 앞단에서 처리되며 X-User-Id로 요청자를 전달받음
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AppointmentController {

    private final BookAppointmentUseCase bookAppointmentUseCase;
    private final CancelAppointmentUseCase cancelAppointmentUseCase;
    private final ChangeAppointmentStatusUseCase changeAppointmentStatusUseCase;
    private final RescheduleAppointmentUseCase rescheduleAppointmentUseCase;

    /**
     * 예약 생성
     * POST /api/v1/businesses/{businessId}/appointments
     * 겹치는 일정이 있으면 409 Conflict
     */
    @PostMapping("/businesses/{businessId}/appointments")
    public ResponseEntity<AppointmentResponse> bookAppointment(
            @PathVariable Long businessId,
            @Valid @RequestBody BookAppointmentRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Book appointment: businessId={}, userId={}, date={}, start={}, end={}",
                businessId, userId, request.date(), request.startTime(), request.endTime());

        Appointment appointment = bookAppointmentUseCase.bookAppointment(request.toCommand(businessId, userId));

        return ResponseEntity.status(HttpStatus.CREATED).body(AppointmentResponse.from(appointment));
    }

    /**
     * 예약 취소
     * POST /api/v1/appointments/{appointmentId}/cancel
     */
    @PostMapping("/appointments/{appointmentId}/cancel")
    public ResponseEntity<AppointmentResponse> cancelAppointment(
            @PathVariable Long appointmentId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Cancel appointment: appointmentId={}, userId={}", appointmentId, userId);

        return ResponseEntity.ok(AppointmentResponse.from(cancelAppointmentUseCase.cancelAppointment(appointmentId)));
    }

    /**
     * 예약 상태 변경 (CONFIRMED, IN_PROGRESS, COMPLETED, NO_SHOW, CANCELLED)
     * POST /api/v1/appointments/{appointmentId}/status
     */
    @PostMapping("/appointments/{appointmentId}/status")
    public ResponseEntity<AppointmentResponse> changeStatus(
            @PathVariable Long appointmentId,
            @Valid @RequestBody ChangeAppointmentStatusRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Change appointment status: appointmentId={}, status={}, userId={}",
                appointmentId, request.status(), userId);

        Appointment appointment = changeAppointmentStatusUseCase.changeStatus(appointmentId, request.status());
        return ResponseEntity.ok(AppointmentResponse.from(appointment));
    }

    /**
     * 예약 일정 변경
     * PUT /api/v1/appointments/{appointmentId}/schedule
     */
    @PutMapping("/appointments/{appointmentId}/schedule")
    public ResponseEntity<AppointmentResponse> rescheduleAppointment(
            @PathVariable Long appointmentId,
            @Valid @RequestBody RescheduleAppointmentRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Reschedule appointment: appointmentId={}, date={}, start={}, end={}, userId={}",
                appointmentId, request.date(), request.startTime(), request.endTime(), userId);

        Appointment appointment = rescheduleAppointmentUseCase.rescheduleAppointment(request.toCommand(appointmentId));
        return ResponseEntity.ok(AppointmentResponse.from(appointment));
    }
}
