package personal.slotbook.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.slotbook.core.booking.application.port.in.BookAppointmentCommand;
import personal.slotbook.core.booking.application.port.in.BookAppointmentUseCase;
import personal.slotbook.core.booking.application.port.in.CancelAppointmentUseCase;
import personal.slotbook.core.booking.application.port.in.ChangeAppointmentStatusUseCase;
import personal.slotbook.core.booking.application.port.in.RescheduleAppointmentCommand;
import personal.slotbook.core.booking.application.port.in.RescheduleAppointmentUseCase;
import personal.slotbook.core.booking.domain.exception.BusinessClosedException;
import personal.slotbook.core.booking.domain.exception.InvalidIntervalException;
import personal.slotbook.core.booking.domain.model.Appointment;
import personal.slotbook.core.booking.domain.model.AppointmentStatus;
import personal.slotbook.core.booking.domain.model.DailyHours;
import personal.slotbook.core.booking.domain.model.TimeRange;
import personal.slotbook.core.booking.domain.service.AppointmentManager;
import personal.slotbook.core.booking.domain.service.ConflictGuard;

import java.time.LocalDate;

/**
 * Appointment Booking Application Service
 * 예약 생성/일정 변경/상태 변경
 *
 * 1. 구간 검증 (저장소 접근 전)
 * 2. 업체/직원/영업 시간 검증
 * 3. ConflictGuard 트랜잭션 (업체 잠금 + 재검사 + 저장 + Outbox)
 * 4. 커밋 이후 업체 캐시 무효화
 * 저장소 장애는 StoreUnavailableException으로 변환하며 충돌과 구분
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentBookingService implements
        BookAppointmentUseCase,
        CancelAppointmentUseCase,
        ChangeAppointmentStatusUseCase,
        RescheduleAppointmentUseCase {

    private final AvailabilityResolver availabilityResolver;
    private final ConflictGuard conflictGuard;
    private final AppointmentManager appointmentManager;

    @Override
    public Appointment bookAppointment(BookAppointmentCommand command) {
        log.info("Booking appointment: businessId={}, customerId={}, staffId={}, date={}, start={}, end={}",
                command.businessId(), command.customerId(), command.staffId(),
                command.date(), command.startTime(), command.endTime());

        TimeRange requested = command.timeRange();

        Appointment saved = StoreOperations.execute("bookAppointment", () -> {
            availabilityResolver.ensureBusinessExists(command.businessId());
            validateBookable(command.businessId(), command.date(), requested);
            availabilityResolver.ensureStaffBelongsTo(command.businessId(), command.staffId());

            Appointment candidate = Appointment.create(command.businessId(), command.customerId(),
                    command.staffId(), command.date(), requested);
            return conflictGuard.commitAppointment(candidate);
        });

        // 트랜잭션 커밋 이후 캐시 무효화
        availabilityResolver.invalidate(saved.businessId());

        log.info("Appointment booked: appointmentId={}, businessId={}, date={}, interval={}",
                saved.id(), saved.businessId(), saved.date(), saved.timeRange());
        return saved;
    }

    @Override
    public Appointment cancelAppointment(Long appointmentId) {
        log.info("Cancelling appointment: appointmentId={}", appointmentId);

        Appointment cancelled = StoreOperations.execute("cancelAppointment",
                () -> appointmentManager.transition(appointmentId, AppointmentStatus.CANCELLED));
        availabilityResolver.invalidate(cancelled.businessId());

        log.info("Appointment cancelled: appointmentId={}, businessId={}", appointmentId, cancelled.businessId());
        return cancelled;
    }

    @Override
    public Appointment changeStatus(Long appointmentId, AppointmentStatus target) {
        log.info("Changing appointment status: appointmentId={}, target={}", appointmentId, target);
        if (target == AppointmentStatus.CANCELLED) {
            return cancelAppointment(appointmentId);
        }

        Appointment changed = StoreOperations.execute("changeAppointmentStatus",
                () -> appointmentManager.transition(appointmentId, target));
        // 상태만 바뀌어도 캐시된 결과의 출처가 바뀌므로 무효화
        availabilityResolver.invalidate(changed.businessId());
        return changed;
    }

    @Override
    public Appointment rescheduleAppointment(RescheduleAppointmentCommand command) {
        log.info("Rescheduling appointment: appointmentId={}, date={}, start={}, end={}",
                command.appointmentId(), command.date(), command.startTime(), command.endTime());

        TimeRange requested = command.timeRange();

        Appointment saved = StoreOperations.execute("rescheduleAppointment", () -> {
            Appointment current = appointmentManager.getAppointment(command.appointmentId());
            validateBookable(current.businessId(), command.date(), requested);
            return conflictGuard.commitReschedule(current.id(), current.businessId(), command.date(), requested);
        });

        availabilityResolver.invalidate(saved.businessId());

        log.info("Appointment rescheduled: appointmentId={}, date={}, interval={}",
                saved.id(), saved.date(), saved.timeRange());
        return saved;
    }

    /**
     * 영업일이고 구간이 영업 시간 안에 있으며 휴게 시간과 겹치지 않는지 검증
     */
    private void validateBookable(Long businessId, LocalDate date, TimeRange requested) {
        DailyHours hours = availabilityResolver.effectiveHours(businessId, date)
                .orElseThrow(() -> {
                    log.warn("Booking rejected on closed day: businessId={}, date={}", businessId, date);
                    return new BusinessClosedException(businessId, date);
                });

        if (!hours.window().contains(requested)) {
            throw new InvalidIntervalException(
                    String.format("Interval %s is outside operating hours %s", requested, hours.window()));
        }
        hours.breaks().stream()
                .filter(requested::overlaps)
                .findFirst()
                .ifPresent(overlapped -> {
                    throw new InvalidIntervalException(
                            String.format("Interval %s overlaps break %s", requested, overlapped));
                });
    }
}
