package personal.slotbook.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.slotbook.core.booking.application.port.out.AppointmentEventPort;
import personal.slotbook.core.booking.application.port.out.AppointmentRepository;
import personal.slotbook.core.booking.application.port.out.BlockedPeriodRepository;
import personal.slotbook.core.booking.application.port.out.BusinessRepository;
import personal.slotbook.core.booking.domain.exception.AppointmentNotFoundException;
import personal.slotbook.core.booking.domain.exception.BusinessNotFoundException;
import personal.slotbook.core.booking.domain.exception.SlotConflictException;
import personal.slotbook.core.booking.domain.model.Appointment;
import personal.slotbook.core.booking.domain.model.AppointmentEventType;
import personal.slotbook.core.booking.domain.model.BlockedPeriod;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Conflict Guard (Transaction Manager)
 * 예약/차단 시간 쓰기의 유일한 관문
 *
 * 업체 행 비관적 잠금 -> 저장소 재조회 -> 겹침 검사 -> 저장을 하나의 트랜잭션으로 수행
 * 같은 업체에 대한 동시 쓰기는 잠금에서 직렬화되므로 같은 구간을 두 요청이 모두 통과할 수 없음
 * 읽기 캐시는 사용하지 않으며, 캐시 무효화는 커밋 이후 호출자가 수행
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConflictGuard {

    private final BusinessRepository businessRepository;
    private final AppointmentRepository appointmentRepository;
    private final BlockedPeriodRepository blockedPeriodRepository;
    private final RecurrenceExpander recurrenceExpander;
    private final AppointmentEventPort appointmentEventPort;

    /**
     * 신규 예약 커밋
     *
     * @return 저장된 예약 (ID 포함)
     * @throws SlotConflictException 겹치는 예약 또는 차단 시간이 있을 때 (아무것도 저장하지 않음)
     */
    @Transactional
    public Appointment commitAppointment(Appointment candidate) {
        lockBusiness(candidate.businessId());

        ensureNoConflict(candidate.businessId(), candidate.staffId(), candidate.date(),
                candidate.timeRange(), null);

        Appointment saved = appointmentRepository.save(candidate);
        // 같은 트랜잭션에서 Outbox 기록
        appointmentEventPort.publishAppointmentEvent(saved, AppointmentEventType.APPOINTMENT_BOOKED);

        log.debug("Appointment committed: appointmentId={}, businessId={}, date={}, interval={}",
                saved.id(), saved.businessId(), saved.date(), saved.timeRange());
        return saved;
    }

    /**
     * 신규 차단 시간 커밋
     * 반복 템플릿은 기준일(date)에 대해서만 검사
     */
    @Transactional
    public BlockedPeriod commitBlockedPeriod(BlockedPeriod candidate) {
        lockBusiness(candidate.businessId());

        ensureNoConflict(candidate.businessId(), candidate.staffId(), candidate.date(),
                candidate.timeRange(), null);

        BlockedPeriod saved = blockedPeriodRepository.save(candidate);
        log.debug("Blocked period committed: blockedPeriodId={}, businessId={}, date={}, interval={}, recurrence={}",
                saved.id(), saved.businessId(), saved.date(), saved.timeRange(), saved.recurrence());
        return saved;
    }

    /**
     * 예약 일정 변경 커밋
     * 잠금 이후 예약을 다시 읽어 상태를 검증하고, 자기 자신은 충돌 대상에서 제외
     */
    @Transactional
    public Appointment commitReschedule(Long appointmentId, Long businessId, LocalDate newDate, TimeRange newTimeRange) {
        lockBusiness(businessId);

        Appointment current = appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> new AppointmentNotFoundException(appointmentId));

        // 상태 검증 (SCHEDULED/CONFIRMED만 가능)
        Appointment rescheduled = current.reschedule(newDate, newTimeRange);

        ensureNoConflict(current.businessId(), current.staffId(), newDate, newTimeRange, current.id());

        Appointment saved = appointmentRepository.save(rescheduled);
        appointmentEventPort.publishAppointmentEvent(saved, AppointmentEventType.APPOINTMENT_RESCHEDULED);

        log.debug("Appointment reschedule committed: appointmentId={}, from={} {}, to={} {}",
                saved.id(), current.date(), current.timeRange(), newDate, newTimeRange);
        return saved;
    }

    private void lockBusiness(Long businessId) {
        if (!businessRepository.lockForWrite(businessId)) {
            throw new BusinessNotFoundException(businessId);
        }
    }

    private void ensureNoConflict(Long businessId, Long staffId, LocalDate date, TimeRange requested,
                                  Long excludedAppointmentId) {
        boolean appointmentConflict = appointmentRepository.findActiveByBusinessIdAndDate(businessId, date).stream()
                .filter(Appointment::occupiesTime)
                .filter(existing -> !Objects.equals(existing.id(), excludedAppointmentId))
                .filter(existing -> existing.competesWith(staffId))
                .anyMatch(existing -> existing.timeRange().overlaps(requested));

        boolean blockedConflict = !appointmentConflict
                && blockedPeriodRepository.findCandidatesOn(businessId, date).stream()
                .filter(period -> period.competesWith(staffId))
                .filter(period -> recurrenceExpander.occursOn(period, date))
                .anyMatch(period -> period.timeRange().overlaps(requested));

        if (appointmentConflict || blockedConflict) {
            log.warn("Slot conflict detected: businessId={}, staffId={}, date={}, interval={}, withAppointment={}",
                    businessId, staffId, date, requested, appointmentConflict);
            throw new SlotConflictException(businessId, date, requested);
        }
    }
}
