package personal.slotbook.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.slotbook.core.booking.application.port.out.AppointmentEventPort;
import personal.slotbook.core.booking.application.port.out.AppointmentRepository;
import personal.slotbook.core.booking.application.port.out.BusinessRepository;
import personal.slotbook.core.booking.domain.exception.AppointmentNotFoundException;
import personal.slotbook.core.booking.domain.exception.BusinessNotFoundException;
import personal.slotbook.core.booking.domain.model.Appointment;
import personal.slotbook.core.booking.domain.model.AppointmentEventType;
import personal.slotbook.core.booking.domain.model.AppointmentStatus;

/**
 * Appointment Domain Service (Transaction Manager)
 * 예약 상태 전이 전용. 일정 변경은 ConflictGuard 담당
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AppointmentManager {

    private final BusinessRepository businessRepository;
    private final AppointmentRepository appointmentRepository;
    private final AppointmentEventPort appointmentEventPort;

    public Appointment getAppointment(Long appointmentId) {
        return appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> new AppointmentNotFoundException(appointmentId));
    }

    /**
     * 상태 전이 (트랜잭션)
     * 업체 ID만 먼저 조회 -> 업체 잠금 -> 예약 행 잠금 조회 순서
     * 잠금 이전에는 예약 엔티티를 읽지 않으므로 다른 트랜잭션이 커밋한 상태 변경을 덮어쓰지 않음
     * 취소 시에는 Outbox 이벤트 기록
     */
    @Transactional
    public Appointment transition(Long appointmentId, AppointmentStatus target) {
        Long businessId = appointmentRepository.findBusinessIdById(appointmentId)
                .orElseThrow(() -> new AppointmentNotFoundException(appointmentId));
        if (!businessRepository.lockForWrite(businessId)) {
            throw new BusinessNotFoundException(businessId);
        }

        Appointment current = appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> new AppointmentNotFoundException(appointmentId));
        Appointment changed = appointmentRepository.save(current.transitionTo(target));

        if (target == AppointmentStatus.CANCELLED) {
            appointmentEventPort.publishAppointmentEvent(changed, AppointmentEventType.APPOINTMENT_CANCELLED);
        }

        log.debug("Appointment status changed: appointmentId={}, {} -> {}",
                appointmentId, current.status(), changed.status());
        return changed;
    }
}
