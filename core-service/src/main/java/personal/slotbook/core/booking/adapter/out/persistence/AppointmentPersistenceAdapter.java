package personal.slotbook.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.slotbook.core.booking.application.port.out.AppointmentRepository;
import personal.slotbook.core.booking.domain.model.Appointment;
import personal.slotbook.core.booking.domain.model.AppointmentStatus;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Appointment Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AppointmentPersistenceAdapter implements AppointmentRepository {

    private final JpaAppointmentRepository jpaAppointmentRepository;

    @Override
    public Appointment save(Appointment appointment) {
        log.debug("Saving appointment: businessId={}, date={}, status={}",
                appointment.businessId(), appointment.date(), appointment.status());
        return jpaAppointmentRepository.save(AppointmentEntity.fromDomain(appointment)).toDomain();
    }

    @Override
    public Optional<Appointment> findById(Long id) {
        log.debug("Finding appointment: appointmentId={}", id);
        return jpaAppointmentRepository.findById(id)
                .map(AppointmentEntity::toDomain);
    }

    @Override
    public Optional<Long> findBusinessIdById(Long id) {
        return jpaAppointmentRepository.findBusinessIdById(id);
    }

    @Override
    public Optional<Appointment> findByIdForUpdate(Long id) {
        log.debug("Acquiring appointment write lock: appointmentId={}", id);
        return jpaAppointmentRepository.findByIdForUpdate(id)
                .map(AppointmentEntity::toDomain);
    }

    @Override
    public List<Appointment> findActiveByBusinessIdAndDate(Long businessId, LocalDate date) {
        return jpaAppointmentRepository
                .findByBusinessIdAndDateExcludingStatus(businessId, date, AppointmentStatus.CANCELLED)
                .stream()
                .map(AppointmentEntity::toDomain)
                .toList();
    }
}
