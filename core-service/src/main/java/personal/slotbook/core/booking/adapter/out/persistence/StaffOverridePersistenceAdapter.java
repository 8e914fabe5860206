package personal.slotbook.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.slotbook.core.booking.application.port.out.StaffOverrideRepository;
import personal.slotbook.core.booking.domain.model.StaffAvailabilityOverride;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Staff Override Persistence Adapter
 */
@Component
@RequiredArgsConstructor
public class StaffOverridePersistenceAdapter implements StaffOverrideRepository {

    private final JpaStaffOverrideRepository jpaStaffOverrideRepository;

    @Override
    public Optional<StaffAvailabilityOverride> findByStaffIdAndDate(Long staffId, LocalDate date) {
        return jpaStaffOverrideRepository.findByStaffIdAndOverrideDate(staffId, date)
                .map(StaffOverrideEntity::toDomain);
    }

    @Override
    @Transactional
    public StaffAvailabilityOverride save(StaffAvailabilityOverride override) {
        StaffOverrideEntity entity = jpaStaffOverrideRepository
                .findByStaffIdAndOverrideDate(override.staffId(), override.date())
                .map(existing -> {
                    existing.update(override);
                    return existing;
                })
                .orElseGet(() -> StaffOverrideEntity.create(override));
        return jpaStaffOverrideRepository.save(entity).toDomain();
    }

    @Override
    @Transactional
    public boolean deleteByStaffIdAndDate(Long staffId, LocalDate date) {
        return jpaStaffOverrideRepository.findByStaffIdAndOverrideDate(staffId, date)
                .map(entity -> {
                    jpaStaffOverrideRepository.delete(entity);
                    return true;
                })
                .orElse(false);
    }
}
