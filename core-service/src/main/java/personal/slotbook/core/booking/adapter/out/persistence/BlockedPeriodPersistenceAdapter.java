package personal.slotbook.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.slotbook.core.booking.application.port.out.BlockedPeriodRepository;
import personal.slotbook.core.booking.domain.model.BlockedPeriod;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Blocked Period Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BlockedPeriodPersistenceAdapter implements BlockedPeriodRepository {

    private final JpaBlockedPeriodRepository jpaBlockedPeriodRepository;

    @Override
    public BlockedPeriod save(BlockedPeriod blockedPeriod) {
        return jpaBlockedPeriodRepository.save(BlockedPeriodEntity.fromDomain(blockedPeriod)).toDomain();
    }

    @Override
    public Optional<BlockedPeriod> findById(Long id) {
        return jpaBlockedPeriodRepository.findById(id)
                .map(BlockedPeriodEntity::toDomain);
    }

    @Override
    public void deleteById(Long id) {
        jpaBlockedPeriodRepository.deleteById(id);
    }

    @Override
    public List<BlockedPeriod> findCandidatesOn(Long businessId, LocalDate date) {
        log.debug("Finding blocked period candidates: businessId={}, date={}", businessId, date);
        return jpaBlockedPeriodRepository.findCandidatesOn(businessId, date).stream()
                .map(BlockedPeriodEntity::toDomain)
                .toList();
    }
}
