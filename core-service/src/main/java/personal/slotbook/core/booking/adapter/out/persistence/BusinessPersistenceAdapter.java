package personal.slotbook.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.slotbook.core.booking.application.port.out.BusinessRepository;
import personal.slotbook.core.booking.application.port.out.StaffRepository;
import personal.slotbook.core.booking.domain.model.Staff;

import java.util.Optional;

/**
 * Business Persistence Adapter
 * 업체/직원 조회와 업체 행 잠금 (SELECT ... FOR UPDATE)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BusinessPersistenceAdapter implements BusinessRepository, StaffRepository {

    private final JpaBusinessRepository jpaBusinessRepository;
    private final JpaStaffRepository jpaStaffRepository;

    @Override
    public boolean existsById(Long businessId) {
        return jpaBusinessRepository.existsById(businessId);
    }

    @Override
    public boolean lockForWrite(Long businessId) {
        log.debug("Acquiring business write lock: businessId={}", businessId);
        return jpaBusinessRepository.findByIdForUpdate(businessId).isPresent();
    }

    @Override
    public Optional<Staff> findById(Long staffId) {
        return jpaStaffRepository.findById(staffId)
                .map(StaffEntity::toDomain);
    }
}
