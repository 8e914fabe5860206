package personal.slotbook.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data JPA Repository for Staff
 */
public interface JpaStaffRepository extends JpaRepository<StaffEntity, Long> {
}
