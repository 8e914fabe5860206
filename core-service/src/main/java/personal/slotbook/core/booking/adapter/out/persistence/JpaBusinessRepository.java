package personal.slotbook.core.booking.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Spring Data JPA Repository for Business
 */
public interface JpaBusinessRepository extends JpaRepository<BusinessEntity, Long> {

    /**
     * SELECT ... FOR UPDATE (트랜잭션 안에서만 호출)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM BusinessEntity b WHERE b.id = :id")
    Optional<BusinessEntity> findByIdForUpdate(@Param("id") Long id);
}
