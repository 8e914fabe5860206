package personal.slotbook.core.booking.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.slotbook.core.booking.domain.model.AppointmentStatus;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Appointment
 */
public interface JpaAppointmentRepository extends JpaRepository<AppointmentEntity, Long> {

    /**
     * 업체 + 날짜의 예약 중 지정 상태를 제외한 목록 (시작 시각 순)
     */
    @Query("SELECT a FROM AppointmentEntity a " +
            "WHERE a.businessId = :businessId AND a.appointmentDate = :date AND a.status <> :excluded " +
            "ORDER BY a.startTime")
    List<AppointmentEntity> findByBusinessIdAndDateExcludingStatus(@Param("businessId") Long businessId,
                                                                    @Param("date") LocalDate date,
                                                                    @Param("excluded") AppointmentStatus excluded);

    @Query("SELECT a.businessId FROM AppointmentEntity a WHERE a.id = :id")
    Optional<Long> findBusinessIdById(@Param("id") Long id);

    /**
     * SELECT ... FOR UPDATE (트랜잭션 안에서만 호출)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AppointmentEntity a WHERE a.id = :id")
    Optional<AppointmentEntity> findByIdForUpdate(@Param("id") Long id);
}
