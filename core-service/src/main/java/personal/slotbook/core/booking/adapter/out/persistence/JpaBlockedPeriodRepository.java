package personal.slotbook.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

/**
 * Spring Data JPA Repository for BlockedPeriod
 */
public interface JpaBlockedPeriodRepository extends JpaRepository<BlockedPeriodEntity, Long> {

    /**
     * 해당 날짜의 단건 차단 + 기준일이 해당 날짜 이전(포함)인 반복 템플릿
     */
    @Query("SELECT b FROM BlockedPeriodEntity b " +
            "WHERE b.businessId = :businessId " +
            "AND (b.blockedDate = :date OR (b.recurrence IS NOT NULL AND b.blockedDate <= :date)) " +
            "ORDER BY b.startTime")
    List<BlockedPeriodEntity> findCandidatesOn(@Param("businessId") Long businessId,
                                               @Param("date") LocalDate date);
}
