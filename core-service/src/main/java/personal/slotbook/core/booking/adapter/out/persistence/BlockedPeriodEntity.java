package personal.slotbook.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.slotbook.core.booking.domain.model.BlockedPeriod;
import personal.slotbook.core.booking.domain.model.RecurrencePattern;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Blocked Period JPA Entity
 * 반복 템플릿은 기준일(blocked_date)과 recurrence로 한 행에 저장
 */
@Entity
@Table(name = "blocked_periods",
        indexes = {
                @Index(name = "idx_blocked_business_date", columnList = "business_id, blocked_date"),
                @Index(name = "idx_blocked_staff_date", columnList = "staff_id, blocked_date")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BlockedPeriodEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "business_id", nullable = false)
    private Long businessId;

    @Column(name = "staff_id")
    private Long staffId;

    @Column(name = "blocked_date", nullable = false)
    private LocalDate blockedDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(length = 255)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private RecurrencePattern recurrence; // null이면 단건

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static BlockedPeriodEntity fromDomain(BlockedPeriod period) {
        BlockedPeriodEntity entity = new BlockedPeriodEntity();
        entity.id = period.id();
        entity.businessId = period.businessId();
        entity.staffId = period.staffId();
        entity.blockedDate = period.date();
        entity.startTime = period.timeRange().startTime();
        entity.endTime = period.timeRange().endTime();
        entity.reason = period.reason();
        entity.recurrence = period.recurrence();
        entity.createdAt = period.createdAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public BlockedPeriod toDomain() {
        return new BlockedPeriod(id, businessId, staffId, blockedDate,
                new TimeRange(startTime, endTime), reason, recurrence, createdAt);
    }
}
