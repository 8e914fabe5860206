package personal.slotbook.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.slotbook.core.booking.domain.model.DailyHours;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Operating Hours JPA Entity
 * 업체 + 요일당 한 행
 */
@Entity
@Table(name = "operating_hours",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_business_day",
                columnNames = {"business_id", "day_of_week"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OperatingHoursEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "business_id", nullable = false)
    private Long businessId;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false, length = 10)
    private DayOfWeek dayOfWeek;

    @Column(name = "is_open", nullable = false)
    private boolean open;

    @Column(name = "open_time")
    private LocalTime openTime;

    @Column(name = "close_time")
    private LocalTime closeTime;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "operating_hour_breaks",
            joinColumns = @JoinColumn(name = "operating_hours_id"))
    private List<BreakTimeEmbeddable> breaks = new ArrayList<>();

    public static OperatingHoursEntity create(Long businessId, DailyHours hours) {
        OperatingHoursEntity entity = new OperatingHoursEntity();
        entity.businessId = businessId;
        entity.dayOfWeek = hours.dayOfWeek();
        entity.update(hours);
        return entity;
    }

    /**
     * 영업 시간 갱신 (영속성 컨텍스트 내에서 사용)
     */
    public void update(DailyHours hours) {
        this.open = hours.open();
        this.openTime = hours.openTime();
        this.closeTime = hours.closeTime();
        this.breaks.clear();
        hours.breaks().stream()
                .map(BreakTimeEmbeddable::fromDomain)
                .forEach(this.breaks::add);
    }

    public DailyHours toDomain() {
        return new DailyHours(dayOfWeek, open, openTime, closeTime,
                breaks.stream().map(BreakTimeEmbeddable::toDomain).toList());
    }
}
