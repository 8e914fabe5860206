package personal.slotbook.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.slotbook.core.booking.domain.model.SpecialDayHours;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Special Day Hours JPA Entity
 */
@Entity
@Table(name = "special_day_hours",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_business_special_date",
                columnNames = {"business_id", "special_date"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SpecialDayHoursEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "business_id", nullable = false)
    private Long businessId;

    @Column(name = "special_date", nullable = false)
    private LocalDate specialDate;

    @Column(name = "is_open", nullable = false)
    private boolean open;

    @Column(name = "open_time")
    private LocalTime openTime;

    @Column(name = "close_time")
    private LocalTime closeTime;

    @Column(length = 255)
    private String note;

    public static SpecialDayHoursEntity create(SpecialDayHours specialDay) {
        SpecialDayHoursEntity entity = new SpecialDayHoursEntity();
        entity.businessId = specialDay.businessId();
        entity.specialDate = specialDay.date();
        entity.update(specialDay);
        return entity;
    }

    public void update(SpecialDayHours specialDay) {
        this.open = specialDay.open();
        this.openTime = specialDay.openTime();
        this.closeTime = specialDay.closeTime();
        this.note = specialDay.note();
    }

    public SpecialDayHours toDomain() {
        return new SpecialDayHours(businessId, specialDate, open, openTime, closeTime, note);
    }
}
