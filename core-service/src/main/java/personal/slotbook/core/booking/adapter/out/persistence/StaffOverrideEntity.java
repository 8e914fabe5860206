package personal.slotbook.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.slotbook.core.booking.domain.model.StaffAvailabilityOverride;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Staff Availability Override JPA Entity
 */
@Entity
@Table(name = "staff_availability_overrides",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_staff_override_date",
                columnNames = {"staff_id", "override_date"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StaffOverrideEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "staff_id", nullable = false)
    private Long staffId;

    @Column(name = "override_date", nullable = false)
    private LocalDate overrideDate;

    @Column(name = "is_available", nullable = false)
    private boolean available;

    @Column(name = "start_time")
    private LocalTime startTime;

    @Column(name = "end_time")
    private LocalTime endTime;

    @Column(length = 255)
    private String reason;

    public static StaffOverrideEntity create(StaffAvailabilityOverride override) {
        StaffOverrideEntity entity = new StaffOverrideEntity();
        entity.staffId = override.staffId();
        entity.overrideDate = override.date();
        entity.update(override);
        return entity;
    }

    public void update(StaffAvailabilityOverride override) {
        this.available = override.available();
        this.startTime = override.window() == null ? null : override.window().startTime();
        this.endTime = override.window() == null ? null : override.window().endTime();
        this.reason = override.reason();
    }

    public StaffAvailabilityOverride toDomain() {
        TimeRange window = startTime == null || endTime == null ? null : new TimeRange(startTime, endTime);
        return new StaffAvailabilityOverride(staffId, overrideDate, available, window, reason);
    }
}
