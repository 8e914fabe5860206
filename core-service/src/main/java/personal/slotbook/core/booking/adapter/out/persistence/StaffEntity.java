package personal.slotbook.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.slotbook.core.booking.domain.model.Staff;

/**
 * Staff JPA Entity
 */
@Entity
@Table(name = "staff",
        indexes = @Index(name = "idx_staff_business", columnList = "business_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StaffEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "business_id", nullable = false)
    private Long businessId;

    @Column(nullable = false, length = 100)
    private String name;

    public static StaffEntity create(Long businessId, String name) {
        StaffEntity entity = new StaffEntity();
        entity.businessId = businessId;
        entity.name = name;
        return entity;
    }

    public Staff toDomain() {
        return new Staff(id, businessId, name);
    }
}
