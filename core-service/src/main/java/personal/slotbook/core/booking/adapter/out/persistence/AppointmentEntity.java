package personal.slotbook.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.slotbook.core.booking.domain.model.Appointment;
import personal.slotbook.core.booking.domain.model.AppointmentStatus;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Appointment JPA Entity
 * 예약 테이블 매핑. (business_id, date), (staff_id, date) 인덱스로 충돌 검사 조회
 */
@Entity
@Table(name = "appointments",
        indexes = {
                @Index(name = "idx_appointment_business_date", columnList = "business_id, appointment_date"),
                @Index(name = "idx_appointment_staff_date", columnList = "staff_id, appointment_date")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AppointmentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "business_id", nullable = false)
    private Long businessId;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "staff_id")
    private Long staffId;

    @Column(name = "appointment_date", nullable = false)
    private LocalDate appointmentDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AppointmentStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static AppointmentEntity fromDomain(Appointment appointment) {
        AppointmentEntity entity = new AppointmentEntity();
        entity.id = appointment.id();
        entity.businessId = appointment.businessId();
        entity.customerId = appointment.customerId();
        entity.staffId = appointment.staffId();
        entity.appointmentDate = appointment.date();
        entity.startTime = appointment.timeRange().startTime();
        entity.endTime = appointment.timeRange().endTime();
        entity.status = appointment.status();
        entity.createdAt = appointment.createdAt();
        entity.updatedAt = appointment.updatedAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    /**
     * 도메인 모델로 변환
     */
    public Appointment toDomain() {
        return new Appointment(id, businessId, customerId, staffId, appointmentDate,
                new TimeRange(startTime, endTime), status, createdAt, updatedAt);
    }
}
