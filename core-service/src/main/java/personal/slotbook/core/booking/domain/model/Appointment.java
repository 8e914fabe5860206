package personal.slotbook.core.booking.domain.model;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;
import personal.slotbook.core.booking.domain.exception.InvalidAppointmentStateException;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Appointment Domain Model
 * 예약 도메인 모델 (불변)
 */
public record Appointment(
        Long id,
        Long businessId,
        Long customerId,
        Long staffId,
        LocalDate date,
        TimeRange timeRange,
        AppointmentStatus status,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {

    public Appointment {
        if (businessId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Business ID cannot be null");
        }
        if (customerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer ID cannot be null");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Appointment date cannot be null");
        }
        if (timeRange == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Appointment time range cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Appointment status cannot be null");
        }
    }

    /**
     * 예약 생성 (SCHEDULED 상태)
     */
    public static Appointment create(Long businessId, Long customerId, Long staffId,
                                     LocalDate date, TimeRange timeRange) {
        LocalDateTime now = LocalDateTime.now();
        return new Appointment(null, businessId, customerId, staffId, date, timeRange,
                AppointmentStatus.SCHEDULED, now, now);
    }

    /**
     * 상태 전이. 허용되지 않는 전이는 InvalidAppointmentStateException
     */
    public Appointment transitionTo(AppointmentStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidAppointmentStateException(status, target);
        }
        return new Appointment(id, businessId, customerId, staffId, date, timeRange,
                target, createdAt, LocalDateTime.now());
    }

    public Appointment cancel() {
        return transitionTo(AppointmentStatus.CANCELLED);
    }

    /**
     * 일정 변경 (SCHEDULED, CONFIRMED 상태에서만 가능)
     */
    public Appointment reschedule(LocalDate newDate, TimeRange newTimeRange) {
        if (status != AppointmentStatus.SCHEDULED && status != AppointmentStatus.CONFIRMED) {
            throw new InvalidAppointmentStateException(status, "reschedule");
        }
        return new Appointment(id, businessId, customerId, staffId, newDate, newTimeRange,
                status, createdAt, LocalDateTime.now());
    }

    public boolean occupiesTime() {
        return status.occupiesTime();
    }

    public boolean competesWith(Long otherStaffId) {
        return StaffScope.sharesResource(staffId, otherStaffId);
    }
}
