package personal.slotbook.core.booking.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Appointment Status
 * SCHEDULED/CONFIRMED -> IN_PROGRESS -> COMPLETED
 * 완료 전에는 언제든 CANCELLED 또는 NO_SHOW로 종료 가능
 */
public enum AppointmentStatus {
    SCHEDULED,
    CONFIRMED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    NO_SHOW;

    public Set<AppointmentStatus> allowedTransitions() {
        return switch (this) {
            case SCHEDULED -> EnumSet.of(CONFIRMED, IN_PROGRESS, CANCELLED, NO_SHOW);
            case CONFIRMED -> EnumSet.of(IN_PROGRESS, CANCELLED, NO_SHOW);
            case IN_PROGRESS -> EnumSet.of(COMPLETED, CANCELLED, NO_SHOW);
            case COMPLETED, CANCELLED, NO_SHOW -> EnumSet.noneOf(AppointmentStatus.class);
        };
    }

    public boolean canTransitionTo(AppointmentStatus target) {
        return allowedTransitions().contains(target);
    }

    /**
     * 충돌 계산 참여 여부. CANCELLED만 시간을 점유하지 않음
     */
    public boolean occupiesTime() {
        return this != CANCELLED;
    }
}
