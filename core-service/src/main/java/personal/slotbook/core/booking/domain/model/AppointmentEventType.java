package personal.slotbook.core.booking.domain.model;

/**
 * 알림 디스패처로 전달되는 예약 이벤트 종류
 */
public enum AppointmentEventType {
    APPOINTMENT_BOOKED("appointment.booked"),
    APPOINTMENT_CANCELLED("appointment.cancelled"),
    APPOINTMENT_RESCHEDULED("appointment.rescheduled");

    private final String topic;

    AppointmentEventType(String topic) {
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }
}
