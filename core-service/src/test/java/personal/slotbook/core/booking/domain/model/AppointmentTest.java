package personal.slotbook.core.booking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import personal.slotbook.core.booking.domain.exception.InvalidAppointmentStateException;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Appointment 도메인 테스트")
class AppointmentTest {

    private static final LocalDate DATE = LocalDate.of(2025, 3, 3);

    private Appointment newAppointment() {
        return Appointment.create(1L, 100L, null, DATE, TimeRange.of("10:00", "11:00"));
    }

    @Test
    @DisplayName("생성 직후 SCHEDULED 상태")
    void create_Scheduled() {
        Appointment appointment = newAppointment();

        assertThat(appointment.status()).isEqualTo(AppointmentStatus.SCHEDULED);
        assertThat(appointment.occupiesTime()).isTrue();
    }

    @Test
    @DisplayName("확정 -> 진행 -> 완료")
    void transition_HappyPath() {
        Appointment completed = newAppointment()
                .transitionTo(AppointmentStatus.CONFIRMED)
                .transitionTo(AppointmentStatus.IN_PROGRESS)
                .transitionTo(AppointmentStatus.COMPLETED);

        assertThat(completed.status()).isEqualTo(AppointmentStatus.COMPLETED);
        assertThat(completed.occupiesTime()).isTrue();
    }

    @Test
    @DisplayName("취소된 예약은 시간을 점유하지 않음")
    void cancel_ReleasesTime() {
        Appointment cancelled = newAppointment().cancel();

        assertThat(cancelled.status()).isEqualTo(AppointmentStatus.CANCELLED);
        assertThat(cancelled.occupiesTime()).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = AppointmentStatus.class, names = {"COMPLETED", "CANCELLED", "NO_SHOW"})
    @DisplayName("종료 상태에서는 어떤 전이도 불가")
    void transition_FromTerminal(AppointmentStatus terminal) {
        assertThat(terminal.allowedTransitions()).isEmpty();
        assertThat(terminal.canTransitionTo(AppointmentStatus.CONFIRMED)).isFalse();
    }

    @Test
    @DisplayName("완료된 예약 취소 시 예외")
    void cancel_Completed() {
        Appointment completed = newAppointment()
                .transitionTo(AppointmentStatus.IN_PROGRESS)
                .transitionTo(AppointmentStatus.COMPLETED);

        assertThatThrownBy(completed::cancel)
                .isInstanceOf(InvalidAppointmentStateException.class);
    }

    @Test
    @DisplayName("일정 변경은 SCHEDULED/CONFIRMED 상태에서만 가능")
    void reschedule() {
        TimeRange newRange = TimeRange.of("14:00", "15:00");
        LocalDate newDate = DATE.plusDays(1);

        Appointment moved = newAppointment().transitionTo(AppointmentStatus.CONFIRMED).reschedule(newDate, newRange);
        assertThat(moved.date()).isEqualTo(newDate);
        assertThat(moved.timeRange()).isEqualTo(newRange);
        assertThat(moved.status()).isEqualTo(AppointmentStatus.CONFIRMED);

        Appointment started = newAppointment().transitionTo(AppointmentStatus.IN_PROGRESS);
        assertThatThrownBy(() -> started.reschedule(newDate, newRange))
                .isInstanceOf(InvalidAppointmentStateException.class);
    }

    @Test
    @DisplayName("직원 지정 예약은 같은 직원 또는 업체 전체와만 경쟁")
    void competesWith() {
        Appointment staffBound = Appointment.create(1L, 100L, 7L, DATE, TimeRange.of("10:00", "11:00"));

        assertThat(staffBound.competesWith(7L)).isTrue();
        assertThat(staffBound.competesWith(null)).isTrue();
        assertThat(staffBound.competesWith(8L)).isFalse();
        assertThat(newAppointment().competesWith(8L)).isTrue();
    }
}
