package personal.slotbook.core.booking.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.slotbook.core.booking.application.port.out.AppointmentEventPort;
import personal.slotbook.core.booking.application.port.out.AppointmentRepository;
import personal.slotbook.core.booking.application.port.out.BusinessRepository;
import personal.slotbook.core.booking.domain.exception.AppointmentNotFoundException;
import personal.slotbook.core.booking.domain.exception.InvalidAppointmentStateException;
import personal.slotbook.core.booking.domain.model.Appointment;
import personal.slotbook.core.booking.domain.model.AppointmentEventType;
import personal.slotbook.core.booking.domain.model.AppointmentStatus;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("AppointmentManager 단위 테스트")
class AppointmentManagerTest {

    @Mock
    private BusinessRepository businessRepository;
    @Mock
    private AppointmentRepository appointmentRepository;
    @Mock
    private AppointmentEventPort appointmentEventPort;

    @InjectMocks
    private AppointmentManager appointmentManager;

    private Appointment scheduled() {
        LocalDateTime now = LocalDateTime.now();
        return new Appointment(10L, 1L, 100L, null, LocalDate.of(2025, 3, 3), TimeRange.of("10:00", "11:00"),
                AppointmentStatus.SCHEDULED, now, now);
    }

    @Test
    @DisplayName("취소 시 업체 잠금 후 저장하고 취소 이벤트 기록")
    void transition_Cancel() {
        // given
        given(appointmentRepository.findBusinessIdById(10L)).willReturn(Optional.of(1L));
        given(businessRepository.lockForWrite(1L)).willReturn(true);
        given(appointmentRepository.findByIdForUpdate(10L)).willReturn(Optional.of(scheduled()));
        given(appointmentRepository.save(any(Appointment.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        Appointment cancelled = appointmentManager.transition(10L, AppointmentStatus.CANCELLED);

        // then
        assertThat(cancelled.status()).isEqualTo(AppointmentStatus.CANCELLED);
        verify(appointmentEventPort).publishAppointmentEvent(cancelled, AppointmentEventType.APPOINTMENT_CANCELLED);
    }

    @Test
    @DisplayName("취소가 아닌 상태 변경은 이벤트를 기록하지 않음")
    void transition_Confirm() {
        given(appointmentRepository.findBusinessIdById(10L)).willReturn(Optional.of(1L));
        given(businessRepository.lockForWrite(1L)).willReturn(true);
        given(appointmentRepository.findByIdForUpdate(10L)).willReturn(Optional.of(scheduled()));
        given(appointmentRepository.save(any(Appointment.class))).willAnswer(invocation -> invocation.getArgument(0));

        Appointment confirmed = appointmentManager.transition(10L, AppointmentStatus.CONFIRMED);

        assertThat(confirmed.status()).isEqualTo(AppointmentStatus.CONFIRMED);
        verifyNoInteractions(appointmentEventPort);
    }

    @Test
    @DisplayName("허용되지 않는 전이는 저장하지 않음")
    void transition_Invalid() {
        given(appointmentRepository.findBusinessIdById(10L)).willReturn(Optional.of(1L));
        given(businessRepository.lockForWrite(1L)).willReturn(true);
        given(appointmentRepository.findByIdForUpdate(10L)).willReturn(Optional.of(scheduled()));

        assertThatThrownBy(() -> appointmentManager.transition(10L, AppointmentStatus.COMPLETED))
                .isInstanceOf(InvalidAppointmentStateException.class);
        verify(appointmentRepository, never()).save(any());
    }

    @Test
    @DisplayName("존재하지 않는 예약")
    void transition_NotFound() {
        given(appointmentRepository.findBusinessIdById(99L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> appointmentManager.transition(99L, AppointmentStatus.CANCELLED))
                .isInstanceOf(AppointmentNotFoundException.class);
        verifyNoInteractions(businessRepository);
    }

    @Test
    @DisplayName("업체 잠금을 먼저 잡은 뒤 예약 행을 잠금 조회")
    void transition_LocksBusinessBeforeReadingAppointment() {
        // given
        given(appointmentRepository.findBusinessIdById(10L)).willReturn(Optional.of(1L));
        given(businessRepository.lockForWrite(1L)).willReturn(true);
        given(appointmentRepository.findByIdForUpdate(10L)).willReturn(Optional.of(scheduled()));
        given(appointmentRepository.save(any(Appointment.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        appointmentManager.transition(10L, AppointmentStatus.CONFIRMED);

        // then
        InOrder inOrder = inOrder(appointmentRepository, businessRepository);
        inOrder.verify(appointmentRepository).findBusinessIdById(10L);
        inOrder.verify(businessRepository).lockForWrite(1L);
        inOrder.verify(appointmentRepository).findByIdForUpdate(10L);
        inOrder.verify(appointmentRepository).save(any(Appointment.class));
        verify(appointmentRepository, never()).findById(any());
    }
}
