package personal.slotbook.core.booking.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.slotbook.core.booking.application.port.out.AppointmentEventPort;
import personal.slotbook.core.booking.application.port.out.AppointmentRepository;
import personal.slotbook.core.booking.application.port.out.BlockedPeriodRepository;
import personal.slotbook.core.booking.application.port.out.BusinessRepository;
import personal.slotbook.core.booking.domain.exception.BusinessNotFoundException;
import personal.slotbook.core.booking.domain.exception.InvalidAppointmentStateException;
import personal.slotbook.core.booking.domain.exception.SlotConflictException;
import personal.slotbook.core.booking.domain.model.Appointment;
import personal.slotbook.core.booking.domain.model.AppointmentEventType;
import personal.slotbook.core.booking.domain.model.AppointmentStatus;
import personal.slotbook.core.booking.domain.model.BlockedPeriod;
import personal.slotbook.core.booking.domain.model.RecurrencePattern;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConflictGuard 단위 테스트")
class ConflictGuardTest {

    private static final Long BUSINESS_ID = 1L;
    private static final LocalDate MONDAY = LocalDate.of(2025, 3, 3);

    @Mock
    private BusinessRepository businessRepository;
    @Mock
    private AppointmentRepository appointmentRepository;
    @Mock
    private BlockedPeriodRepository blockedPeriodRepository;
    @Mock
    private AppointmentEventPort appointmentEventPort;

    private ConflictGuard conflictGuard;

    @BeforeEach
    void setUp() {
        conflictGuard = new ConflictGuard(businessRepository, appointmentRepository, blockedPeriodRepository,
                new RecurrenceExpander(), appointmentEventPort);
    }

    private Appointment persisted(Long id, Long staffId, String start, String end, AppointmentStatus status) {
        LocalDateTime now = LocalDateTime.now();
        return new Appointment(id, BUSINESS_ID, 100L + id, staffId, MONDAY, TimeRange.of(start, end), status, now, now);
    }

    @Test
    @DisplayName("겹치는 예약이 없으면 저장 후 예약 이벤트 기록")
    void commitAppointment_Success() {
        // given
        Appointment candidate = Appointment.create(BUSINESS_ID, 100L, null, MONDAY, TimeRange.of("10:00", "11:00"));
        Appointment saved = persisted(1L, null, "10:00", "11:00", AppointmentStatus.SCHEDULED);
        given(businessRepository.lockForWrite(BUSINESS_ID)).willReturn(true);
        given(appointmentRepository.findActiveByBusinessIdAndDate(BUSINESS_ID, MONDAY))
                .willReturn(List.of(persisted(2L, null, "09:00", "10:00", AppointmentStatus.CONFIRMED)));
        given(appointmentRepository.save(candidate)).willReturn(saved);

        // when
        Appointment result = conflictGuard.commitAppointment(candidate);

        // then
        assertThat(result.id()).isEqualTo(1L);
        verify(appointmentEventPort).publishAppointmentEvent(saved, AppointmentEventType.APPOINTMENT_BOOKED);
    }

    @Test
    @DisplayName("겹치는 예약이 있으면 SlotConflictException, 아무것도 저장하지 않음")
    void commitAppointment_ConflictWithAppointment() {
        // given
        Appointment candidate = Appointment.create(BUSINESS_ID, 100L, null, MONDAY, TimeRange.of("10:30", "11:30"));
        given(businessRepository.lockForWrite(BUSINESS_ID)).willReturn(true);
        given(appointmentRepository.findActiveByBusinessIdAndDate(BUSINESS_ID, MONDAY))
                .willReturn(List.of(persisted(2L, null, "10:00", "11:00", AppointmentStatus.SCHEDULED)));

        // when & then
        assertThatThrownBy(() -> conflictGuard.commitAppointment(candidate))
                .isInstanceOf(SlotConflictException.class)
                .hasMessageContaining("[10:30,11:30)");
        verify(appointmentRepository, never()).save(any());
        verifyNoInteractions(appointmentEventPort);
    }

    @Test
    @DisplayName("반복 차단 시간이 적용되는 날짜면 충돌")
    void commitAppointment_ConflictWithRecurringBlock() {
        Appointment candidate = Appointment.create(BUSINESS_ID, 100L, null, MONDAY, TimeRange.of("12:00", "12:30"));
        BlockedPeriod weeklyLunch = new BlockedPeriod(5L, BUSINESS_ID, null, MONDAY.minusWeeks(2),
                TimeRange.of("12:00", "13:00"), "점심", RecurrencePattern.WEEKLY, LocalDateTime.now());
        given(businessRepository.lockForWrite(BUSINESS_ID)).willReturn(true);
        given(blockedPeriodRepository.findCandidatesOn(BUSINESS_ID, MONDAY)).willReturn(List.of(weeklyLunch));

        assertThatThrownBy(() -> conflictGuard.commitAppointment(candidate))
                .isInstanceOf(SlotConflictException.class);
        verify(appointmentRepository, never()).save(any());
    }

    @Test
    @DisplayName("취소된 예약과 다른 직원의 예약은 충돌하지 않음")
    void commitAppointment_IgnoresCancelledAndOtherStaff() {
        Appointment candidate = Appointment.create(BUSINESS_ID, 100L, 7L, MONDAY, TimeRange.of("10:00", "11:00"));
        given(businessRepository.lockForWrite(BUSINESS_ID)).willReturn(true);
        given(appointmentRepository.findActiveByBusinessIdAndDate(BUSINESS_ID, MONDAY)).willReturn(List.of(
                persisted(2L, null, "10:00", "11:00", AppointmentStatus.CANCELLED),
                persisted(3L, 8L, "10:00", "11:00", AppointmentStatus.SCHEDULED)));
        given(appointmentRepository.save(candidate)).willReturn(candidate);

        conflictGuard.commitAppointment(candidate);

        verify(appointmentRepository).save(candidate);
    }

    @Test
    @DisplayName("업체 잠금 실패(업체 없음) 시 BusinessNotFoundException")
    void commitAppointment_BusinessNotFound() {
        Appointment candidate = Appointment.create(BUSINESS_ID, 100L, null, MONDAY, TimeRange.of("10:00", "11:00"));
        given(businessRepository.lockForWrite(BUSINESS_ID)).willReturn(false);

        assertThatThrownBy(() -> conflictGuard.commitAppointment(candidate))
                .isInstanceOf(BusinessNotFoundException.class);
        verifyNoInteractions(appointmentRepository);
    }

    @Test
    @DisplayName("차단 시간도 기존 예약과 겹치면 거부")
    void commitBlockedPeriod_Conflict() {
        BlockedPeriod candidate = BlockedPeriod.create(BUSINESS_ID, null, MONDAY, TimeRange.of("10:00", "12:00"),
                "청소", null);
        given(businessRepository.lockForWrite(BUSINESS_ID)).willReturn(true);
        given(appointmentRepository.findActiveByBusinessIdAndDate(BUSINESS_ID, MONDAY))
                .willReturn(List.of(persisted(2L, 7L, "11:00", "12:00", AppointmentStatus.SCHEDULED)));

        assertThatThrownBy(() -> conflictGuard.commitBlockedPeriod(candidate))
                .isInstanceOf(SlotConflictException.class);
        verify(blockedPeriodRepository, never()).save(any());
    }

    @Test
    @DisplayName("일정 변경 시 자기 자신은 충돌 대상에서 제외")
    void commitReschedule_ExcludesSelf() {
        // given
        Appointment current = persisted(10L, null, "10:00", "11:00", AppointmentStatus.SCHEDULED);
        TimeRange newRange = TimeRange.of("10:30", "11:30");
        given(businessRepository.lockForWrite(BUSINESS_ID)).willReturn(true);
        given(appointmentRepository.findByIdForUpdate(10L)).willReturn(Optional.of(current));
        given(appointmentRepository.findActiveByBusinessIdAndDate(BUSINESS_ID, MONDAY)).willReturn(List.of(current));
        given(appointmentRepository.save(any(Appointment.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        Appointment result = conflictGuard.commitReschedule(10L, BUSINESS_ID, MONDAY, newRange);

        // then
        assertThat(result.timeRange()).isEqualTo(newRange);
        verify(appointmentEventPort).publishAppointmentEvent(result, AppointmentEventType.APPOINTMENT_RESCHEDULED);
    }

    @Test
    @DisplayName("진행 중인 예약은 일정 변경 불가")
    void commitReschedule_InvalidState() {
        Appointment inProgress = persisted(10L, null, "10:00", "11:00", AppointmentStatus.IN_PROGRESS);
        given(businessRepository.lockForWrite(BUSINESS_ID)).willReturn(true);
        given(appointmentRepository.findByIdForUpdate(10L)).willReturn(Optional.of(inProgress));

        assertThatThrownBy(() -> conflictGuard.commitReschedule(10L, BUSINESS_ID, MONDAY, TimeRange.of("14:00", "15:00")))
                .isInstanceOf(InvalidAppointmentStateException.class);
        verify(appointmentRepository, never()).save(any());
    }
}
