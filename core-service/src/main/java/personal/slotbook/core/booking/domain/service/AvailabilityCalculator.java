package personal.slotbook.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.slotbook.core.booking.domain.model.Appointment;
import personal.slotbook.core.booking.domain.model.BlockedInterval;
import personal.slotbook.core.booking.domain.model.BlockedPeriod;
import personal.slotbook.core.booking.domain.model.DailyHours;
import personal.slotbook.core.booking.domain.model.DayAvailability;
import personal.slotbook.core.booking.domain.model.SpecialDayHours;
import personal.slotbook.core.booking.domain.model.StaffAvailabilityOverride;
import personal.slotbook.core.booking.domain.model.TimeRange;
import personal.slotbook.core.booking.domain.model.TimeSlot;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Availability Calculator
 * 영업 시간, 휴게 시간, 차단 시간, 예약, 직원 근무 예외를 합쳐 하루 단위 예약 가능 여부를 계산
 * 저장소에 접근하지 않는 순수 계산 (입력 조회와 캐시는 AvailabilityResolver 담당)
 */
@Component
@RequiredArgsConstructor
public class AvailabilityCalculator {

    private final SlotGenerator slotGenerator;
    private final RecurrenceExpander recurrenceExpander;

    /**
     * 날짜의 실제 영업 시간
     * 특별 영업일이 주간 영업 시간보다 우선하며, 특별 영업일에 비어 있는 시각은 주간 값으로 채움
     * 주간 휴게 시간은 특별 영업일의 영업 창에 맞게 잘라서 유지
     *
     * @return 영업 시간 (휴무면 Optional.empty())
     */
    public Optional<DailyHours> effectiveHours(LocalDate date,
                                               Optional<DailyHours> weekly,
                                               Optional<SpecialDayHours> specialDay) {
        if (specialDay.isEmpty()) {
            return weekly.filter(DailyHours::open);
        }

        SpecialDayHours special = specialDay.get();
        if (!special.open()) {
            return Optional.empty();
        }

        Optional<DailyHours> openWeekly = weekly.filter(DailyHours::open);
        LocalTime openTime = special.openTime() != null
                ? special.openTime()
                : openWeekly.map(DailyHours::openTime).orElse(null);
        LocalTime closeTime = special.closeTime() != null
                ? special.closeTime()
                : openWeekly.map(DailyHours::closeTime).orElse(null);
        if (openTime == null || closeTime == null || !openTime.isBefore(closeTime)) {
            return Optional.empty();
        }

        TimeRange window = new TimeRange(openTime, closeTime);
        List<TimeRange> breaks = openWeekly.map(DailyHours::breaks).orElse(List.of()).stream()
                .map(window::intersection)
                .flatMap(Optional::stream)
                .toList();
        return Optional.of(DailyHours.open(date.getDayOfWeek(), openTime, closeTime, breaks));
    }

    /**
     * @param hours        실제 영업 시간 (휴무면 empty)
     * @param candidates   날짜에 적용될 수 있는 차단 시간 (단건 + 반복 템플릿)
     * @param appointments 날짜의 예약 목록 (취소 건은 무시)
     * @param override     직원 근무 예외 (staffId가 있을 때만 적용)
     * @param staffId      직원 범위 조회 시 직원 ID, 업체 전체 조회면 null
     */
    public DayAvailability calculate(LocalDate date,
                                     Optional<DailyHours> hours,
                                     List<BlockedPeriod> candidates,
                                     List<Appointment> appointments,
                                     Optional<StaffAvailabilityOverride> override,
                                     Long staffId,
                                     int durationMinutes,
                                     int stepMinutes) {
        if (hours.isEmpty() || !hours.get().open()) {
            return DayAvailability.closed(date);
        }
        DailyHours day = hours.get();

        List<BlockedInterval> blocked = candidates.stream()
                .filter(period -> period.competesWith(staffId))
                .filter(period -> recurrenceExpander.occursOn(period, date))
                .map(BlockedInterval::from)
                .sorted(Comparator.comparing(interval -> interval.timeRange().startTime()))
                .toList();

        List<TimeRange> booked = appointments.stream()
                .filter(Appointment::occupiesTime)
                .filter(appointment -> appointment.date().equals(date))
                .filter(appointment -> appointment.competesWith(staffId))
                .map(Appointment::timeRange)
                .toList();

        Optional<StaffAvailabilityOverride> staffOverride = staffId == null ? Optional.empty() : override;

        List<TimeSlot> slots = slotGenerator
                .generate(day.openTime(), day.closeTime(), day.breaks(), durationMinutes, stepMinutes)
                .stream()
                .map(slot -> {
                    TimeRange range = slot.timeRange();
                    boolean available = blocked.stream().noneMatch(b -> b.timeRange().overlaps(range))
                            && booked.stream().noneMatch(range::overlaps)
                            && staffOverride.map(o -> o.permits(range)).orElse(true);
                    return slot.withAvailability(available, staffId);
                })
                .toList();

        return new DayAvailability(date, true, day.openTime(), day.closeTime(), slots, blocked);
    }
}
