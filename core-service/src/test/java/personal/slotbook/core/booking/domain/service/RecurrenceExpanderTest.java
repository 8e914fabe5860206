package personal.slotbook.core.booking.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.slotbook.core.booking.domain.model.BlockedPeriod;
import personal.slotbook.core.booking.domain.model.RecurrencePattern;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RecurrenceExpander 단위 테스트")
class RecurrenceExpanderTest {

    private final RecurrenceExpander expander = new RecurrenceExpander();

    private BlockedPeriod template(LocalDate anchor, RecurrencePattern recurrence) {
        return BlockedPeriod.create(1L, null, anchor, TimeRange.of("12:00", "13:00"), "점심", recurrence);
    }

    @Test
    @DisplayName("매주 반복은 기준일과 같은 요일만 생성")
    void expand_Weekly() {
        // given
        LocalDate monday = LocalDate.of(2025, 3, 3);
        BlockedPeriod weekly = template(monday, RecurrencePattern.WEEKLY);

        // when
        List<LocalDate> dates = expander.expand(weekly, LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 31));

        // then
        assertThat(dates).containsExactly(
                LocalDate.of(2025, 3, 3), LocalDate.of(2025, 3, 10), LocalDate.of(2025, 3, 17),
                LocalDate.of(2025, 3, 24), LocalDate.of(2025, 3, 31));
        assertThat(dates).allMatch(d -> d.getDayOfWeek() == DayOfWeek.MONDAY);
    }

    @Test
    @DisplayName("매월 반복은 해당 일자가 없는 달을 건너뜀")
    void expand_MonthlySkipsShortMonths() {
        BlockedPeriod monthly = template(LocalDate.of(2025, 1, 31), RecurrencePattern.MONTHLY);

        List<LocalDate> dates = expander.expand(monthly, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 6, 30));

        assertThat(dates).containsExactly(
                LocalDate.of(2025, 1, 31), LocalDate.of(2025, 3, 31), LocalDate.of(2025, 5, 31));
    }

    @Test
    @DisplayName("기준일 이전 날짜는 생성하지 않음")
    void expand_NotBeforeAnchor() {
        BlockedPeriod daily = template(LocalDate.of(2025, 3, 5), RecurrencePattern.DAILY);

        List<LocalDate> dates = expander.expand(daily, LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 7));

        assertThat(dates).containsExactly(
                LocalDate.of(2025, 3, 5), LocalDate.of(2025, 3, 6), LocalDate.of(2025, 3, 7));
    }

    @Test
    @DisplayName("반복 없는 차단은 기준일 하나만")
    void expand_NonRecurring() {
        LocalDate anchor = LocalDate.of(2025, 3, 5);
        BlockedPeriod single = template(anchor, null);

        assertThat(expander.expand(single, LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 31)))
                .containsExactly(anchor);
        assertThat(expander.expand(single, LocalDate.of(2025, 3, 6), LocalDate.of(2025, 3, 31)))
                .isEmpty();
    }

    @Test
    @DisplayName("단일 날짜 적용 여부는 전개 결과와 일치")
    void occursOn_MatchesExpand() {
        BlockedPeriod weekly = template(LocalDate.of(2025, 3, 3), RecurrencePattern.WEEKLY);
        BlockedPeriod monthly = template(LocalDate.of(2025, 1, 31), RecurrencePattern.MONTHLY);

        assertThat(expander.occursOn(weekly, LocalDate.of(2025, 3, 17))).isTrue();
        assertThat(expander.occursOn(weekly, LocalDate.of(2025, 3, 18))).isFalse();
        assertThat(expander.occursOn(weekly, LocalDate.of(2025, 2, 24))).isFalse();
        assertThat(expander.occursOn(monthly, LocalDate.of(2025, 3, 31))).isTrue();
        assertThat(expander.occursOn(monthly, LocalDate.of(2025, 4, 30))).isFalse();
    }
}
