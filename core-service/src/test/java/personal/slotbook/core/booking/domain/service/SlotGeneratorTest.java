package personal.slotbook.core.booking.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.slotbook.core.booking.domain.exception.InvalidIntervalException;
import personal.slotbook.core.booking.domain.model.TimeRange;
import personal.slotbook.core.booking.domain.model.TimeSlot;

import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SlotGenerator 단위 테스트")
class SlotGeneratorTest {

    private static final LocalTime OPEN = LocalTime.of(9, 0);
    private static final LocalTime CLOSE = LocalTime.of(17, 0);

    private final SlotGenerator slotGenerator = new SlotGenerator();

    @Test
    @DisplayName("60분 서비스, 30분 간격이면 09:00부터 16:00까지 15개 슬롯")
    void generate_NoBreaks() {
        // when
        List<TimeSlot> slots = slotGenerator.generate(OPEN, CLOSE, List.of(), 60, 30);

        // then
        assertThat(slots).hasSize(15);
        assertThat(slots.get(0).startTime()).isEqualTo(LocalTime.of(9, 0));
        assertThat(slots.get(0).endTime()).isEqualTo(LocalTime.of(10, 0));
        assertThat(slots.get(14).startTime()).isEqualTo(LocalTime.of(16, 0));
        assertThat(slots.get(14).endTime()).isEqualTo(CLOSE);
        assertThat(slots).allMatch(TimeSlot::available);
    }

    @Test
    @DisplayName("휴게 시간과 겹치는 슬롯 제외")
    void generate_WithBreak() {
        // given
        List<TimeRange> breaks = List.of(TimeRange.of("12:00", "13:00"));

        // when
        List<TimeSlot> slots = slotGenerator.generate(OPEN, CLOSE, breaks, 60, 30);

        // then
        assertThat(slots).extracting(TimeSlot::startTime)
                .doesNotContain(LocalTime.of(11, 30), LocalTime.of(12, 0), LocalTime.of(12, 30))
                .contains(LocalTime.of(11, 0), LocalTime.of(13, 0));
        assertThat(slots).hasSize(12);
    }

    @Test
    @DisplayName("마감 시각을 넘는 부분 슬롯은 만들지 않음")
    void generate_NoPartialSlot() {
        List<TimeSlot> slots = slotGenerator.generate(OPEN, LocalTime.of(10, 15), List.of(), 45, 30);

        assertThat(slots).extracting(TimeSlot::startTime)
                .containsExactly(LocalTime.of(9, 0), LocalTime.of(9, 30));
    }

    @Test
    @DisplayName("영업 시간보다 긴 서비스는 슬롯 없음")
    void generate_DurationLongerThanDay() {
        assertThat(slotGenerator.generate(OPEN, CLOSE, List.of(), 600, 30)).isEmpty();
    }

    @Test
    @DisplayName("소요 시간 또는 간격이 0 이하면 예외")
    void generate_InvalidArguments() {
        assertThatThrownBy(() -> slotGenerator.generate(OPEN, CLOSE, List.of(), 0, 30))
                .isInstanceOf(InvalidIntervalException.class);
        assertThatThrownBy(() -> slotGenerator.generate(OPEN, CLOSE, List.of(), 60, 0))
                .isInstanceOf(InvalidIntervalException.class);
    }
}
