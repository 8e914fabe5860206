package personal.slotbook.core.booking.domain.service;

import org.springframework.stereotype.Component;
import personal.slotbook.core.booking.domain.model.BlockedPeriod;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

/**
 * Recurrence Expander
 * 반복 차단 템플릿을 조회 범위 [rangeStart, rangeEnd] 안의 실제 날짜 목록으로 전개
 * 기준일(template.date) 이전 날짜는 생성하지 않으며 종료일은 없음
 */
@Component
public class RecurrenceExpander {

    /**
     * @param template   차단 시간 (반복 여부 무관)
     * @param rangeStart 조회 시작일 (포함)
     * @param rangeEnd   조회 종료일 (포함)
     * @return 오름차순 날짜 목록
     */
    public List<LocalDate> expand(BlockedPeriod template, LocalDate rangeStart, LocalDate rangeEnd) {
        LocalDate anchor = template.date();
        LocalDate from = rangeStart.isBefore(anchor) ? anchor : rangeStart;
        if (from.isAfter(rangeEnd)) {
            return List.of();
        }
        if (!template.isRecurring()) {
            return List.of(anchor);
        }

        List<LocalDate> dates = new ArrayList<>();
        switch (template.recurrence()) {
            case DAILY -> {
                for (LocalDate d = from; !d.isAfter(rangeEnd); d = d.plusDays(1)) {
                    dates.add(d);
                }
            }
            case WEEKLY -> {
                LocalDate first = from.with(TemporalAdjusters.nextOrSame(anchor.getDayOfWeek()));
                for (LocalDate d = first; !d.isAfter(rangeEnd); d = d.plusWeeks(1)) {
                    dates.add(d);
                }
            }
            case MONTHLY -> {
                int dayOfMonth = anchor.getDayOfMonth();
                YearMonth last = YearMonth.from(rangeEnd);
                for (YearMonth month = YearMonth.from(from); !month.isAfter(last); month = month.plusMonths(1)) {
                    // 31일 기준 템플릿은 30일까지 있는 달을 건너뜀
                    if (!month.isValidDay(dayOfMonth)) {
                        continue;
                    }
                    LocalDate d = month.atDay(dayOfMonth);
                    if (!d.isBefore(from) && !d.isAfter(rangeEnd)) {
                        dates.add(d);
                    }
                }
            }
        }
        return dates;
    }

    /**
     * 단일 날짜에 템플릿이 적용되는지 여부
     */
    public boolean occursOn(BlockedPeriod template, LocalDate date) {
        LocalDate anchor = template.date();
        if (date.isBefore(anchor)) {
            return false;
        }
        if (!template.isRecurring()) {
            return date.equals(anchor);
        }
        return switch (template.recurrence()) {
            case DAILY -> true;
            case WEEKLY -> ChronoUnit.DAYS.between(anchor, date) % 7 == 0;
            case MONTHLY -> date.getDayOfMonth() == anchor.getDayOfMonth();
        };
    }
}
