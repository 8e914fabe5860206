package personal.slotbook.core.booking.adapter.in.web.dto;

import personal.slotbook.core.booking.domain.model.BlockedPeriod;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;
import java.util.Locale;

/**
 * 차단 시간 응답 DTO
 */
public record BlockedPeriodResponse(
        Long blockedPeriodId,
        Long businessId,
        Long staffId,
        LocalDate date,
        String startTime,
        String endTime,
        String reason,
        String recurrence
) {
    public static BlockedPeriodResponse from(BlockedPeriod period) {
        return new BlockedPeriodResponse(
                period.id(),
                period.businessId(),
                period.staffId(),
                period.date(),
                TimeRange.format(period.timeRange().startTime()),
                TimeRange.format(period.timeRange().endTime()),
                period.reason(),
                period.recurrence() == null ? null : period.recurrence().name().toLowerCase(Locale.ROOT)
        );
    }
}
