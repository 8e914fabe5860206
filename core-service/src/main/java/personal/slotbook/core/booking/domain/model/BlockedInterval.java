package personal.slotbook.core.booking.domain.model;

/**
 * 특정 날짜에 적용되는 차단 구간 (반복 템플릿 전개 결과 포함)
 */
public record BlockedInterval(
        Long blockedPeriodId,
        TimeRange timeRange,
        String reason) {

    public static BlockedInterval from(BlockedPeriod period) {
        return new BlockedInterval(period.id(), period.timeRange(), period.reason());
    }
}
