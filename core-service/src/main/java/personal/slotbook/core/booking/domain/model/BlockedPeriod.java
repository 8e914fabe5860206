package personal.slotbook.core.booking.domain.model;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Blocked Period Domain Model
 * 업체(선택적으로 특정 직원)의 예약 불가 시간
 * recurrence가 있으면 date를 기준일로 하는 템플릿이며, 조회 시점에 전개됨
 */
public record BlockedPeriod(
        Long id,
        Long businessId,
        Long staffId,
        LocalDate date,
        TimeRange timeRange,
        String reason,
        RecurrencePattern recurrence,
        LocalDateTime createdAt) {

    public BlockedPeriod {
        if (businessId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Business ID cannot be null");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Blocked date cannot be null");
        }
        if (timeRange == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Blocked time range cannot be null");
        }
    }

    public static BlockedPeriod create(Long businessId, Long staffId, LocalDate date, TimeRange timeRange,
                                       String reason, RecurrencePattern recurrence) {
        return new BlockedPeriod(null, businessId, staffId, date, timeRange, reason, recurrence,
                LocalDateTime.now());
    }

    public boolean isRecurring() {
        return recurrence != null;
    }

    public boolean competesWith(Long otherStaffId) {
        return StaffScope.sharesResource(staffId, otherStaffId);
    }
}
