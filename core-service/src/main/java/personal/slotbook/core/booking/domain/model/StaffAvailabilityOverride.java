package personal.slotbook.core.booking.domain.model;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * 직원의 날짜별 근무 예외
 * 해당 날짜에 기록이 없으면 직원은 업체 영업 시간을 따름
 *
 * @param window 근무 가능 구간. available이고 window가 있으면 이 구간 안의 슬롯만 허용
 */
public record StaffAvailabilityOverride(
        Long staffId,
        LocalDate date,
        boolean available,
        TimeRange window,
        String reason) {

    public StaffAvailabilityOverride {
        if (staffId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Staff ID cannot be null");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Override date cannot be null");
        }
    }

    public boolean permits(TimeRange slot) {
        if (!available) {
            return false;
        }
        return window == null || window.contains(slot);
    }
}
