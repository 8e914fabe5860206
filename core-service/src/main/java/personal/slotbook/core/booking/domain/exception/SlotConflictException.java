package personal.slotbook.core.booking.domain.exception;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;
import personal.slotbook.core.booking.domain.model.TimeRange;

import java.time.LocalDate;

/**
 * Slot Conflict Exception
 * 커밋 시점에 취소되지 않은 예약 또는 차단 시간과 겹치는 경우 발생
 * HTTP 409 Conflict 반환용 (재시도 시 다른 시간 선택)
 */
public class SlotConflictException extends BusinessException {
    public SlotConflictException(Long businessId, LocalDate date, TimeRange requested) {
        super(ErrorCode.SLOT_CONFLICT,
                String.format("Requested interval overlaps an existing commitment: businessId=%d, date=%s, interval=%s",
                        businessId, date, requested));
    }
}
