package personal.slotbook.core.booking.domain.exception;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;

/**
 * Invalid Schedule Exception
 * 영업 시간/휴게 시간 불변식 위반 (open < close, 휴게 시간은 영업 시간 내, 상호 비중첩)
 */
public class InvalidScheduleException extends BusinessException {
    public InvalidScheduleException(String detail) {
        super(ErrorCode.INVALID_SCHEDULE, detail);
    }
}
