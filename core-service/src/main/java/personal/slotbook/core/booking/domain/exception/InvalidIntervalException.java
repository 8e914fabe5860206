package personal.slotbook.core.booking.domain.exception;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;

/**
 * Invalid Interval Exception
 * 시작 시각이 종료 시각보다 늦거나 같을 때, 또는 하루 범위를 벗어날 때 발생
 * 저장소 접근 전에 검출됨 (HTTP 400)
 */
public class InvalidIntervalException extends BusinessException {
    public InvalidIntervalException(String detail) {
        super(ErrorCode.INVALID_INTERVAL, detail);
    }
}
