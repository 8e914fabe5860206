package personal.slotbook.core.booking.domain.exception;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;

/**
 * Store Unavailable Exception
 * 저장소 통신/트랜잭션 실패. 충돌(SlotConflictException)과 구분되는 재시도 가능한 일시 장애 (HTTP 503)
 */
public class StoreUnavailableException extends BusinessException {
    public StoreUnavailableException(String operation, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE,
                String.format("Store unavailable during %s: %s", operation, cause.getMessage()),
                cause);
    }
}
