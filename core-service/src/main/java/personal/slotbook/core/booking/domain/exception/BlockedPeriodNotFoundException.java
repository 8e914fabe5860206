package personal.slotbook.core.booking.domain.exception;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;

/**
 * Blocked Period Not Found Exception
 */
public class BlockedPeriodNotFoundException extends BusinessException {
    public BlockedPeriodNotFoundException(Long blockedPeriodId) {
        super(ErrorCode.BLOCKED_PERIOD_NOT_FOUND,
                String.format("Blocked period not found: blockedPeriodId=%d", blockedPeriodId));
    }
}
