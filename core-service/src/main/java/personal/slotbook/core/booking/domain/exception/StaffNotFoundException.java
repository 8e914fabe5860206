package personal.slotbook.core.booking.domain.exception;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;

/**
 * Staff Not Found Exception
 * 직원이 없거나 해당 업체 소속이 아닌 경우
 */
public class StaffNotFoundException extends BusinessException {
    public StaffNotFoundException(Long staffId) {
        super(ErrorCode.STAFF_NOT_FOUND,
                String.format("Staff not found: staffId=%d", staffId));
    }
}
