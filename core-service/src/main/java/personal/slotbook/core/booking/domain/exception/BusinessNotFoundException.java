package personal.slotbook.core.booking.domain.exception;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;

/**
 * Business Not Found Exception
 */
public class BusinessNotFoundException extends BusinessException {
    public BusinessNotFoundException(Long businessId) {
        super(ErrorCode.BUSINESS_NOT_FOUND,
                String.format("Business not found: businessId=%d", businessId));
    }
}
