package personal.slotbook.core.booking.domain.exception;

import personal.slotbook.common.exception.BusinessException;
import personal.slotbook.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Business Closed Exception
 * 영업 시간이 없는 날짜에 예약을 시도한 경우
 */
public class BusinessClosedException extends BusinessException {
    public BusinessClosedException(Long businessId, LocalDate date) {
        super(ErrorCode.BUSINESS_CLOSED,
                String.format("Business is closed: businessId=%d, date=%s", businessId, date));
    }
}
