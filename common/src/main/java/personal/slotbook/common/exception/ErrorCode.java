package personal.slotbook.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (1xxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "C002", "인증이 필요합니다."),
    FORBIDDEN(HttpStatus.FORBIDDEN, "C003", "권한이 없습니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C005", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // Business / Schedule (2xxx)
    BUSINESS_NOT_FOUND(HttpStatus.NOT_FOUND, "S001", "업체를 찾을 수 없습니다."),
    STAFF_NOT_FOUND(HttpStatus.NOT_FOUND, "S002", "직원을 찾을 수 없습니다."),
    BUSINESS_CLOSED(HttpStatus.UNPROCESSABLE_ENTITY, "S003", "영업하지 않는 날짜입니다."),
    INVALID_SCHEDULE(HttpStatus.BAD_REQUEST, "S004", "영업 시간 설정이 올바르지 않습니다."),

    // Booking (3xxx)
    INVALID_INTERVAL(HttpStatus.BAD_REQUEST, "B001", "시간 구간이 올바르지 않습니다."),
    SLOT_CONFLICT(HttpStatus.CONFLICT, "B002", "이미 예약되었거나 차단된 시간입니다. 다른 시간을 선택해 주세요."),
    APPOINTMENT_NOT_FOUND(HttpStatus.NOT_FOUND, "B003", "예약을 찾을 수 없습니다."),
    BLOCKED_PERIOD_NOT_FOUND(HttpStatus.NOT_FOUND, "B004", "차단 시간을 찾을 수 없습니다."),
    INVALID_APPOINTMENT_STATE(HttpStatus.CONFLICT, "B005", "현재 예약 상태에서는 처리할 수 없습니다."),

    // Infrastructure (9xxx)
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "E001", "저장소를 일시적으로 사용할 수 없습니다. 잠시 후 다시 시도해 주세요.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
