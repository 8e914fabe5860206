package personal.slotbook.common.exception;

/**
 * 에러 응답 포맷
 *
 * @param code    에러 코드 (예: B002)
 * @param message 사용자에게 노출할 메시지
 */
public record ErrorResponse(
        String code,
        String message
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(errorCode.getCode(), message);
    }
}
