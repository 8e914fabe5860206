package personal.slotbook.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 전역 예외 처리 핸들러
 * BusinessException은 ErrorCode의 HTTP Status로, 그 외 예외는 500으로 변환
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

        @ExceptionHandler(BusinessException.class)
        public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
                ErrorCode errorCode = e.getErrorCode();
                if (errorCode.getHttpStatus().is5xxServerError()) {
                        log.error("Business exception occurred: code={}, detail={}",
                                        errorCode.getCode(), e.getMessage(), e);
                } else {
                        log.warn("Business exception occurred: code={}, message={}, detail={}",
                                        errorCode.getCode(), errorCode.getMessage(), e.getMessage());
                }

                ErrorResponse response = ErrorResponse.of(errorCode, errorCode.getMessage());
                return ResponseEntity
                                .status(errorCode.getHttpStatus())
                                .body(response);
        }

        @ExceptionHandler(org.springframework.web.servlet.resource.NoResourceFoundException.class)
        public ResponseEntity<ErrorResponse> handleNoResourceFoundException(
                        org.springframework.web.servlet.resource.NoResourceFoundException e) {
                log.warn("Resource not found: {}", e.getResourcePath());

                ErrorResponse response = ErrorResponse.of(
                                ErrorCode.NOT_FOUND,
                                "요청한 URL을 찾을 수 없습니다: " + e.getResourcePath());
                return ResponseEntity
                                .status(ErrorCode.NOT_FOUND.getHttpStatus())
                                .body(response);
        }

        @ExceptionHandler(org.springframework.web.bind.MethodArgumentNotValidException.class)
        public ResponseEntity<ErrorResponse> handleMethodArgumentNotValidException(
                        org.springframework.web.bind.MethodArgumentNotValidException e) {
                log.warn("Validation failed: {}", e.getMessage());
                String message = "입력값이 유효하지 않습니다.";
                if (!e.getBindingResult().getAllErrors().isEmpty()) {
                        message = e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
                }
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT, message);
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(org.springframework.web.method.annotation.HandlerMethodValidationException.class)
        public ResponseEntity<ErrorResponse> handleHandlerMethodValidationException(
                        org.springframework.web.method.annotation.HandlerMethodValidationException e) {
                log.warn("Parameter validation failed: {}", e.getMessage());
                String message = "입력값이 유효하지 않습니다.";
                if (!e.getAllErrors().isEmpty()) {
                        message = e.getAllErrors().get(0).getDefaultMessage();
                }
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT, message);
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(org.springframework.web.method.annotation.MethodArgumentTypeMismatchException.class)
        public ResponseEntity<ErrorResponse> handleMethodArgumentTypeMismatchException(
                        org.springframework.web.method.annotation.MethodArgumentTypeMismatchException e) {
                log.warn("Type mismatch: parameter={}, value={}", e.getName(), e.getValue());
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT,
                                "파라미터 형식이 올바르지 않습니다: " + e.getName());
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(org.springframework.web.bind.MissingServletRequestParameterException.class)
        public ResponseEntity<ErrorResponse> handleMissingServletRequestParameterException(
                        org.springframework.web.bind.MissingServletRequestParameterException e) {
                log.warn("Missing parameter: {}", e.getParameterName());
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT,
                                "필수 파라미터가 누락되었습니다: " + e.getParameterName());
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(org.springframework.web.bind.MissingRequestHeaderException.class)
        public ResponseEntity<ErrorResponse> handleMissingRequestHeaderException(
                        org.springframework.web.bind.MissingRequestHeaderException e) {
                log.warn("Missing header: {}", e.getHeaderName());
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT,
                                "필수 헤더가 누락되었습니다: " + e.getHeaderName());
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(org.springframework.http.converter.HttpMessageNotReadableException.class)
        public ResponseEntity<ErrorResponse> handleHttpMessageNotReadableException(
                        org.springframework.http.converter.HttpMessageNotReadableException e) {
                log.warn("Unreadable request body: {}", e.getMessage());
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT, "요청 본문 형식이 올바르지 않습니다.");
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(Exception.class)
        public ResponseEntity<ErrorResponse> handleException(Exception e) {
                log.error("Unexpected exception occurred", e);

                ErrorResponse response = ErrorResponse.of(
                                ErrorCode.INTERNAL_SERVER_ERROR,
                                ErrorCode.INTERNAL_SERVER_ERROR.getMessage());
                return ResponseEntity
                                .status(ErrorCode.INTERNAL_SERVER_ERROR.getHttpStatus())
                                .body(response);
        }
}
