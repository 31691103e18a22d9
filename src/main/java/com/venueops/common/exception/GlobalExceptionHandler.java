package com.venueops.common.exception;

import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * 전역 예외 처리기 (Global Exception Handler)
 *
 * <p>모든 실패를 RFC 7807 ProblemDetail 형식으로 통일한다.
 * {@code type} URI의 마지막 세그먼트가 ErrorCode 이름(소문자)이므로
 * 클라이언트는 이 값으로 분기할 수 있다.</p>
 *
 * <pre>
 *   {
 *     "type": "https://venue-ops.io/errors/invalid_transition",
 *     "status": 409,
 *     "detail": "Order 7f3c... is READY; expected SERVING",
 *     "code": "INVALID_TRANSITION"
 *   }
 * </pre>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String ERROR_TYPE_BASE = "https://venue-ops.io/errors/";

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getStatus().is5xxServerError()) {
            log.error("Business failure: code={}, message={}", errorCode, e.getMessage(), e);
        } else {
            log.debug("Business rejection: code={}, message={}", errorCode, e.getMessage());
        }
        return problem(errorCode, e.getMessage());
    }

    /** Bean Validation 실패 → INVALID_INPUT (필드별 메시지 포함) */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .map(field -> field + " " + e.getBindingResult().getFieldError(field).getDefaultMessage())
                .collect(Collectors.joining(", "));
        return problem(ErrorCode.INVALID_INPUT, detail.isEmpty() ? ErrorCode.INVALID_INPUT.getMessage() : detail);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingRequestHeaderException.class})
    public ResponseEntity<ProblemDetail> handleUnreadable(Exception e) {
        log.debug("Malformed request: {}", e.getMessage());
        return problem(ErrorCode.INVALID_INPUT, "Malformed request: " + e.getMessage());
    }

    // Resilience4j Rate Limiter 초과
    @ExceptionHandler(RequestNotPermitted.class)
    public ResponseEntity<ProblemDetail> handleRateLimitExceeded(RequestNotPermitted e) {
        log.warn("Rate limit exceeded: {}", e.getMessage());
        return problem(ErrorCode.RATE_LIMIT_EXCEEDED, ErrorCode.RATE_LIMIT_EXCEEDED.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception e) {
        log.error("Unhandled exception", e);
        return problem(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.getMessage());
    }

    private ResponseEntity<ProblemDetail> problem(ErrorCode errorCode, String detail) {
        HttpStatus status = errorCode.getStatus();
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create(ERROR_TYPE_BASE + errorCode.name().toLowerCase()));
        problem.setProperty("code", errorCode.name());
        return ResponseEntity.status(status).body(problem);
    }
}
