package com.venueops.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 응답 래퍼 (Common API Response Wrapper)
 *
 * <pre>
 *   // 성공: {"success": true, "data": {...}}
 *   return ApiResponse.ok(response);
 * </pre>
 *
 * 실패 응답은 GlobalExceptionHandler가 ProblemDetail로 내려준다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        boolean success,
        T data,
        String message
) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }
}
