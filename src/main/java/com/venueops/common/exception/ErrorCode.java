package com.venueops.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 에러 코드 열거형 (Error Code Enum)
 *
 * <p>주문 라이프사이클과 결제 정산에서 발생하는 모든 실패 유형.
 * 호출자는 메시지 문자열이 아니라 이 코드로 분기한다.</p>
 *
 * <h3>에러 코드 분류</h3>
 * <ul>
 *   <li><b>Common</b>: 입력값 오류, 엔티티 미발견, 내부 오류</li>
 *   <li><b>Idempotency</b>: 멱등성 키 재사용 충돌, 처리 중 중복 요청</li>
 *   <li><b>Order / Table</b>: 상태 전이 위반, 결제 방식 호환성 거부, 테이블 점유</li>
 *   <li><b>Payment</b>: 환불 한도 초과, 결제 대행사 장애, 미해결 결제 이벤트</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ── Common ──
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected internal error"),
    RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "Rate limit exceeded. Please try again later"),

    // ── Idempotency ──
    // 같은 키에 다른 요청 본문
    IDEMPOTENCY_CONFLICT(HttpStatus.CONFLICT, "Idempotency key was already used with a different request"),
    // 같은 키의 첫 요청이 아직 처리 중
    DUPLICATE_REQUEST(HttpStatus.CONFLICT, "A request with this idempotency key is still being processed"),

    // ── Venue / Table ──
    VENUE_NOT_FOUND(HttpStatus.NOT_FOUND, "Venue not found"),
    TABLE_OCCUPIED(HttpStatus.CONFLICT, "Table already has an open session bound to another order"),

    // ── Order ──
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Order not found"),
    INVALID_TRANSITION(HttpStatus.CONFLICT, "Invalid status transition"),
    COMPATIBILITY_DENIED(HttpStatus.BAD_REQUEST, "Payment method is not allowed for this fulfillment"),
    FORCED_COMPLETION_NOT_ALLOWED(HttpStatus.FORBIDDEN, "Only managers or owners can force-complete an order"),

    // ── Payment ──
    REFUND_EXCEEDS_BALANCE(HttpStatus.BAD_REQUEST, "Refund amount exceeds the refundable balance"),
    EXTERNAL_PROCESSOR_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "Payment processor is temporarily unavailable"),
    PROCESSOR_REJECTED(HttpStatus.UNPROCESSABLE_ENTITY, "Payment processor rejected the request"),
    // 웹훅 응답의 outcome 코드로만 쓰임 (예외로 던지지 않음)
    UNRESOLVED_PAYMENT_EVENT(HttpStatus.OK, "Payment event could not be matched to an order");

    private final HttpStatus status;
    private final String message;
}
