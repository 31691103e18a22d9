package com.venueops.order.dto;

import jakarta.validation.constraints.Size;

/**
 * @param amount          환불액 (최소 화폐 단위). 생략하면 남은 잔액 전부.
 * @param clientReference Idempotency-Key 헤더가 없을 때 쓰는 호출자 발급 참조값. 환불 요청마다 달라야 한다.
 */
public record RefundOrderRequest(Long amount, @Size(max = 500) String reason, @Size(max = 100) String clientReference) {
}
