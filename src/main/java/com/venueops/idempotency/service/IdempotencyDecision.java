package com.venueops.idempotency.service;

/**
 * checkOrReserve 결과. 충돌과 처리 중 중복은 BusinessException으로 던져진다.
 */
public record IdempotencyDecision(
        Outcome outcome,
        String storedResponse,
        Integer storedStatus
) {
    public enum Outcome {
        PROCEED,  // 예약 성공 → 작업 수행
        REPLAY    // 이미 완료 → 저장된 응답 재전송
    }

    public static IdempotencyDecision proceed() {
        return new IdempotencyDecision(Outcome.PROCEED, null, null);
    }

    public static IdempotencyDecision replay(String storedResponse, Integer storedStatus) {
        return new IdempotencyDecision(Outcome.REPLAY, storedResponse, storedStatus);
    }

    public boolean isReplay() {
        return outcome == Outcome.REPLAY;
    }
}
