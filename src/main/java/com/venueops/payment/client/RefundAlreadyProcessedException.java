package com.venueops.payment.client;

/**
 * 대행사가 "이미 환불됨"으로 확정 거절. 재시도하지 않고 로컬 상태를 맞춘다.
 */
public class RefundAlreadyProcessedException extends RuntimeException {

    public RefundAlreadyProcessedException(String message) {
        super(message);
    }
}
