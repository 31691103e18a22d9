package com.venueops.payment.client;

/**
 * 결제 대행사 일시 장애 (5xx, 429, 네트워크 오류). Resilience4j Retry 대상.
 */
public class TransientProcessorException extends RuntimeException {

    public TransientProcessorException(String message) {
        super(message);
    }

    public TransientProcessorException(String message, Throwable cause) {
        super(message, cause);
    }
}
