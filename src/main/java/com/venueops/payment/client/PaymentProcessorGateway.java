package com.venueops.payment.client;

import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import feign.RetryableException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 결제 대행사 호출 게이트웨이 - Resilience4j Retry 적용 지점.
 *
 * <h3>재시도 정책 (application.yml: resilience4j.retry.instances.paymentProcessor)</h3>
 * <pre>
 *   maxAttempts: 3, waitDuration: 500ms, exponential backoff x2
 *   1차 실패 → 500ms → 2차 실패 → 1000ms → 3차 실패 → fallback
 * </pre>
 * <p>재시도 대상은 {@link TransientProcessorException}뿐이다. 확정 거절
 * ({@link RefundAlreadyProcessedException}, PROCESSOR_REJECTED)은 즉시 전파된다.
 * 재시도를 모두 소진하면 EXTERNAL_PROCESSOR_ERROR(503)로 바뀐다.</p>
 *
 * <p>환불 재시도는 같은 Idempotency-Key를 보내므로 대행사에서 중복 환불되지 않는다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentProcessorGateway {

    private final PaymentProcessorClient client;

    @Retry(name = "paymentProcessor", fallbackMethod = "refundFallback")
    public PaymentProcessorClient.RefundResponse createRefund(String paymentRef, long amount,
                                                              String reason, String idempotencyKey) {
        log.info("Requesting processor refund: paymentRef={}, amount={}, key={}", paymentRef, amount, idempotencyKey);
        try {
            return client.createRefund(idempotencyKey,
                    new PaymentProcessorClient.RefundRequest(paymentRef, amount, reason));
        } catch (RetryableException e) {
            throw new TransientProcessorException("Payment processor unreachable: " + e.getMessage(), e);
        }
    }

    @Retry(name = "paymentProcessor", fallbackMethod = "sessionFallback")
    public PaymentProcessorClient.CheckoutSessionResponse retrieveSession(String sessionRef) {
        try {
            return client.retrieveSession(sessionRef);
        } catch (RetryableException e) {
            throw new TransientProcessorException("Payment processor unreachable: " + e.getMessage(), e);
        }
    }

    private PaymentProcessorClient.RefundResponse refundFallback(String paymentRef, long amount, String reason,
                                                                 String idempotencyKey, TransientProcessorException e) {
        log.error("Processor refund failed after retries: paymentRef={}, amount={}, cause={}",
                paymentRef, amount, e.getMessage());
        throw new BusinessException(ErrorCode.EXTERNAL_PROCESSOR_ERROR,
                "Payment processor unavailable; refund not issued", e);
    }

    private PaymentProcessorClient.CheckoutSessionResponse sessionFallback(String sessionRef,
                                                                           TransientProcessorException e) {
        log.error("Processor session lookup failed after retries: sessionRef={}, cause={}", sessionRef, e.getMessage());
        throw new BusinessException(ErrorCode.EXTERNAL_PROCESSOR_ERROR,
                "Payment processor unavailable; session lookup failed", e);
    }
}
