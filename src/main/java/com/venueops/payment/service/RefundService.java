package com.venueops.payment.service;

import com.venueops.order.entity.Order;
import com.venueops.order.service.OrderService;
import com.venueops.payment.client.PaymentProcessorGateway;
import com.venueops.payment.client.RefundAlreadyProcessedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 환불 핸들러 (Refund Handler)
 *
 * <h3>처리 흐름</h3>
 * <pre>
 *   1. 주문 조회 + 환불액 확정 (잔액 초과 → REFUND_EXCEEDS_BALANCE)
 *   2. 온라인 결제(externalPaymentRef 있음)면 대행사 환불 요청
 *        - 일시 장애: 지수 백오프 재시도 후 EXTERNAL_PROCESSOR_ERROR (로컬 상태 변경 없음)
 *        - "이미 환불됨": 로컬을 REFUNDED로 맞추고 성공 처리
 *   3. 로컬 환불 반영 (applyRefund)
 * </pre>
 *
 * <p>대행사 호출은 DB 트랜잭션 밖에서 한다. 로컬 반영(applyRefund)만 트랜잭션 안에서 실행된다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefundService {

    private final OrderService orderService;
    private final PaymentProcessorGateway processorGateway;

    /**
     * @param amount         null이면 남은 잔액 전부
     * @param idempotencyKey 대행사에 그대로 전달되는 환불 멱등성 키
     */
    public RefundResult refund(String orderId, String venueId, Long amount, String reason, String idempotencyKey) {
        Order order = orderService.getOrder(orderId, venueId);
        long refundAmount = orderService.quoteRefund(order, amount);

        String refundRef = null;
        if (order.getExternalPaymentRef() != null) {
            try {
                refundRef = processorGateway.createRefund(order.getExternalPaymentRef(), refundAmount,
                        reason, idempotencyKey).id();
            } catch (RefundAlreadyProcessedException e) {
                log.warn("Processor reports charge already refunded, reconciling locally: orderId={}, paymentRef={}",
                        orderId, order.getExternalPaymentRef());
                Order reconciled = orderService.reconcileUpstreamRefund(orderId, venueId, order.getTotalAmount(), null);
                return new RefundResult(reconciled, 0L, null, true);
            }
        } else {
            log.info("Offline payment, refunding locally only: orderId={}, mode={}", orderId, order.getPaymentMode());
        }

        Order refunded = orderService.applyRefund(orderId, venueId, refundAmount, reason, refundRef);
        return new RefundResult(refunded, refundAmount, refundRef, false);
    }
}
