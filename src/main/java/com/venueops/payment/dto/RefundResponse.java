package com.venueops.payment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.venueops.order.entity.Order;
import com.venueops.order.entity.PaymentStatus;
import com.venueops.payment.service.RefundResult;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RefundResponse(
        String orderId,
        PaymentStatus paymentStatus,
        long refundedAmount,
        long totalRefunded,
        long remainingBalance,
        String refundRef,
        boolean reconciledUpstream
) {
    public static RefundResponse from(RefundResult result) {
        Order order = result.order();
        return new RefundResponse(order.getId(), order.getPaymentStatus(), result.amount(),
                order.getRefundAmount(), order.getRefundableBalance(),
                result.refundRef() != null ? result.refundRef() : order.getRefundRef(),
                result.reconciledUpstream());
    }
}
