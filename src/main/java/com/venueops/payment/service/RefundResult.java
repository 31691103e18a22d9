package com.venueops.payment.service;

import com.venueops.order.entity.Order;

/**
 * @param amount              이번 요청으로 환불된 금액 (대행사 상태로 맞춘 경우 0)
 * @param reconciledUpstream  대행사가 이미 환불한 상태여서 로컬만 맞췄는지
 */
public record RefundResult(
        Order order,
        long amount,
        String refundRef,
        boolean reconciledUpstream
) {
}
