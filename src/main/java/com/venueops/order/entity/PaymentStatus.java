package com.venueops.order.entity;

/**
 * 결제 상태. 단조 증가하며 되돌아가지 않는다.
 *
 * <pre>
 *   UNPAID → PAID → PARTIALLY_REFUNDED → REFUNDED
 *             └─────────────────────────→ REFUNDED
 * </pre>
 */
public enum PaymentStatus {
    UNPAID,
    PAID,
    PARTIALLY_REFUNDED,
    REFUNDED;

    public boolean isRefundable() {
        return this == PAID || this == PARTIALLY_REFUNDED;
    }
}
