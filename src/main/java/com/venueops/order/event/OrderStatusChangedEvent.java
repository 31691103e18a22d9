package com.venueops.order.event;

import com.venueops.order.entity.Order;
import com.venueops.order.entity.OrderStatus;
import com.venueops.order.entity.PaymentStatus;

/**
 * 주문 상태 변경 (JVM 내부 이벤트). 커밋 이후 OrderStatusPublisher가 Redis로 전파한다.
 */
public record OrderStatusChangedEvent(
        String orderId,
        String venueId,
        String tableRef,
        OrderStatus orderStatus,
        PaymentStatus paymentStatus,
        long occurredAt
) {
    public static OrderStatusChangedEvent of(Order order) {
        return new OrderStatusChangedEvent(order.getId(), order.getVenueId(), order.getTableRef(),
                order.getOrderStatus(), order.getPaymentStatus(), System.currentTimeMillis());
    }
}
