package com.venueops.order.dto;

import com.venueops.order.entity.Order;
import com.venueops.order.entity.OrderStatus;
import com.venueops.order.entity.PaymentStatus;

public record CreateOrderResponse(
        String orderId,
        OrderStatus orderStatus,
        PaymentStatus paymentStatus,
        long totalAmount,
        String tableSessionId
) {
    public static CreateOrderResponse from(Order order) {
        return new CreateOrderResponse(order.getId(), order.getOrderStatus(), order.getPaymentStatus(),
                order.getTotalAmount(), order.getTableSessionId());
    }
}
