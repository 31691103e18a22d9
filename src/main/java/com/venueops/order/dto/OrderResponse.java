package com.venueops.order.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.venueops.order.entity.*;

import java.time.LocalDateTime;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderResponse(
        String orderId,
        String venueId,
        FulfillmentType fulfillmentType,
        String tableRef,
        String tableSessionId,
        String counterLabel,
        QrType qrType,
        boolean requiresCollection,
        OrderSource source,
        List<Item> items,
        long totalAmount,
        OrderStatus orderStatus,
        PaymentStatus paymentStatus,
        PaymentMethod paymentMethod,
        PaymentMode paymentMode,
        String externalSessionRef,
        String externalPaymentRef,
        long refundAmount,
        String refundRef,
        String cancelReason,
        boolean forcedCompletion,
        String forcedBy,
        String forcedReason,
        LocalDateTime createdAt,
        LocalDateTime paidAt,
        LocalDateTime completedAt,
        LocalDateTime cancelledAt
) {
    public record Item(String menuItemId, String name, long unitPrice, int quantity, long subtotal, String note) {
    }

    public static OrderResponse from(Order order) {
        return new OrderResponse(
                order.getId(),
                order.getVenueId(),
                order.getFulfillmentType(),
                order.getTableRef(),
                order.getTableSessionId(),
                order.getCounterLabel(),
                order.getQrType(),
                order.isRequiresCollection(),
                order.getSource(),
                order.getItems().stream()
                        .map(i -> new Item(i.getMenuItemId(), i.getName(), i.getUnitPrice(),
                                i.getQuantity(), i.getSubtotal(), i.getNote()))
                        .toList(),
                order.getTotalAmount(),
                order.getOrderStatus(),
                order.getPaymentStatus(),
                order.getPaymentMethod(),
                order.getPaymentMode(),
                order.getExternalSessionRef(),
                order.getExternalPaymentRef(),
                order.getRefundAmount(),
                order.getRefundRef(),
                order.getCancelReason(),
                order.isForcedCompletion(),
                order.getForcedBy(),
                order.getForcedReason(),
                order.getCreatedAt(),
                order.getPaidAt(),
                order.getCompletedAt(),
                order.getCancelledAt());
    }
}
