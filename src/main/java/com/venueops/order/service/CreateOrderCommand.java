package com.venueops.order.service;

import com.venueops.order.entity.FulfillmentType;
import com.venueops.order.entity.OrderSource;
import com.venueops.order.entity.PaymentMethod;
import com.venueops.order.entity.QrType;

import java.util.List;

/**
 * 주문 생성 입력. HTTP DTO와 분리되어 있어 서비스는 웹 계층 없이 호출 가능하다.
 *
 * @param qrType      null이면 fulfillmentType으로부터 결정
 * @param clientTotal 클라이언트가 계산한 총액 (선택, 최소 화폐 단위)
 */
public record CreateOrderCommand(
        String venueId,
        FulfillmentType fulfillmentType,
        QrType qrType,
        PaymentMethod paymentMethod,
        OrderSource source,
        String tableRef,
        String counterLabel,
        Customer customer,
        List<Line> items,
        Long clientTotal
) {
    public record Line(String menuItemId, String name, long unitPrice, int quantity, String note) {
    }

    public record Customer(String name, String phone, String email) {
    }
}
