package com.venueops.order.dto;

import com.venueops.order.entity.FulfillmentType;
import com.venueops.order.entity.OrderSource;
import com.venueops.order.entity.PaymentMethod;
import com.venueops.order.entity.QrType;
import com.venueops.order.service.CreateOrderCommand;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * 주문 생성 요청.
 *
 * @param clientReference Idempotency-Key 헤더가 없을 때 멱등성 키를 만들 클라이언트 측 식별자
 * @param total           클라이언트 계산 총액 (선택). 서버 계산과 1 단위 이상 차이나면 무시된다.
 */
public record CreateOrderRequest(
        @NotNull FulfillmentType fulfillmentType,
        QrType qrType,
        @NotNull PaymentMethod paymentMethod,
        OrderSource source,
        @Size(max = 64) String tableRef,
        @Size(max = 64) String counterLabel,
        CustomerRequest customer,
        @NotEmpty @Valid List<OrderItemRequest> items,
        @PositiveOrZero Long total,
        @Size(max = 128) String clientReference
) {
    public record CustomerRequest(String name, String phone, String email) {
    }

    public CreateOrderCommand toCommand(String venueId) {
        return new CreateOrderCommand(
                venueId,
                fulfillmentType,
                qrType,
                paymentMethod,
                source,
                tableRef,
                counterLabel,
                customer != null ? new CreateOrderCommand.Customer(customer.name(), customer.phone(), customer.email()) : null,
                items.stream()
                        .map(i -> new CreateOrderCommand.Line(i.menuItemId(), i.name(), i.unitPrice(), i.quantity(), i.note()))
                        .toList(),
                total);
    }
}
