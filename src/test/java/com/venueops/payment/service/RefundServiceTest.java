package com.venueops.payment.service;

import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import com.venueops.order.entity.*;
import com.venueops.order.service.OrderService;
import com.venueops.payment.client.PaymentProcessorClient;
import com.venueops.payment.client.PaymentProcessorGateway;
import com.venueops.payment.client.RefundAlreadyProcessedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RefundServiceTest {

    private static final String VENUE = "venue-1";

    @Mock
    private OrderService orderService;

    @Mock
    private PaymentProcessorGateway processorGateway;

    @InjectMocks
    private RefundService refundService;

    @Test
    @DisplayName("오프라인 결제 주문은 대행사 호출 없이 로컬 환불")
    void refund_OfflinePayment_LocalOnly() {
        // Given
        Order order = paidOrder(PaymentMethod.PAY_AT_TILL, null);
        given(orderService.getOrder(order.getId(), VENUE)).willReturn(order);
        given(orderService.quoteRefund(order, 1000L)).willReturn(1000L);
        given(orderService.applyRefund(order.getId(), VENUE, 1000L, "wrong item", null)).willReturn(order);

        // When
        RefundResult result = refundService.refund(order.getId(), VENUE, 1000L, "wrong item", "refund:key");

        // Then
        assertThat(result.amount()).isEqualTo(1000L);
        assertThat(result.reconciledUpstream()).isFalse();
        verify(processorGateway, never()).createRefund(anyString(), anyLong(), any(), anyString());
    }

    @Test
    @DisplayName("온라인 결제 주문은 대행사 환불 후 환불 참조와 함께 로컬 반영")
    void refund_OnlinePayment_CallsProcessor() {
        // Given
        Order order = paidOrder(PaymentMethod.PAY_NOW, "pi_1");
        given(orderService.getOrder(order.getId(), VENUE)).willReturn(order);
        given(orderService.quoteRefund(order, null)).willReturn(5000L);
        given(processorGateway.createRefund("pi_1", 5000L, null, "refund:key"))
                .willReturn(new PaymentProcessorClient.RefundResponse("re_1", 5000L, "succeeded"));
        given(orderService.applyRefund(order.getId(), VENUE, 5000L, null, "re_1")).willReturn(order);

        // When
        RefundResult result = refundService.refund(order.getId(), VENUE, null, null, "refund:key");

        // Then
        assertThat(result.refundRef()).isEqualTo("re_1");
        assertThat(result.amount()).isEqualTo(5000L);
    }

    @Test
    @DisplayName("대행사가 이미 환불했다고 응답하면 로컬을 맞추고 성공 처리")
    void refund_AlreadyRefundedUpstream_Reconciles() {
        // Given
        Order order = paidOrder(PaymentMethod.PAY_NOW, "pi_1");
        given(orderService.getOrder(order.getId(), VENUE)).willReturn(order);
        given(orderService.quoteRefund(order, 2000L)).willReturn(2000L);
        given(processorGateway.createRefund("pi_1", 2000L, null, "refund:key"))
                .willThrow(new RefundAlreadyProcessedException("charge_already_refunded"));
        given(orderService.reconcileUpstreamRefund(order.getId(), VENUE, 5000L, null)).willReturn(order);

        // When
        RefundResult result = refundService.refund(order.getId(), VENUE, 2000L, null, "refund:key");

        // Then
        assertThat(result.reconciledUpstream()).isTrue();
        assertThat(result.amount()).isZero();
        verify(orderService, never()).applyRefund(anyString(), anyString(), anyLong(), any(), any());
    }

    @Test
    @DisplayName("대행사 장애가 계속되면 EXTERNAL_PROCESSOR_ERROR, 로컬 상태 변경 없음")
    void refund_ProcessorUnavailable_NoLocalChange() {
        // Given
        Order order = paidOrder(PaymentMethod.PAY_NOW, "pi_1");
        given(orderService.getOrder(order.getId(), VENUE)).willReturn(order);
        given(orderService.quoteRefund(order, 2000L)).willReturn(2000L);
        given(processorGateway.createRefund("pi_1", 2000L, null, "refund:key"))
                .willThrow(new BusinessException(ErrorCode.EXTERNAL_PROCESSOR_ERROR));

        // When & Then
        assertThatThrownBy(() -> refundService.refund(order.getId(), VENUE, 2000L, null, "refund:key"))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.EXTERNAL_PROCESSOR_ERROR));
        verify(orderService, never()).applyRefund(anyString(), anyString(), anyLong(), any(), any());
    }

    @Test
    @DisplayName("잔액 초과 환불은 대행사 호출 전에 거부")
    void refund_ExceedsBalance_BeforeProcessorCall() {
        // Given
        Order order = paidOrder(PaymentMethod.PAY_NOW, "pi_1");
        given(orderService.getOrder(order.getId(), VENUE)).willReturn(order);
        given(orderService.quoteRefund(order, 9000L))
                .willThrow(new BusinessException(ErrorCode.REFUND_EXCEEDS_BALANCE));

        // When & Then
        assertThatThrownBy(() -> refundService.refund(order.getId(), VENUE, 9000L, null, "refund:key"))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.REFUND_EXCEEDS_BALANCE));
        verify(processorGateway, never()).createRefund(anyString(), anyLong(), any(), anyString());
    }

    private Order paidOrder(PaymentMethod method, String paymentRef) {
        Order order = Order.builder()
                .venueId(VENUE)
                .fulfillmentType(FulfillmentType.COUNTER)
                .qrType(QrType.COUNTER_PICKUP)
                .source(OrderSource.COUNTER)
                .paymentMethod(method)
                .build();
        order.settleTotal(5000L);
        ReflectionTestUtils.setField(order, "paymentStatus", PaymentStatus.PAID);
        ReflectionTestUtils.setField(order, "externalPaymentRef", paymentRef);
        return order;
    }
}
