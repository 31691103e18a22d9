package com.venueops.order.service;

import com.venueops.common.auth.StaffRole;
import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import com.venueops.order.entity.*;
import com.venueops.order.event.OrderStatusChangedEvent;
import com.venueops.order.repository.OrderRepository;
import com.venueops.table.entity.TableSession;
import com.venueops.table.service.TableSessionManager;
import com.venueops.venue.service.VenueDirectory;
import com.venueops.venue.service.VenuePolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class OrderServiceTest {

    private static final String VENUE = "venue-1";

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private VenueDirectory venueDirectory;

    @Spy
    private PaymentCompatibilityValidator compatibilityValidator = new PaymentCompatibilityValidator();

    @Mock
    private TableSessionManager tableSessionManager;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private OrderService orderService;

    @Test
    @DisplayName("테이블 주문 생성 시 세션을 열고 주문에 연결")
    void createOrder_TableOrder_OpensSession() {
        // Given
        given(venueDirectory.findPolicy(VENUE)).willReturn(Optional.of(new VenuePolicy(VENUE, false, false)));
        TableSession session = TableSession.openFor(VENUE, "T1", "placeholder");
        given(tableSessionManager.openOrAttach(eq(VENUE), eq("T1"), anyString())).willReturn(session);
        given(orderRepository.save(any(Order.class))).willAnswer(inv -> inv.getArgument(0));

        // When
        Order order = orderService.createOrder(tableCommand(PaymentMethod.PAY_LATER, null));

        // Then
        assertThat(order.getOrderStatus()).isEqualTo(OrderStatus.PLACED);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.UNPAID);
        assertThat(order.getPaymentMode()).isEqualTo(PaymentMode.DEFERRED);
        assertThat(order.getTotalAmount()).isEqualTo(2850L);
        assertThat(order.getTableSessionId()).isEqualTo(session.getId());
        assertThat(order.getItems()).hasSize(2);
        verify(eventPublisher).publishEvent(any(OrderStatusChangedEvent.class));
    }

    @Test
    @DisplayName("클라이언트 총액이 허용 오차 안이면 그 값을 사용")
    void createOrder_ClientTotalWithinTolerance_UsesClientTotal() {
        // Given
        given(venueDirectory.findPolicy(VENUE)).willReturn(Optional.of(new VenuePolicy(VENUE, false, false)));
        given(orderRepository.save(any(Order.class))).willAnswer(inv -> inv.getArgument(0));

        // When
        Order order = orderService.createOrder(counterCommand(PaymentMethod.PAY_NOW, 2851L));

        // Then
        assertThat(order.getTotalAmount()).isEqualTo(2851L);
        verify(tableSessionManager, never()).openOrAttach(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("클라이언트 총액이 허용 오차를 벗어나면 서버 계산값 사용")
    void createOrder_ClientTotalMismatch_UsesComputedTotal() {
        // Given
        given(venueDirectory.findPolicy(VENUE)).willReturn(Optional.of(new VenuePolicy(VENUE, false, false)));
        given(orderRepository.save(any(Order.class))).willAnswer(inv -> inv.getArgument(0));

        // When
        Order order = orderService.createOrder(counterCommand(PaymentMethod.PAY_NOW, 3000L));

        // Then
        assertThat(order.getTotalAmount()).isEqualTo(2850L);
    }

    @Test
    @DisplayName("결제 호환성 검사 실패 시 주문 저장 안 함")
    void createOrder_CompatibilityDenied() {
        // Given
        given(venueDirectory.findPolicy(VENUE)).willReturn(Optional.of(new VenuePolicy(VENUE, false, false)));

        // When & Then
        assertThatThrownBy(() -> orderService.createOrder(counterCommand(PaymentMethod.PAY_LATER, null)))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.COMPATIBILITY_DENIED));
        verify(orderRepository, never()).save(any());
    }

    @Test
    @DisplayName("존재하지 않는 매장이면 VENUE_NOT_FOUND")
    void createOrder_UnknownVenue() {
        // Given
        given(venueDirectory.findPolicy(VENUE)).willReturn(Optional.empty());

        // When & Then
        assertThatThrownBy(() -> orderService.createOrder(counterCommand(PaymentMethod.PAY_NOW, null)))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.VENUE_NOT_FOUND));
    }

    @Test
    @DisplayName("테이블 주문에 tableRef가 없으면 INVALID_INPUT")
    void createOrder_TableWithoutTableRef() {
        CreateOrderCommand command = new CreateOrderCommand(VENUE, FulfillmentType.TABLE, null,
                PaymentMethod.PAY_NOW, null, " ", null, null, lines(), null);

        assertThatThrownBy(() -> orderService.createOrder(command))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_INPUT));
        verify(venueDirectory, never()).findPolicy(anyString());
    }

    @Test
    @DisplayName("테이블이 다른 주문에 점유되어 있으면 주문도 저장되지 않음")
    void createOrder_TableOccupied() {
        // Given
        given(venueDirectory.findPolicy(VENUE)).willReturn(Optional.of(new VenuePolicy(VENUE, false, false)));
        given(tableSessionManager.openOrAttach(eq(VENUE), eq("T1"), anyString()))
                .willThrow(new BusinessException(ErrorCode.TABLE_OCCUPIED));

        // When & Then
        assertThatThrownBy(() -> orderService.createOrder(tableCommand(PaymentMethod.PAY_NOW, null)))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.TABLE_OCCUPIED));
        verify(orderRepository, never()).save(any());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("PLACED → IN_PREP 진행 성공")
    void advanceStatus_Success() {
        // Given
        Order order = order(OrderStatus.IN_PREP, PaymentStatus.UNPAID, 1000L);
        given(orderRepository.transitionStatus(eq(order.getId()), eq(VENUE), eq(OrderStatus.PLACED),
                eq(OrderStatus.IN_PREP), any())).willReturn(1);
        given(orderRepository.findByIdAndVenueId(order.getId(), VENUE)).willReturn(Optional.of(order));

        // When
        Order result = orderService.advanceStatus(order.getId(), VENUE, OrderStatus.IN_PREP);

        // Then
        assertThat(result.getOrderStatus()).isEqualTo(OrderStatus.IN_PREP);
        verify(eventPublisher).publishEvent(any(OrderStatusChangedEvent.class));
    }

    @Test
    @DisplayName("동시 진행에서 진 쪽은 INVALID_TRANSITION")
    void advanceStatus_LostRace() {
        // Given
        Order order = order(OrderStatus.IN_PREP, PaymentStatus.UNPAID, 1000L);
        given(orderRepository.transitionStatus(eq(order.getId()), eq(VENUE), eq(OrderStatus.PLACED),
                eq(OrderStatus.IN_PREP), any())).willReturn(0);
        given(orderRepository.findByIdAndVenueId(order.getId(), VENUE)).willReturn(Optional.of(order));

        // When & Then
        assertThatThrownBy(() -> orderService.advanceStatus(order.getId(), VENUE, OrderStatus.IN_PREP))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_TRANSITION))
                .hasMessageContaining("IN_PREP");
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("다른 매장의 주문이면 ORDER_NOT_FOUND")
    void advanceStatus_OtherVenue_NotFound() {
        // Given
        given(orderRepository.transitionStatus(eq("order-x"), eq(VENUE), eq(OrderStatus.READY),
                eq(OrderStatus.SERVING), any())).willReturn(0);
        given(orderRepository.findByIdAndVenueId("order-x", VENUE)).willReturn(Optional.empty());

        // When & Then
        assertThatThrownBy(() -> orderService.advanceStatus("order-x", VENUE, OrderStatus.SERVING))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.ORDER_NOT_FOUND));
    }

    @Test
    @DisplayName("진행으로 종료 상태에 도달할 수 없음")
    void advanceStatus_ToTerminal_Rejected() {
        assertThatThrownBy(() -> orderService.advanceStatus("order-1", VENUE, OrderStatus.COMPLETED))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_TRANSITION));
        verify(orderRepository, never()).transitionStatus(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("SERVING 주문 완료 시 테이블 세션 해제")
    void completeOrder_FromServing_FreesTable() {
        // Given
        Order order = order(OrderStatus.COMPLETED, PaymentStatus.PAID, 1000L);
        given(orderRepository.markCompleted(eq(order.getId()), eq(VENUE), eq(List.of(OrderStatus.SERVING)),
                eq(OrderStatus.COMPLETED), eq(false), isNull(), isNull(), any())).willReturn(1);
        given(orderRepository.findByIdAndVenueId(order.getId(), VENUE)).willReturn(Optional.of(order));

        // When
        orderService.completeOrder(order.getId(), VENUE, CompletionRequest.normal("staff-1", StaffRole.STAFF));

        // Then
        verify(tableSessionManager).freeForOrder(VENUE, order.getId());
        verify(eventPublisher).publishEvent(any(OrderStatusChangedEvent.class));
    }

    @Test
    @DisplayName("SERVING 이전 상태에서 일반 완료는 거부되고 테이블 유지")
    void completeOrder_NotServing_Rejected() {
        // Given
        Order order = order(OrderStatus.READY, PaymentStatus.UNPAID, 1000L);
        given(orderRepository.markCompleted(eq(order.getId()), eq(VENUE), anyCollection(),
                eq(OrderStatus.COMPLETED), eq(false), isNull(), isNull(), any())).willReturn(0);
        given(orderRepository.findByIdAndVenueId(order.getId(), VENUE)).willReturn(Optional.of(order));

        // When & Then
        assertThatThrownBy(() -> orderService.completeOrder(order.getId(), VENUE,
                CompletionRequest.normal("staff-1", StaffRole.MANAGER)))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_TRANSITION));
        verify(tableSessionManager, never()).freeForOrder(anyString(), anyString());
    }

    @Test
    @DisplayName("STAFF 권한으로 강제 완료 불가")
    void completeOrder_ForcedByStaff_NotAllowed() {
        CompletionRequest request = new CompletionRequest(true, "customer left", "staff-1", StaffRole.STAFF);

        assertThatThrownBy(() -> orderService.completeOrder("order-1", VENUE, request))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.FORCED_COMPLETION_NOT_ALLOWED));
        verify(orderRepository, never()).markCompleted(any(), any(), any(), any(), anyBoolean(), any(), any(), any());
    }

    @Test
    @DisplayName("강제 완료는 사유가 필요")
    void completeOrder_ForcedWithoutReason() {
        CompletionRequest request = new CompletionRequest(true, "  ", "staff-9", StaffRole.MANAGER);

        assertThatThrownBy(() -> orderService.completeOrder("order-1", VENUE, request))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_INPUT));
    }

    @Test
    @DisplayName("MANAGER 강제 완료는 종료되지 않은 모든 상태에서 가능하고 감사 정보를 남김")
    void completeOrder_ForcedByManager() {
        // Given
        Order order = order(OrderStatus.COMPLETED, PaymentStatus.UNPAID, 1000L);
        given(orderRepository.markCompleted(eq(order.getId()), eq(VENUE), eq(OrderStatus.nonTerminal()),
                eq(OrderStatus.COMPLETED), eq(true), eq("staff-9"), eq("customer left"), any())).willReturn(1);
        given(orderRepository.findByIdAndVenueId(order.getId(), VENUE)).willReturn(Optional.of(order));

        // When
        orderService.completeOrder(order.getId(), VENUE,
                new CompletionRequest(true, " customer left ", "staff-9", StaffRole.MANAGER));

        // Then
        verify(tableSessionManager).freeForOrder(VENUE, order.getId());
    }

    @Test
    @DisplayName("주문 취소 시 테이블 해제, 결제 상태는 유지")
    void cancelOrder_FreesTable() {
        // Given
        Order order = order(OrderStatus.CANCELLED, PaymentStatus.PAID, 1000L);
        given(orderRepository.markCancelled(eq(order.getId()), eq(VENUE), eq(OrderStatus.nonTerminal()),
                eq(OrderStatus.CANCELLED), eq("out of stock"), any())).willReturn(1);
        given(orderRepository.findByIdAndVenueId(order.getId(), VENUE)).willReturn(Optional.of(order));

        // When
        Order result = orderService.cancelOrder(order.getId(), VENUE, "out of stock");

        // Then
        assertThat(result.getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
        verify(tableSessionManager).freeForOrder(VENUE, order.getId());
    }

    @Test
    @DisplayName("이미 결제된 주문에 결제 반영 시 INVALID_TRANSITION")
    void applyPayment_AlreadyPaid() {
        // Given
        Order order = order(OrderStatus.PLACED, PaymentStatus.PAID, 1000L);
        given(orderRepository.markPaid(eq(order.getId()), eq(VENUE), eq("cs_1"), eq("pi_1"),
                eq(PaymentStatus.UNPAID), eq(PaymentStatus.PAID), any())).willReturn(0);
        given(orderRepository.findByIdAndVenueId(order.getId(), VENUE)).willReturn(Optional.of(order));

        // When & Then
        assertThatThrownBy(() -> orderService.applyPayment(order.getId(), VENUE, "cs_1", "pi_1"))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_TRANSITION));
    }

    @Test
    @DisplayName("부분 환불은 PARTIALLY_REFUNDED로 전이")
    void applyRefund_Partial() {
        // Given
        Order order = order(OrderStatus.COMPLETED, PaymentStatus.PAID, 5000L);
        given(orderRepository.findByIdAndVenueId(order.getId(), VENUE)).willReturn(Optional.of(order));
        given(orderRepository.applyRefund(eq(order.getId()), eq(VENUE), eq(0L), eq(2000L),
                eq(PaymentStatus.PARTIALLY_REFUNDED), eq("re_1"), eq("cold food"), anyCollection(), any()))
                .willReturn(1);

        // When
        orderService.applyRefund(order.getId(), VENUE, 2000L, "cold food", "re_1");

        // Then
        verify(eventPublisher).publishEvent(any(OrderStatusChangedEvent.class));
    }

    @Test
    @DisplayName("금액 없이 환불하면 남은 잔액 전부 환불")
    void applyRefund_FullRemaining() {
        // Given
        Order order = order(OrderStatus.COMPLETED, PaymentStatus.PARTIALLY_REFUNDED, 5000L);
        ReflectionTestUtils.setField(order, "refundAmount", 2000L);
        given(orderRepository.findByIdAndVenueId(order.getId(), VENUE)).willReturn(Optional.of(order));
        given(orderRepository.applyRefund(eq(order.getId()), eq(VENUE), eq(2000L), eq(5000L),
                eq(PaymentStatus.REFUNDED), isNull(), isNull(), anyCollection(), any()))
                .willReturn(1);

        // When
        orderService.applyRefund(order.getId(), VENUE, null, null, null);

        // Then
        verify(orderRepository).applyRefund(eq(order.getId()), eq(VENUE), eq(2000L), eq(5000L),
                eq(PaymentStatus.REFUNDED), isNull(), isNull(), anyCollection(), any());
    }

    @Test
    @DisplayName("남은 잔액보다 큰 환불은 REFUND_EXCEEDS_BALANCE")
    void applyRefund_ExceedsBalance() {
        // Given
        Order order = order(OrderStatus.COMPLETED, PaymentStatus.PARTIALLY_REFUNDED, 5000L);
        ReflectionTestUtils.setField(order, "refundAmount", 4000L);
        given(orderRepository.findByIdAndVenueId(order.getId(), VENUE)).willReturn(Optional.of(order));

        // When & Then
        assertThatThrownBy(() -> orderService.applyRefund(order.getId(), VENUE, 1500L, null, null))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.REFUND_EXCEEDS_BALANCE));
        verify(orderRepository, never()).applyRefund(any(), any(), anyLong(), anyLong(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("전액 환불된 주문에 1원 환불하면 REFUND_EXCEEDS_BALANCE")
    void applyRefund_AfterFullRefund_ExceedsBalance() {
        // Given
        Order order = order(OrderStatus.COMPLETED, PaymentStatus.REFUNDED, 1000L);
        ReflectionTestUtils.setField(order, "refundAmount", 1000L);
        given(orderRepository.findByIdAndVenueId(order.getId(), VENUE)).willReturn(Optional.of(order));

        // When & Then
        assertThatThrownBy(() -> orderService.applyRefund(order.getId(), VENUE, 1L, null, null))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.REFUND_EXCEEDS_BALANCE));
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.REFUNDED);
        verify(orderRepository, never()).applyRefund(any(), any(), anyLong(), anyLong(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("전액 환불된 주문에 금액 없이 환불해도 REFUND_EXCEEDS_BALANCE")
    void applyRefund_FullAfterFullRefund_ExceedsBalance() {
        Order order = order(OrderStatus.COMPLETED, PaymentStatus.REFUNDED, 1000L);
        ReflectionTestUtils.setField(order, "refundAmount", 1000L);
        given(orderRepository.findByIdAndVenueId(order.getId(), VENUE)).willReturn(Optional.of(order));

        assertThatThrownBy(() -> orderService.applyRefund(order.getId(), VENUE, null, null, null))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.REFUND_EXCEEDS_BALANCE));
    }

    @Test
    @DisplayName("미결제 주문 환불은 INVALID_TRANSITION")
    void applyRefund_Unpaid() {
        Order order = order(OrderStatus.PLACED, PaymentStatus.UNPAID, 5000L);
        given(orderRepository.findByIdAndVenueId(order.getId(), VENUE)).willReturn(Optional.of(order));

        assertThatThrownBy(() -> orderService.applyRefund(order.getId(), VENUE, 100L, null, null))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_TRANSITION));
    }

    @Test
    @DisplayName("0원 환불은 INVALID_INPUT")
    void applyRefund_ZeroAmount() {
        Order order = order(OrderStatus.COMPLETED, PaymentStatus.PAID, 5000L);
        given(orderRepository.findByIdAndVenueId(order.getId(), VENUE)).willReturn(Optional.of(order));

        assertThatThrownBy(() -> orderService.applyRefund(order.getId(), VENUE, 0L, null, null))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_INPUT));
    }

    @Test
    @DisplayName("동시 환불에서 진 쪽은 INVALID_TRANSITION")
    void applyRefund_ConcurrentWriteLost() {
        // Given
        Order order = order(OrderStatus.COMPLETED, PaymentStatus.PAID, 5000L);
        given(orderRepository.findByIdAndVenueId(order.getId(), VENUE)).willReturn(Optional.of(order));
        given(orderRepository.applyRefund(eq(order.getId()), eq(VENUE), eq(0L), eq(3000L),
                eq(PaymentStatus.PARTIALLY_REFUNDED), isNull(), isNull(), anyCollection(), any()))
                .willReturn(0);

        // When & Then
        assertThatThrownBy(() -> orderService.applyRefund(order.getId(), VENUE, 3000L, null, null))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_TRANSITION))
                .hasMessageContaining("concurrently");
    }

    @Test
    @DisplayName("대행사 누적 환불액이 로컬보다 작으면 되돌리지 않음")
    void reconcileUpstreamRefund_NeverMovesBackwards() {
        // Given
        Order order = order(OrderStatus.COMPLETED, PaymentStatus.PARTIALLY_REFUNDED, 5000L);
        ReflectionTestUtils.setField(order, "refundAmount", 3000L);
        given(orderRepository.findByIdAndVenueId(order.getId(), VENUE)).willReturn(Optional.of(order));

        // When
        Order result = orderService.reconcileUpstreamRefund(order.getId(), VENUE, 2000L, "re_9");

        // Then
        assertThat(result.getRefundAmount()).isEqualTo(3000L);
        verify(orderRepository, never()).applyRefund(any(), any(), anyLong(), anyLong(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("대행사 누적 환불액은 주문 총액으로 상한")
    void reconcileUpstreamRefund_CappedAtTotal() {
        // Given
        Order order = order(OrderStatus.COMPLETED, PaymentStatus.PAID, 5000L);
        given(orderRepository.findByIdAndVenueId(order.getId(), VENUE)).willReturn(Optional.of(order));
        given(orderRepository.applyRefund(eq(order.getId()), eq(VENUE), eq(0L), eq(5000L),
                eq(PaymentStatus.REFUNDED), eq("re_9"), isNull(), anyCollection(), any())).willReturn(1);

        // When
        orderService.reconcileUpstreamRefund(order.getId(), VENUE, 9000L, "re_9");

        // Then
        verify(eventPublisher).publishEvent(any(OrderStatusChangedEvent.class));
    }

    private CreateOrderCommand tableCommand(PaymentMethod method, Long clientTotal) {
        return new CreateOrderCommand(VENUE, FulfillmentType.TABLE, null, method, null, "T1", null,
                new CreateOrderCommand.Customer("Kim", null, null), lines(), clientTotal);
    }

    private CreateOrderCommand counterCommand(PaymentMethod method, Long clientTotal) {
        return new CreateOrderCommand(VENUE, FulfillmentType.COUNTER, null, method, OrderSource.COUNTER, null,
                "A-12", null, lines(), clientTotal);
    }

    private List<CreateOrderCommand.Line> lines() {
        return List.of(
                new CreateOrderCommand.Line("m-1", "Flat White", 1200L, 2, null),
                new CreateOrderCommand.Line("m-2", "Croissant", 450L, 1, "warm"));
    }

    private Order order(OrderStatus orderStatus, PaymentStatus paymentStatus, long total) {
        Order order = Order.builder()
                .venueId(VENUE)
                .fulfillmentType(FulfillmentType.TABLE)
                .tableRef("T1")
                .qrType(QrType.TABLE_FULL_SERVICE)
                .source(OrderSource.QR)
                .paymentMethod(PaymentMethod.PAY_NOW)
                .build();
        order.settleTotal(total);
        ReflectionTestUtils.setField(order, "orderStatus", orderStatus);
        ReflectionTestUtils.setField(order, "paymentStatus", paymentStatus);
        return order;
    }
}
