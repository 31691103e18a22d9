package com.venueops.order.service;

import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import com.venueops.order.entity.*;
import com.venueops.order.event.OrderStatusChangedEvent;
import com.venueops.order.repository.OrderRepository;
import com.venueops.table.entity.TableSession;
import com.venueops.table.service.TableSessionManager;
import com.venueops.venue.service.VenueDirectory;
import com.venueops.venue.service.VenuePolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 상태 머신 (Order State Machine)
 *
 * <p>orderStatus / paymentStatus를 바꾸는 유일한 서비스. 모든 전이는 OrderRepository의
 * 조건부 UPDATE 한 문장으로 수행되므로 인스턴스가 여러 개여도 프로세스 내 락이 필요 없다.</p>
 *
 * <h3>전이 실패 판정</h3>
 * <pre>
 *   UPDATE ... WHERE id=? AND venue_id=? AND order_status=&lt;기대 상태&gt;
 *     1행 → 성공
 *     0행 → 주문 재조회
 *             ├─ 없음 (또는 다른 매장)  → ORDER_NOT_FOUND
 *             └─ 있음                   → INVALID_TRANSITION (현재 상태를 메시지에 포함)
 * </pre>
 *
 * <h3>교차 집계 변경</h3>
 * <p>주문 생성 + 테이블 세션 오픈, 주문 완료/취소 + 테이블 세션 해제는
 * 하나의 {@code @Transactional} 안에서 함께 커밋되거나 함께 롤백된다.</p>
 *
 * <p>상태 변경 알림은 ApplicationEventPublisher로 발행하고, 커밋 이후에만 Redis로 전파된다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OrderService {

    // 클라이언트 총액과 서버 계산 총액의 허용 오차 (최소 화폐 단위)
    static final long TOTAL_TOLERANCE = 1L;

    private final OrderRepository orderRepository;
    private final VenueDirectory venueDirectory;
    private final PaymentCompatibilityValidator compatibilityValidator;
    private final TableSessionManager tableSessionManager;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * 주문 생성. 테이블 주문이면 같은 트랜잭션에서 테이블 세션을 열거나 바인딩한다.
     * 테이블이 다른 주문에 점유되어 있으면(TABLE_OCCUPIED) 주문도 저장되지 않는다.
     */
    @Transactional
    public Order createOrder(CreateOrderCommand command) {
        validateShape(command);

        VenuePolicy policy = venueDirectory.findPolicy(command.venueId())
                .orElseThrow(() -> new BusinessException(ErrorCode.VENUE_NOT_FOUND,
                        "Venue " + command.venueId() + " not found"));

        QrType qrType = command.qrType() != null ? command.qrType() : QrType.defaultFor(command.fulfillmentType());
        OrderSource source = command.source() != null ? command.source() : OrderSource.QR;

        CompatibilityResult compatibility = compatibilityValidator.validate(
                command.fulfillmentType(), qrType, command.paymentMethod(), source, policy);
        if (!compatibility.allowed()) {
            log.info("Order rejected by payment compatibility: venueId={}, qrType={}, method={}, reason={}",
                    command.venueId(), qrType, command.paymentMethod(), compatibility.reason());
            throw new BusinessException(ErrorCode.COMPATIBILITY_DENIED, compatibility.reason());
        }

        CreateOrderCommand.Customer customer = command.customer();
        Order order = Order.builder()
                .venueId(command.venueId())
                .fulfillmentType(command.fulfillmentType())
                .tableRef(command.fulfillmentType() == FulfillmentType.TABLE ? command.tableRef().trim() : null)
                .counterLabel(command.counterLabel())
                .qrType(qrType)
                .source(source)
                .paymentMethod(command.paymentMethod())
                .customerName(customer != null ? customer.name() : null)
                .customerPhone(customer != null ? customer.phone() : null)
                .customerEmail(customer != null ? customer.email() : null)
                .build();

        for (CreateOrderCommand.Line line : command.items()) {
            order.addItem(OrderItem.builder()
                    .menuItemId(line.menuItemId())
                    .name(line.name())
                    .unitPrice(line.unitPrice())
                    .quantity(line.quantity())
                    .note(line.note())
                    .build());
        }
        long computed;
        try {
            computed = order.computeItemsTotal();
        } catch (ArithmeticException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Order total is out of range", e);
        }
        order.settleTotal(resolveTotal(computed, command.clientTotal(), command.venueId()));

        // 세션을 먼저 열고 주문을 저장한다 (세션 바인딩 UPDATE가 영속성 컨텍스트를 비우므로)
        if (order.getFulfillmentType() == FulfillmentType.TABLE) {
            TableSession session = tableSessionManager.openOrAttach(order.getVenueId(), order.getTableRef(), order.getId());
            order.attachTableSession(session.getId());
        }
        order = orderRepository.save(order);

        eventPublisher.publishEvent(OrderStatusChangedEvent.of(order));
        log.info("Order created: orderId={}, venueId={}, fulfillment={}, method={}, total={}",
                order.getId(), order.getVenueId(), order.getFulfillmentType(),
                order.getPaymentMethod(), order.getTotalAmount());
        return order;
    }

    /**
     * 주방 단계 진행 (PLACED → IN_PREP → READY → SERVING).
     * COMPLETED / CANCELLED는 completeOrder / cancelOrder로만 도달한다.
     */
    @Transactional
    public Order advanceStatus(String orderId, String venueId, OrderStatus nextStatus) {
        if (nextStatus == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "nextStatus is required");
        }
        OrderStatus expected = nextStatus.predecessor();
        if (expected == null) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    "Cannot advance an order to " + nextStatus + "; use the complete or cancel operation");
        }

        int updated = orderRepository.transitionStatus(orderId, venueId, expected, nextStatus, LocalDateTime.now());
        if (updated == 0) {
            Order current = getOrder(orderId, venueId);
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    "Order " + orderId + " is " + current.getOrderStatus() + "; expected " + expected);
        }

        Order order = getOrder(orderId, venueId);
        eventPublisher.publishEvent(OrderStatusChangedEvent.of(order));
        log.info("Order advanced: orderId={}, {} -> {}", orderId, expected, nextStatus);
        return order;
    }

    /**
     * 주문 완료. 일반 완료는 SERVING에서만 가능하다.
     * 강제 완료는 MANAGER/OWNER가 사유를 남겨야 하며 종료되지 않은 어느 상태에서나 가능하다.
     * 바인딩된 테이블 세션은 같은 트랜잭션에서 해제된다.
     */
    @Transactional
    public Order completeOrder(String orderId, String venueId, CompletionRequest request) {
        List<OrderStatus> allowedFrom;
        String forcedBy = null;
        String forcedReason = null;

        if (request.forced()) {
            if (request.role() == null || !request.role().canForceComplete()) {
                throw new BusinessException(ErrorCode.FORCED_COMPLETION_NOT_ALLOWED,
                        "Role " + request.role() + " cannot force-complete orders");
            }
            if (request.forcedReason() == null || request.forcedReason().isBlank()) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "A reason is required to force-complete an order");
            }
            allowedFrom = OrderStatus.nonTerminal();
            forcedBy = request.staffId();
            forcedReason = request.forcedReason().trim();
        } else {
            allowedFrom = List.of(OrderStatus.SERVING);
        }

        int updated = orderRepository.markCompleted(orderId, venueId, allowedFrom, OrderStatus.COMPLETED,
                request.forced(), forcedBy, forcedReason, LocalDateTime.now());
        if (updated == 0) {
            Order current = getOrder(orderId, venueId);
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    "Order " + orderId + " is " + current.getOrderStatus() + "; cannot complete"
                            + (request.forced() ? "" : " (expected SERVING)"));
        }

        tableSessionManager.freeForOrder(venueId, orderId);

        if (request.forced()) {
            log.warn("Order force-completed: orderId={}, venueId={}, by={}, role={}, reason={}",
                    orderId, venueId, forcedBy, request.role(), forcedReason);
        } else {
            log.info("Order completed: orderId={}, venueId={}", orderId, venueId);
        }

        Order order = getOrder(orderId, venueId);
        eventPublisher.publishEvent(OrderStatusChangedEvent.of(order));
        return order;
    }

    /**
     * 주문 취소. 결제 상태는 건드리지 않는다 (결제된 주문의 환불은 별도 작업).
     */
    @Transactional
    public Order cancelOrder(String orderId, String venueId, String reason) {
        int updated = orderRepository.markCancelled(orderId, venueId, OrderStatus.nonTerminal(),
                OrderStatus.CANCELLED, reason, LocalDateTime.now());
        if (updated == 0) {
            Order current = getOrder(orderId, venueId);
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    "Order " + orderId + " is already " + current.getOrderStatus());
        }

        tableSessionManager.freeForOrder(venueId, orderId);

        Order order = getOrder(orderId, venueId);
        eventPublisher.publishEvent(OrderStatusChangedEvent.of(order));
        log.info("Order cancelled: orderId={}, venueId={}, paymentStatus={}, reason={}",
                orderId, venueId, order.getPaymentStatus(), reason);
        return order;
    }

    /**
     * 체크아웃 세션 연결. 결제 웹훅이 sessionRef로 주문을 찾을 수 있게 한다.
     * 같은 세션으로 다시 호출하면 그대로 성공한다.
     */
    @Transactional
    public Order attachCheckoutSession(String orderId, String venueId, String sessionRef) {
        if (sessionRef == null || sessionRef.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "sessionRef is required");
        }
        int updated = orderRepository.bindSessionRef(orderId, venueId, sessionRef, PaymentStatus.UNPAID, LocalDateTime.now());
        if (updated == 0) {
            Order current = getOrder(orderId, venueId);
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    "Order " + orderId + " (" + current.getPaymentStatus() + ") is already bound to another payment session");
        }
        return getOrder(orderId, venueId);
    }

    /**
     * 결제 반영 (UNPAID → PAID). 이미 결제된 주문이면 INVALID_TRANSITION.
     * 정산 핸들러는 이 코드를 "이미 반영됨"으로 취급한다.
     */
    @Transactional
    public Order applyPayment(String orderId, String venueId, String externalSessionRef, String externalPaymentRef) {
        int updated = orderRepository.markPaid(orderId, venueId, externalSessionRef, externalPaymentRef,
                PaymentStatus.UNPAID, PaymentStatus.PAID, LocalDateTime.now());
        if (updated == 0) {
            Order current = getOrder(orderId, venueId);
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    "Order " + orderId + " is already " + current.getPaymentStatus());
        }

        Order order = getOrder(orderId, venueId);
        eventPublisher.publishEvent(OrderStatusChangedEvent.of(order));
        log.info("Payment applied: orderId={}, sessionRef={}, paymentRef={}, amount={}",
                orderId, externalSessionRef, externalPaymentRef, order.getTotalAmount());
        return order;
    }

    /**
     * 환불 반영. amount가 null이면 남은 잔액 전부.
     * 직전에 읽은 누적 환불액 기준 조건부 UPDATE이므로 동시 환불이 잔액을 넘길 수 없다.
     */
    @Transactional
    public Order applyRefund(String orderId, String venueId, Long amount, String reason, String refundRef) {
        Order order = getOrder(orderId, venueId);
        long refundAmount = quoteRefund(order, amount);

        long cumulative = order.getRefundAmount() + refundAmount;
        PaymentStatus next = cumulative < order.getTotalAmount() ? PaymentStatus.PARTIALLY_REFUNDED : PaymentStatus.REFUNDED;
        writeRefund(order, cumulative, next, refundRef, reason);

        Order refunded = getOrder(orderId, venueId);
        eventPublisher.publishEvent(OrderStatusChangedEvent.of(refunded));
        log.info("Refund applied: orderId={}, amount={}, cumulative={}, status={}, refundRef={}",
                orderId, refundAmount, cumulative, next, refundRef);
        return refunded;
    }

    /**
     * 결제 대행사 쪽에서 이미 처리된 환불을 로컬 상태에 맞춘다. 앞으로만 움직이고 되돌리지 않는다.
     *
     * @param cumulativeRefunded 대행사가 보고한 누적 환불액
     */
    @Transactional
    public Order reconcileUpstreamRefund(String orderId, String venueId, long cumulativeRefunded, String refundRef) {
        Order order = getOrder(orderId, venueId);
        if (order.getPaymentStatus() == PaymentStatus.UNPAID) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    "Order " + orderId + " is UNPAID locally; cannot reconcile an upstream refund");
        }

        long target = Math.min(cumulativeRefunded, order.getTotalAmount());
        if (target <= order.getRefundAmount()) {
            log.debug("Upstream refund already reflected: orderId={}, local={}, upstream={}",
                    orderId, order.getRefundAmount(), cumulativeRefunded);
            return order;
        }

        PaymentStatus next = target < order.getTotalAmount() ? PaymentStatus.PARTIALLY_REFUNDED : PaymentStatus.REFUNDED;
        writeRefund(order, target, next, refundRef, null);

        Order reconciled = getOrder(orderId, venueId);
        eventPublisher.publishEvent(OrderStatusChangedEvent.of(reconciled));
        log.warn("Local refund state reconciled to processor: orderId={}, refunded={}, status={}",
                orderId, target, next);
        return reconciled;
    }

    public Order getOrder(String orderId, String venueId) {
        return orderRepository.findByIdAndVenueId(orderId, venueId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND,
                        "Order " + orderId + " not found in venue " + venueId));
    }

    public List<Order> listOrders(String venueId, OrderStatus orderStatus, PaymentStatus paymentStatus) {
        return orderRepository.search(venueId, orderStatus, paymentStatus);
    }

    /**
     * 요청 환불액을 확정한다. amount가 null이면 남은 잔액 전부.
     * 결제 대행사 호출 전에 RefundService도 같은 검사를 거친다.
     */
    public long quoteRefund(Order order, Long amount) {
        PaymentStatus current = order.getPaymentStatus();
        if (current == PaymentStatus.UNPAID) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION, "Order " + order.getId() + " has not been paid");
        }
        if (amount != null && amount <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Refund amount must be positive");
        }
        long remaining = order.getRefundableBalance();
        long refundAmount = amount != null ? amount : remaining;
        if (refundAmount <= 0 || refundAmount > remaining) {
            throw new BusinessException(ErrorCode.REFUND_EXCEEDS_BALANCE,
                    "Refund " + refundAmount + " exceeds remaining balance " + remaining);
        }
        return refundAmount;
    }

    private void writeRefund(Order observed, long cumulative, PaymentStatus next, String refundRef, String reason) {
        int updated = orderRepository.applyRefund(observed.getId(), observed.getVenueId(),
                observed.getRefundAmount(), cumulative, next, refundRef, reason,
                List.of(PaymentStatus.PAID, PaymentStatus.PARTIALLY_REFUNDED), LocalDateTime.now());
        if (updated == 0) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    "Refund state of order " + observed.getId() + " changed concurrently; reload and retry");
        }
    }

    /** 클라이언트 총액이 허용 오차 안이면 그 값을, 아니면 서버 계산값을 쓴다. */
    private long resolveTotal(long computed, Long clientTotal, String venueId) {
        if (clientTotal == null) {
            return computed;
        }
        if (Math.abs(clientTotal - computed) <= TOTAL_TOLERANCE) {
            return clientTotal;
        }
        log.warn("Client total mismatch, using computed total: venueId={}, client={}, computed={}",
                venueId, clientTotal, computed);
        return computed;
    }

    private void validateShape(CreateOrderCommand command) {
        if (command.fulfillmentType() == null || command.paymentMethod() == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "fulfillmentType and paymentMethod are required");
        }
        if (command.items() == null || command.items().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Order must contain at least one item");
        }
        for (CreateOrderCommand.Line line : command.items()) {
            if (line.quantity() <= 0 || line.unitPrice() < 0 || line.name() == null || line.name().isBlank()) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        "Invalid order line: quantity must be positive, price non-negative, name present");
            }
        }
        if (command.fulfillmentType() == FulfillmentType.TABLE
                && (command.tableRef() == null || command.tableRef().isBlank())) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "tableRef is required for table orders");
        }
        if (command.clientTotal() != null && command.clientTotal() < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "total must not be negative");
        }
    }
}
