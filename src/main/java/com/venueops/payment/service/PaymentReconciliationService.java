package com.venueops.payment.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import com.venueops.idempotency.service.IdempotencyStore;
import com.venueops.idempotency.service.IdempotentResponse;
import com.venueops.order.entity.Order;
import com.venueops.order.entity.OrderStatus;
import com.venueops.order.entity.PaymentStatus;
import com.venueops.order.repository.OrderRepository;
import com.venueops.order.service.OrderService;
import com.venueops.payment.client.PaymentProcessorClient;
import com.venueops.payment.client.PaymentProcessorGateway;
import com.venueops.payment.dto.PaymentWebhookEvent;
import com.venueops.payment.dto.ReconciliationOutcome;
import com.venueops.payment.dto.WebhookAck;
import com.venueops.payment.entity.UnresolvedPaymentEvent;
import com.venueops.payment.repository.UnresolvedPaymentEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;

/**
 * 결제 정산 핸들러 (Payment Reconciliation Handler)
 *
 * <p>결제 대행사 웹훅을 주문 결제 상태로 반영한다. 대행사는 같은 이벤트를 여러 번 보낼 수 있으므로
 * 주문 조회 전에 멱등성 가드를 먼저 건다.</p>
 *
 * <h3>처리 흐름</h3>
 * <pre>
 *   1. 구조 검증 (type, sessionRef 필수)          → 실패 시 INVALID_INPUT (4xx)
 *   2. 처리 대상이 아닌 이벤트 종류                 → IGNORED
 *   3. 멱등성 가드 webhook:payment:&lt;sessionRef&gt; → 재전송이면 저장된 응답 그대로
 *   4. 주문 찾기
 *        a. externalSessionRef로 연결된 주문
 *        b. metadata orderId / orderIds (테이블 일괄 결제)
 *        c. fallback: 같은 매장, 최근 N분, 미결제/미연결, 금액 일치 주문이 정확히 1개
 *   5. 주문별 applyPayment (같은 세션의 "이미 결제됨"은 성공, 다른 세션이면 미해결)
 *   6. 찾지 못하면 UnresolvedPaymentEvent 기록 후 UNRESOLVED 응답 (아무 주문도 건드리지 않음)
 * </pre>
 *
 * <p>처리 중 예외가 나면 멱등성 예약이 해제되고 예외가 전파된다. 대행사가 재전송하면 다시 처리된다.</p>
 */
@Slf4j
@Service
public class PaymentReconciliationService {

    static final String OPERATION = "payment.webhook";

    private final OrderService orderService;
    private final OrderRepository orderRepository;
    private final UnresolvedPaymentEventRepository unresolvedRepository;
    private final IdempotencyStore idempotencyStore;
    private final PaymentProcessorGateway processorGateway;
    private final ObjectMapper objectMapper;
    private final Duration fallbackWindow;

    public PaymentReconciliationService(OrderService orderService,
                                        OrderRepository orderRepository,
                                        UnresolvedPaymentEventRepository unresolvedRepository,
                                        IdempotencyStore idempotencyStore,
                                        PaymentProcessorGateway processorGateway,
                                        ObjectMapper objectMapper,
                                        @Value("${venue-ops.reconciliation.fallback-window:PT10M}") Duration fallbackWindow) {
        this.orderService = orderService;
        this.orderRepository = orderRepository;
        this.unresolvedRepository = unresolvedRepository;
        this.idempotencyStore = idempotencyStore;
        this.processorGateway = processorGateway;
        this.objectMapper = objectMapper;
        this.fallbackWindow = fallbackWindow;
    }

    public WebhookAck handle(PaymentWebhookEvent event) {
        validateStructure(event);

        if (!event.isPaymentSuccess() && !event.isRefund()) {
            log.debug("Webhook ignored: type={}, sessionRef={}", event.type(), event.sessionRef());
            return WebhookAck.ignored(event.type());
        }

        IdempotentResponse<WebhookAck> response = idempotencyStore.execute(
                guardKey(event), OPERATION, fingerprintPayload(event), WebhookAck.class, 200,
                () -> event.isRefund() ? reconcileRefund(event) : reconcilePayment(event));

        if (response.replayed()) {
            log.info("Webhook replay acknowledged: type={}, sessionRef={}", event.type(), event.sessionRef());
            return response.body().asReplay();
        }
        return response.body();
    }

    /**
     * 결제 완료 이벤트. 세션 연결 주문과 메타데이터 주문을 모두 대상으로 한다.
     */
    WebhookAck reconcilePayment(PaymentWebhookEvent event) {
        String sessionRef = event.sessionRef();
        String paymentRef = event.paymentRef();
        List<String> metadataOrderIds = event.orderIds();

        if (paymentRef == null) {
            PaymentProcessorClient.CheckoutSessionResponse session = processorGateway.retrieveSession(sessionRef);
            paymentRef = session.paymentRef();
            if (metadataOrderIds.isEmpty() && session.metadata() != null) {
                metadataOrderIds = new PaymentWebhookEvent.Metadata(
                        session.metadata().get("orderId"), session.metadata().get("orderIds"), null).allOrderIds();
            }
        }

        Map<String, Order> targets = new LinkedHashMap<>();
        for (Order order : orderRepository.findByExternalSessionRef(sessionRef)) {
            targets.put(order.getId(), order);
        }
        for (String orderId : metadataOrderIds) {
            if (targets.containsKey(orderId)) {
                continue;
            }
            Optional<Order> order = orderRepository.findById(orderId);
            if (order.isEmpty()) {
                log.warn("Webhook metadata references unknown order: orderId={}, sessionRef={}", orderId, sessionRef);
            } else if (event.venueId() != null && !event.venueId().equals(order.get().getVenueId())) {
                log.warn("Webhook metadata order belongs to another venue: orderId={}, eventVenue={}, orderVenue={}",
                        orderId, event.venueId(), order.get().getVenueId());
            } else {
                targets.put(orderId, order.get());
            }
        }

        if (targets.isEmpty()) {
            if (!metadataOrderIds.isEmpty()) {
                return recordUnresolved(event, 0, "Metadata order ids " + metadataOrderIds + " did not match any order");
            }
            return reconcileByFallback(event, paymentRef);
        }

        if (targets.size() == 1 && event.amountTotal() != null) {
            Order only = targets.values().iterator().next();
            if (only.getTotalAmount() != event.amountTotal()) {
                log.warn("Paid amount differs from order total: orderId={}, total={}, paid={}",
                        only.getId(), only.getTotalAmount(), event.amountTotal());
            }
        }
        return applyToOrders(event, targets.values(), paymentRef);
    }

    /**
     * 상관관계 정보가 전혀 없을 때의 휴리스틱 매칭. 후보가 정확히 1개일 때만 반영한다.
     */
    private WebhookAck reconcileByFallback(PaymentWebhookEvent event, String paymentRef) {
        String venueId = event.venueId();
        if (venueId == null || event.amountTotal() == null) {
            return recordUnresolved(event, 0, "No correlation metadata, venue or amount to match on");
        }

        long amount = event.amountTotal();
        List<Order> candidates = orderRepository.findFallbackCandidates(venueId,
                        LocalDateTime.now().minus(fallbackWindow), PaymentStatus.UNPAID, OrderStatus.CANCELLED)
                .stream()
                .filter(order -> order.getTotalAmount() == amount)
                .toList();

        if (candidates.size() != 1) {
            return recordUnresolved(event, candidates.size(),
                    candidates.isEmpty()
                            ? "No unpaid order at venue matches amount " + amount
                            : candidates.size() + " unpaid orders at venue match amount " + amount);
        }

        Order match = candidates.get(0);
        log.warn("Payment matched by fallback: orderId={}, venueId={}, amount={}, sessionRef={}",
                match.getId(), venueId, amount, event.sessionRef());
        return applyToOrders(event, List.of(match), paymentRef);
    }

    /**
     * "이미 결제됨"은 같은 세션의 재전송/경합일 때만 성공으로 본다.
     * 다른 세션으로 이미 결제된 주문에 들어온 결제는 미해결로 기록한다.
     */
    private WebhookAck applyToOrders(PaymentWebhookEvent event, Collection<Order> orders, String paymentRef) {
        String sessionRef = event.sessionRef();
        List<String> orderIds = new ArrayList<>();
        List<String> paidElsewhere = new ArrayList<>();
        boolean anyApplied = false;
        for (Order order : orders) {
            try {
                orderService.applyPayment(order.getId(), order.getVenueId(), sessionRef, paymentRef);
                anyApplied = true;
            } catch (BusinessException e) {
                if (e.getErrorCode() != ErrorCode.INVALID_TRANSITION) {
                    throw e;
                }
                String paidSessionRef = orderRepository.findById(order.getId())
                        .map(Order::getExternalSessionRef)
                        .orElse(null);
                if (!sessionRef.equals(paidSessionRef)) {
                    log.warn("Order already paid by another session: orderId={}, paidSessionRef={}, sessionRef={}",
                            order.getId(), paidSessionRef, sessionRef);
                    paidElsewhere.add(order.getId());
                    continue;
                }
                log.info("Payment already applied: orderId={}, sessionRef={}", order.getId(), sessionRef);
            }
            orderIds.add(order.getId());
        }

        if (!paidElsewhere.isEmpty()) {
            WebhookAck unresolved = recordUnresolved(event, paidElsewhere.size(),
                    "Orders " + paidElsewhere + " already paid by another session");
            if (!anyApplied) {
                return unresolved;
            }
        }
        return WebhookAck.of(anyApplied ? ReconciliationOutcome.APPLIED : ReconciliationOutcome.ALREADY_APPLIED, orderIds);
    }

    /**
     * 대행사 쪽 환불 이벤트. 로컬 환불 상태를 대행사 누적 환불액까지 앞으로 맞춘다.
     */
    WebhookAck reconcileRefund(PaymentWebhookEvent event) {
        Optional<Order> order = Optional.empty();
        if (event.paymentRef() != null) {
            order = orderRepository.findFirstByExternalPaymentRef(event.paymentRef());
        }
        if (order.isEmpty()) {
            order = orderRepository.findByExternalSessionRef(event.sessionRef()).stream().findFirst();
        }
        if (order.isEmpty()) {
            return recordUnresolved(event, 0, "No order found for refunded charge");
        }

        Order target = order.get();
        try {
            orderService.reconcileUpstreamRefund(target.getId(), target.getVenueId(),
                    event.amountRefunded(), event.refundRef());
        } catch (BusinessException e) {
            if (e.getErrorCode() != ErrorCode.INVALID_TRANSITION) {
                throw e;
            }
            return recordUnresolved(event, 1, e.getMessage());
        }
        return WebhookAck.of(ReconciliationOutcome.REFUND_RECONCILED, List.of(target.getId()));
    }

    private WebhookAck recordUnresolved(PaymentWebhookEvent event, int candidateCount, String reason) {
        unresolvedRepository.save(UnresolvedPaymentEvent.builder()
                .eventType(event.type())
                .eventId(event.id())
                .sessionRef(event.sessionRef())
                .paymentRef(event.paymentRef())
                .venueId(event.venueId())
                .amountTotal(event.amountTotal())
                .candidateCount(candidateCount)
                .reason(reason)
                .payload(toJson(event))
                .build());
        log.warn("Unresolved payment event recorded: type={}, sessionRef={}, venueId={}, candidates={}, reason={}",
                event.type(), event.sessionRef(), event.venueId(), candidateCount, reason);
        return WebhookAck.unresolved(ErrorCode.UNRESOLVED_PAYMENT_EVENT.name(), reason);
    }

    private void validateStructure(PaymentWebhookEvent event) {
        if (event == null || isBlank(event.type()) || isBlank(event.sessionRef())) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Webhook event requires type and sessionRef");
        }
        if (event.isRefund() && (event.amountRefunded() == null || event.amountRefunded() < 0)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "charge.refunded event requires amountRefunded");
        }
        if (event.amountTotal() != null && event.amountTotal() < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "amountTotal must not be negative");
        }
    }

    /**
     * 결제 완료 이벤트는 종류와 관계없이 세션당 한 번. 환불 이벤트는 부분 환불이 이어질 수 있으므로
     * 누적 환불액까지 키에 포함한다.
     */
    static String guardKey(PaymentWebhookEvent event) {
        if (event.isRefund()) {
            return "webhook:" + event.type() + ":" + event.sessionRef() + ":" + event.amountRefunded();
        }
        return "webhook:payment:" + event.sessionRef();
    }

    /**
     * 같은 세션의 결제 완료 이벤트는 종류마다 실리는 필드가 달라서 세션 참조만 지문에 넣는다.
     */
    static Map<String, Object> fingerprintPayload(PaymentWebhookEvent event) {
        Map<String, Object> payload = new TreeMap<>();
        payload.put("sessionRef", event.sessionRef());
        if (event.isRefund()) {
            payload.put("type", event.type());
            payload.put("paymentRef", event.paymentRef());
            payload.put("amountRefunded", event.amountRefunded());
        }
        return payload;
    }

    private String toJson(PaymentWebhookEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.debug("Could not serialize webhook payload: {}", e.getMessage());
            return event.toString();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
