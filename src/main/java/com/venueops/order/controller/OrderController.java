package com.venueops.order.controller;

import com.venueops.common.auth.StaffRole;
import com.venueops.common.dto.ApiResponse;
import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import com.venueops.idempotency.service.IdempotencyStore;
import com.venueops.idempotency.service.IdempotentResponse;
import com.venueops.idempotency.service.RequestFingerprint;
import com.venueops.order.dto.*;
import com.venueops.order.entity.OrderStatus;
import com.venueops.order.entity.PaymentStatus;
import com.venueops.order.service.CompletionRequest;
import com.venueops.order.service.OrderService;
import com.venueops.payment.dto.RefundResponse;
import com.venueops.payment.service.RefundService;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * 주문 API.
 *
 * <h3>멱등성</h3>
 * <p>주문 생성과 환불은 IdempotencyStore로 감싼다. 키는 {@code Idempotency-Key} 헤더를 우선 쓰고,
 * 없으면 생성은 body의 clientReference로, 환불은 주문 ID와 금액으로 만든다.
 * 재전송 요청은 첫 응답과 같은 상태 코드와 본문을 받고 {@code Idempotent-Replayed: true} 헤더가 붙는다.</p>
 *
 * <p>{@code X-Staff-Id} / {@code X-Staff-Role}은 앞단 인증 계층이 채운다.</p>
 */
@RestController
@RequestMapping("/api/venues/{venueId}/orders")
@RequiredArgsConstructor
public class OrderController {

    private static final String REPLAYED_HEADER = "Idempotent-Replayed";

    private final OrderService orderService;
    private final RefundService refundService;
    private final IdempotencyStore idempotencyStore;

    @PostMapping
    @RateLimiter(name = "orderApi")
    public ResponseEntity<ApiResponse<CreateOrderResponse>> createOrder(
            @PathVariable String venueId,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey,
            @Valid @RequestBody CreateOrderRequest request) {

        String key = "order.create:" + resolveCreateKey(venueId, idempotencyKey, request);
        IdempotentResponse<CreateOrderResponse> response = idempotencyStore.execute(
                key, "order.create", Map.of("venueId", venueId, "request", request),
                CreateOrderResponse.class, HttpStatus.CREATED.value(),
                () -> CreateOrderResponse.from(orderService.createOrder(request.toCommand(venueId))));

        return ResponseEntity.status(response.status())
                .header(REPLAYED_HEADER, String.valueOf(response.replayed()))
                .body(ApiResponse.ok(response.body()));
    }

    @GetMapping("/{orderId}")
    public ApiResponse<OrderResponse> getOrder(@PathVariable String venueId, @PathVariable String orderId) {
        return ApiResponse.ok(OrderResponse.from(orderService.getOrder(orderId, venueId)));
    }

    @GetMapping
    public ApiResponse<List<OrderResponse>> listOrders(@PathVariable String venueId,
                                                       @RequestParam(required = false) OrderStatus orderStatus,
                                                       @RequestParam(required = false) PaymentStatus paymentStatus) {
        return ApiResponse.ok(orderService.listOrders(venueId, orderStatus, paymentStatus).stream()
                .map(OrderResponse::from)
                .toList());
    }

    @PostMapping("/{orderId}/advance")
    public ApiResponse<OrderResponse> advance(@PathVariable String venueId, @PathVariable String orderId,
                                              @Valid @RequestBody AdvanceOrderRequest request) {
        return ApiResponse.ok(OrderResponse.from(orderService.advanceStatus(orderId, venueId, request.nextStatus())));
    }

    @PostMapping("/{orderId}/complete")
    public ApiResponse<OrderResponse> complete(@PathVariable String venueId, @PathVariable String orderId,
                                               @RequestHeader(value = "X-Staff-Id", required = false) String staffId,
                                               @RequestHeader(value = "X-Staff-Role", required = false) StaffRole role,
                                               @RequestBody(required = false) CompleteOrderRequest request) {
        CompletionRequest completion = request != null && request.isForced()
                ? new CompletionRequest(true, request.forcedReason(), staffId, role)
                : CompletionRequest.normal(staffId, role);
        return ApiResponse.ok(OrderResponse.from(orderService.completeOrder(orderId, venueId, completion)));
    }

    @PostMapping("/{orderId}/cancel")
    public ApiResponse<OrderResponse> cancel(@PathVariable String venueId, @PathVariable String orderId,
                                             @Valid @RequestBody(required = false) CancelOrderRequest request) {
        String reason = request != null ? request.reason() : null;
        return ApiResponse.ok(OrderResponse.from(orderService.cancelOrder(orderId, venueId, reason)));
    }

    /** 결제 대행사 체크아웃 세션 연결 */
    @PostMapping("/{orderId}/checkout-session")
    public ApiResponse<OrderResponse> attachCheckoutSession(@PathVariable String venueId, @PathVariable String orderId,
                                                            @Valid @RequestBody CheckoutSessionRequest request) {
        return ApiResponse.ok(OrderResponse.from(
                orderService.attachCheckoutSession(orderId, venueId, request.sessionRef())));
    }

    @PostMapping("/{orderId}/refund")
    @RateLimiter(name = "orderApi")
    public ResponseEntity<ApiResponse<RefundResponse>> refund(
            @PathVariable String venueId, @PathVariable String orderId,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey,
            @Valid @RequestBody(required = false) RefundOrderRequest request) {

        Long amount = request != null ? request.amount() : null;
        String reason = request != null ? request.reason() : null;
        String key = resolveRefundKey(orderId, idempotencyKey, request);

        IdempotentResponse<RefundResponse> response = idempotencyStore.execute(
                key, "order.refund", Map.of("venueId", venueId, "orderId", orderId, "amount", amount != null ? amount : "full"),
                RefundResponse.class, HttpStatus.OK.value(),
                () -> RefundResponse.from(refundService.refund(orderId, venueId, amount, reason, key)));

        return ResponseEntity.status(response.status())
                .header(REPLAYED_HEADER, String.valueOf(response.replayed()))
                .body(ApiResponse.ok(response.body()));
    }

    private String resolveCreateKey(String venueId, String idempotencyKey, CreateOrderRequest request) {
        if (idempotencyKey != null && !idempotencyKey.isBlank()) {
            return venueId + ":" + idempotencyKey;
        }
        if (request.clientReference() != null && !request.clientReference().isBlank()) {
            return venueId + ":ref:" + RequestFingerprint.sha256Hex(venueId + "|" + request.clientReference());
        }
        throw new BusinessException(ErrorCode.INVALID_INPUT,
                "Idempotency-Key header or clientReference is required to create an order");
    }

    private String resolveRefundKey(String orderId, String idempotencyKey, RefundOrderRequest request) {
        if (idempotencyKey != null && !idempotencyKey.isBlank()) {
            return "refund:" + orderId + ":" + idempotencyKey;
        }
        if (request != null && request.clientReference() != null && !request.clientReference().isBlank()) {
            return "refund:" + orderId + ":ref:" + RequestFingerprint.sha256Hex(orderId + "|" + request.clientReference());
        }
        throw new BusinessException(ErrorCode.INVALID_INPUT,
                "Idempotency-Key header or clientReference is required to refund an order");
    }
}
