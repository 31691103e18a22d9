package com.venueops.payment.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;

import java.util.Map;

/**
 * 결제 대행사 HTTP 클라이언트 (OpenFeign).
 *
 * <p>직접 호출하지 말고 {@link PaymentProcessorGateway}를 통해 호출한다.
 * 재시도와 오류 분류(일시 장애 / 확정 거절)가 게이트웨이에 있다.</p>
 */
@FeignClient(name = "payment-processor", url = "${payment-processor.url:http://localhost:8090}")
public interface PaymentProcessorClient {

    /** 체크아웃 세션 조회 - 웹훅에 결제 참조가 빠졌을 때 보충용 */
    @GetMapping("/v1/checkout/sessions/{sessionRef}")
    CheckoutSessionResponse retrieveSession(@PathVariable("sessionRef") String sessionRef);

    /** 환불 생성. 같은 Idempotency-Key 재전송은 대행사가 중복 환불하지 않는다. */
    @PostMapping("/v1/refunds")
    RefundResponse createRefund(@RequestHeader("Idempotency-Key") String idempotencyKey,
                                @RequestBody RefundRequest request);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CheckoutSessionResponse(String id, String paymentStatus, String paymentRef,
                                   Long amountTotal, Map<String, String> metadata) {}

    record RefundRequest(String paymentRef, long amount, String reason) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RefundResponse(String id, long amount, String status) {}
}
