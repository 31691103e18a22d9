package com.venueops.payment.controller;

import com.venueops.common.dto.ApiResponse;
import com.venueops.payment.dto.PaymentWebhookEvent;
import com.venueops.payment.dto.UnresolvedPaymentEventResponse;
import com.venueops.payment.dto.WebhookAck;
import com.venueops.payment.repository.UnresolvedPaymentEventRepository;
import com.venueops.payment.service.PaymentReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 결제 대행사 웹훅 수신.
 *
 * <p>처리됨 / 재전송 / 무시 / 미해결 모두 200을 반환한다. 4xx는 이벤트 구조가 잘못된 경우뿐이고,
 * 5xx는 일시 장애로 대행사 재전송이 필요한 경우다.</p>
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class PaymentWebhookController {

    private final PaymentReconciliationService reconciliationService;
    private final UnresolvedPaymentEventRepository unresolvedRepository;

    @PostMapping("/api/webhooks/payment")
    public ApiResponse<WebhookAck> receive(@RequestBody PaymentWebhookEvent event) {
        log.info("Payment webhook received: id={}, type={}, sessionRef={}",
                event.id(), event.type(), event.sessionRef());
        return ApiResponse.ok(reconciliationService.handle(event));
    }

    /** 스태프 확인용 미해결 결제 이벤트 목록 */
    @GetMapping("/api/venues/{venueId}/payments/unresolved")
    public ApiResponse<List<UnresolvedPaymentEventResponse>> unresolved(@PathVariable String venueId) {
        return ApiResponse.ok(unresolvedRepository.findByVenueIdAndResolvedFalseOrderByReceivedAtDesc(venueId).stream()
                .map(UnresolvedPaymentEventResponse::from)
                .toList());
    }
}
