package com.venueops.payment.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

import java.util.Arrays;
import java.util.List;

/**
 * 결제 대행사 웹훅 이벤트 (서명 검증은 앞단에서 끝난 상태로 들어온다).
 *
 * @param amountTotal    결제 총액 (최소 화폐 단위)
 * @param amountRefunded charge.refunded 이벤트의 누적 환불액
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PaymentWebhookEvent(
        String id,
        @NotBlank String type,
        @NotBlank String sessionRef,
        String paymentRef,
        Metadata metadata,
        Long amountTotal,
        Long amountRefunded,
        String refundRef
) {
    public static final String CHECKOUT_COMPLETED = "checkout.session.completed";
    public static final String PAYMENT_SUCCEEDED = "payment_intent.succeeded";
    public static final String CHARGE_REFUNDED = "charge.refunded";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metadata(String orderId, String orderIds, String venueId) {

        /** orderId와 쉼표로 구분된 orderIds(테이블 일괄 결제)를 합친 목록 */
        public List<String> allOrderIds() {
            String joined = (orderIds != null ? orderIds : "") + "," + (orderId != null ? orderId : "");
            return Arrays.stream(joined.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .distinct()
                    .toList();
        }
    }

    @JsonIgnore
    public boolean isPaymentSuccess() {
        return CHECKOUT_COMPLETED.equals(type) || PAYMENT_SUCCEEDED.equals(type);
    }

    @JsonIgnore
    public boolean isRefund() {
        return CHARGE_REFUNDED.equals(type);
    }

    public List<String> orderIds() {
        return metadata != null ? metadata.allOrderIds() : List.of();
    }

    public String venueId() {
        return metadata != null ? metadata.venueId() : null;
    }
}
