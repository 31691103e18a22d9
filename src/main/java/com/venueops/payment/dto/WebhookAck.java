package com.venueops.payment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 웹훅 응답. 처리/재전송/무시/미해결 모두 200으로 응답해 대행사의 무한 재전송을 막는다.
 *
 * @param code UNRESOLVED일 때 UNRESOLVED_PAYMENT_EVENT
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookAck(
        boolean received,
        ReconciliationOutcome outcome,
        List<String> orderIds,
        String code,
        String detail,
        boolean replayed
) {
    public static WebhookAck of(ReconciliationOutcome outcome, List<String> orderIds) {
        return new WebhookAck(true, outcome, orderIds, null, null, false);
    }

    public static WebhookAck ignored(String type) {
        return new WebhookAck(true, ReconciliationOutcome.IGNORED, List.of(), null, "Event type " + type + " is not handled", false);
    }

    public static WebhookAck unresolved(String code, String detail) {
        return new WebhookAck(true, ReconciliationOutcome.UNRESOLVED, List.of(), code, detail, false);
    }

    public WebhookAck asReplay() {
        return new WebhookAck(received, outcome, orderIds, code, detail, true);
    }
}
