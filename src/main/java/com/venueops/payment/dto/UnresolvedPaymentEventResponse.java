package com.venueops.payment.dto;

import com.venueops.payment.entity.UnresolvedPaymentEvent;

import java.time.LocalDateTime;

public record UnresolvedPaymentEventResponse(
        Long id,
        String eventType,
        String sessionRef,
        String paymentRef,
        Long amountTotal,
        int candidateCount,
        String reason,
        LocalDateTime receivedAt
) {
    public static UnresolvedPaymentEventResponse from(UnresolvedPaymentEvent event) {
        return new UnresolvedPaymentEventResponse(event.getId(), event.getEventType(), event.getSessionRef(),
                event.getPaymentRef(), event.getAmountTotal(), event.getCandidateCount(),
                event.getReason(), event.getReceivedAt());
    }
}
