package com.venueops.payment.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 주문과 매칭하지 못한 결제 이벤트. 스태프가 수동으로 확인한다.
 *
 * <p>후보가 0개이거나 2개 이상이면 어떤 주문도 건드리지 않고 여기에 기록만 한다.</p>
 */
@Entity
@Table(name = "unresolved_payment_events", indexes = {
        @Index(name = "idx_unresolved_venue_resolved", columnList = "venueId, resolved")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UnresolvedPaymentEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "unresolved_payment_event_seq")
    @SequenceGenerator(name = "unresolved_payment_event_seq", sequenceName = "unresolved_payment_event_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false, length = 64)
    private String eventType;

    private String eventId;
    private String sessionRef;
    private String paymentRef;
    private String venueId;
    private Long amountTotal;

    private int candidateCount;

    @Column(nullable = false)
    private String reason;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false)
    private LocalDateTime receivedAt;

    private boolean resolved;

    @Builder
    public UnresolvedPaymentEvent(String eventType, String eventId, String sessionRef, String paymentRef,
                                  String venueId, Long amountTotal, int candidateCount,
                                  String reason, String payload) {
        this.eventType = eventType;
        this.eventId = eventId;
        this.sessionRef = sessionRef;
        this.paymentRef = paymentRef;
        this.venueId = venueId;
        this.amountTotal = amountTotal;
        this.candidateCount = candidateCount;
        this.reason = reason;
        this.payload = payload;
        this.receivedAt = LocalDateTime.now();
        this.resolved = false;
    }
}
