package com.venueops.order.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 주문 엔티티.
 *
 * <p>orderStatus / paymentStatus는 엔티티 setter가 아니라 OrderRepository의
 * 조건부 UPDATE로만 바뀐다. 엔티티에는 생성 시점의 상태 구성 로직만 있다.</p>
 *
 * <p>금액 필드는 모두 최소 화폐 단위(long)이다.</p>
 */
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_orders_venue_created", columnList = "venue_id, created_at"),
        @Index(name = "idx_orders_session_ref", columnList = "external_session_ref"),
        @Index(name = "idx_orders_payment_ref", columnList = "external_payment_ref")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Order {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "venue_id", nullable = false, length = 64)
    private String venueId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private FulfillmentType fulfillmentType;

    private String tableRef;

    // 테이블 주문일 때 열린/바인딩된 세션
    @Column(length = 36)
    private String tableSessionId;

    private String counterLabel;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private QrType qrType;

    // TABLE_COLLECTION: 카운터에서 수령 필요
    private boolean requiresCollection;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private OrderSource source;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderColumn(name = "line_no")
    private List<OrderItem> items = new ArrayList<>();

    @Column(nullable = false)
    private long totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private OrderStatus orderStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 24)
    private PaymentStatus paymentStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PaymentMethod paymentMethod;

    // 생성 시 paymentMethod로부터 한 번 결정
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private PaymentMode paymentMode;

    private String customerName;
    private String customerPhone;
    private String customerEmail;

    @Column(name = "external_session_ref")
    private String externalSessionRef;

    @Column(name = "external_payment_ref")
    private String externalPaymentRef;

    private LocalDateTime paidAt;

    private String refundRef;

    @Column(nullable = false)
    private long refundAmount;

    private String refundReason;
    private LocalDateTime refundedAt;

    private String cancelReason;
    private LocalDateTime cancelledAt;

    private LocalDateTime completedAt;

    // 강제 완료 감사 필드
    private boolean forcedCompletion;
    private String forcedBy;
    private String forcedReason;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    @Builder
    public Order(String venueId, FulfillmentType fulfillmentType, String tableRef, String counterLabel,
                 QrType qrType, OrderSource source, PaymentMethod paymentMethod,
                 String customerName, String customerPhone, String customerEmail) {
        this.id = UUID.randomUUID().toString();
        this.venueId = venueId;
        this.fulfillmentType = fulfillmentType;
        this.tableRef = tableRef;
        this.counterLabel = counterLabel;
        this.qrType = qrType;
        this.requiresCollection = qrType == QrType.TABLE_COLLECTION;
        this.source = source;
        this.paymentMethod = paymentMethod;
        this.paymentMode = paymentMethod.toMode();
        this.customerName = customerName;
        this.customerPhone = customerPhone;
        this.customerEmail = customerEmail;
        this.orderStatus = OrderStatus.PLACED;
        this.paymentStatus = PaymentStatus.UNPAID;
        this.totalAmount = 0L;
        this.refundAmount = 0L;
    }

    public void addItem(OrderItem item) {
        items.add(item);
        item.setOrder(this);
    }

    /** 항목 합계 (최소 화폐 단위, overflow 시 ArithmeticException) */
    public long computeItemsTotal() {
        long sum = 0L;
        for (OrderItem item : items) {
            sum = Math.addExact(sum, item.getSubtotal());
        }
        return sum;
    }

    /** 생성 시점에만 호출. 이후 총액은 바뀌지 않는다. */
    public void settleTotal(long totalAmount) {
        this.totalAmount = totalAmount;
    }

    public void attachTableSession(String tableSessionId) {
        this.tableSessionId = tableSessionId;
    }

    public long getRefundableBalance() {
        return totalAmount - refundAmount;
    }
}
