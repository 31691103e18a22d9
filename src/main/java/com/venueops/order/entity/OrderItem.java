package com.venueops.order.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "order_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "order_item_seq")
    @SequenceGenerator(name = "order_item_seq", sequenceName = "order_item_seq", allocationSize = 50)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id")
    @Setter(AccessLevel.PACKAGE)
    private Order order;

    // 메뉴 카탈로그 밖의 즉석 항목이면 null
    private String menuItemId;

    @Column(nullable = false)
    private String name;

    // 최소 화폐 단위 (cents)
    @Column(nullable = false)
    private long unitPrice;

    @Column(nullable = false)
    private int quantity;

    private String note;

    @Builder
    public OrderItem(String menuItemId, String name, long unitPrice, int quantity, String note) {
        this.menuItemId = menuItemId;
        this.name = name;
        this.unitPrice = unitPrice;
        this.quantity = quantity;
        this.note = note;
    }

    public long getSubtotal() {
        return Math.multiplyExact(unitPrice, (long) quantity);
    }
}
