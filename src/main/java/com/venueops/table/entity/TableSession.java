package com.venueops.table.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 테이블 세션 - 테이블 점유 상태와 바인딩된 주문.
 *
 * <h3>단일 오픈 세션 보장</h3>
 * <p>{@code openKey}는 세션이 열려 있는 동안에만 {@code venueId:tableRef} 값을 갖고,
 * 닫히면 null이 된다. 이 컬럼의 UNIQUE 제약으로 (venue, table)당 열린 세션이
 * 하나뿐임을 DB가 보장한다. (NULL은 UNIQUE 비교 대상이 아니므로 닫힌 세션은 여러 개 가능)</p>
 */
@Entity
@Table(name = "table_sessions", indexes = {
        @Index(name = "idx_table_session_bound_order", columnList = "venue_id, bound_order_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TableSession {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "venue_id", nullable = false, length = 64)
    private String venueId;

    @Column(nullable = false)
    private String tableRef;

    @Column(unique = true)
    private String openKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TableSessionStatus status;

    @Column(name = "bound_order_id", length = 36)
    private String boundOrderId;

    @Column(nullable = false)
    private LocalDateTime openedAt;

    private LocalDateTime closedAt;

    private TableSession(String venueId, String tableRef, String boundOrderId) {
        this.id = UUID.randomUUID().toString();
        this.venueId = venueId;
        this.tableRef = tableRef;
        this.openKey = openKeyOf(venueId, tableRef);
        this.boundOrderId = boundOrderId;
        this.status = boundOrderId != null ? TableSessionStatus.OCCUPIED : TableSessionStatus.RESERVED;
        this.openedAt = LocalDateTime.now();
    }

    /** 주문이 바인딩된 채로 열린 세션 */
    public static TableSession openFor(String venueId, String tableRef, String orderId) {
        return new TableSession(venueId, tableRef, orderId);
    }

    /** 주문 없이 열린 세션 (예약, 착석 후 주문 전) */
    public static TableSession reserve(String venueId, String tableRef) {
        return new TableSession(venueId, tableRef, null);
    }

    public static String openKeyOf(String venueId, String tableRef) {
        return venueId + ":" + tableRef;
    }

    public boolean isBoundTo(String orderId) {
        return orderId != null && orderId.equals(boundOrderId);
    }
}
