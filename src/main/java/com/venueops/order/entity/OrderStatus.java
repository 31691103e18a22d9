package com.venueops.order.entity;

import java.util.List;

/**
 * 주문 상태.
 *
 * <pre>
 *   PLACED → IN_PREP → READY → SERVING → COMPLETED
 *      └────────┴────────┴───────┴──→ CANCELLED
 * </pre>
 *
 * COMPLETED, CANCELLED는 종료 상태이며 되돌릴 수 없다.
 */
public enum OrderStatus {
    PLACED,
    IN_PREP,
    READY,
    SERVING,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /** 단계 진행(advance)으로 이 상태에 들어올 수 있는 직전 상태. 진행으로 도달할 수 없으면 null. */
    public OrderStatus predecessor() {
        return switch (this) {
            case IN_PREP -> PLACED;
            case READY -> IN_PREP;
            case SERVING -> READY;
            case PLACED, COMPLETED, CANCELLED -> null;
        };
    }

    public static List<OrderStatus> nonTerminal() {
        return List.of(PLACED, IN_PREP, READY, SERVING);
    }
}
