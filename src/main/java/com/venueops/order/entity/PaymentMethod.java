package com.venueops.order.entity;

public enum PaymentMethod {
    PAY_NOW,       // 주문 시 온라인 결제
    PAY_AT_TILL,   // 카운터에서 결제
    PAY_LATER,     // 식사 후 결제 (후불)
    MANUAL;        // 스태프 수기 처리

    /** 결제 모드는 생성 시 한 번 결정되고 바뀌지 않는다. */
    public PaymentMode toMode() {
        return switch (this) {
            case PAY_NOW -> PaymentMode.ONLINE;
            case PAY_AT_TILL, MANUAL -> PaymentMode.OFFLINE;
            case PAY_LATER -> PaymentMode.DEFERRED;
        };
    }
}
