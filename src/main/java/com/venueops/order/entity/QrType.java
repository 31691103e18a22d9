package com.venueops.order.entity;

/**
 * 주문이 들어온 QR 코드의 종류.
 */
public enum QrType {
    TABLE_FULL_SERVICE(FulfillmentType.TABLE),   // 테이블에서 주문, 테이블로 서빙
    TABLE_COLLECTION(FulfillmentType.TABLE),     // 테이블에서 주문, 카운터에서 수령
    TABLE_RESERVATION(FulfillmentType.TABLE),    // 예약 연동 테이블 주문
    COUNTER_PICKUP(FulfillmentType.COUNTER);     // 카운터 픽업

    private final FulfillmentType fulfillmentType;

    QrType(FulfillmentType fulfillmentType) {
        this.fulfillmentType = fulfillmentType;
    }

    public boolean supports(FulfillmentType type) {
        return fulfillmentType == type;
    }

    public static QrType defaultFor(FulfillmentType type) {
        return type == FulfillmentType.TABLE ? TABLE_FULL_SERVICE : COUNTER_PICKUP;
    }
}
