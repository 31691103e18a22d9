package com.venueops.order.entity;

public enum OrderSource {
    QR,       // 손님이 QR로 직접 주문
    COUNTER,  // 카운터 키오스크/POS
    STAFF     // 스태프 대리 입력
}
