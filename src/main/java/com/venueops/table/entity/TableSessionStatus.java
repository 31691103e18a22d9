package com.venueops.table.entity;

public enum TableSessionStatus {
    FREE,       // 세션 종료 (테이블 비어 있음)
    RESERVED,   // 열려 있지만 아직 주문이 바인딩되지 않음
    OCCUPIED    // 주문이 바인딩된 상태
}
