package com.venueops.payment.dto;

public enum ReconciliationOutcome {
    APPLIED,            // 결제 반영
    ALREADY_APPLIED,    // 이미 결제된 주문 (성공으로 취급)
    REFUND_RECONCILED,  // 대행사 환불 상태로 로컬 갱신
    UNRESOLVED,         // 매칭 실패, 미해결 이벤트로 기록
    IGNORED             // 처리 대상이 아닌 이벤트 종류
}
