package com.venueops.order.service;

import com.venueops.common.auth.StaffRole;

/**
 * 주문 완료 요청자 정보와 강제 완료 여부.
 */
public record CompletionRequest(
        boolean forced,
        String forcedReason,
        String staffId,
        StaffRole role
) {
    public static CompletionRequest normal(String staffId, StaffRole role) {
        return new CompletionRequest(false, null, staffId, role);
    }
}
