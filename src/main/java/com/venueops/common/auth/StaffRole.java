package com.venueops.common.auth;

/**
 * 인증 계층이 {@code X-Staff-Role} 헤더로 전달하는 스태프 권한.
 */
public enum StaffRole {
    STAFF,
    MANAGER,
    OWNER;

    public boolean canForceComplete() {
        return this == MANAGER || this == OWNER;
    }
}
