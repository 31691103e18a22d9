package com.venueops.order.service;

public record CompatibilityResult(boolean allowed, String reason) {

    public static CompatibilityResult allow() {
        return new CompatibilityResult(true, null);
    }

    public static CompatibilityResult deny(String reason) {
        return new CompatibilityResult(false, reason);
    }
}
