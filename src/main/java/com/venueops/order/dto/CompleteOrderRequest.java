package com.venueops.order.dto;

public record CompleteOrderRequest(Boolean forced, String forcedReason) {

    public boolean isForced() {
        return Boolean.TRUE.equals(forced);
    }
}
