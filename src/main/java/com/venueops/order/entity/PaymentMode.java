package com.venueops.order.entity;

public enum PaymentMode {
    ONLINE,
    OFFLINE,
    DEFERRED
}
