package com.venueops.order.entity;

public enum FulfillmentType {
    TABLE,
    COUNTER
}
