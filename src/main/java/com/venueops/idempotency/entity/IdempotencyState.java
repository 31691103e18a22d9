package com.venueops.idempotency.entity;

public enum IdempotencyState {
    IN_PROGRESS,
    COMPLETED
}
