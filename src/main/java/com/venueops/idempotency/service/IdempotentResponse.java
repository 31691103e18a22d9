package com.venueops.idempotency.service;

public record IdempotentResponse<T>(
        T body,
        int status,
        boolean replayed
) {
}
