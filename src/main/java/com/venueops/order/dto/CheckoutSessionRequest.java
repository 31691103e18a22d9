package com.venueops.order.dto;

import jakarta.validation.constraints.NotBlank;

public record CheckoutSessionRequest(@NotBlank String sessionRef) {
}
