package com.venueops.order.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

public record OrderItemRequest(
        String menuItemId,
        @NotBlank String name,
        @NotNull @PositiveOrZero Long unitPrice,   // 최소 화폐 단위
        @Positive int quantity,
        String note
) {
}
