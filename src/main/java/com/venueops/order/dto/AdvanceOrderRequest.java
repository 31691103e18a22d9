package com.venueops.order.dto;

import com.venueops.order.entity.OrderStatus;
import jakarta.validation.constraints.NotNull;

public record AdvanceOrderRequest(@NotNull OrderStatus nextStatus) {
}
