package com.capacityengine.api.dto;

import com.capacityengine.subscription.SubscriptionKind;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for starting an auction. {@code parameter} is the rate in micro-TPS for
 * LIFETIME and the number of days for DAILY.
 */
@Data
public class StartAuctionRequest {

    @NotNull(message = "Subscription kind is required")
    private SubscriptionKind kind;

    @NotNull(message = "Mode parameter is required")
    private Long parameter;
}
