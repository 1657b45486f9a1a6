package com.capacityengine.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class StartLifetimeRequest {

    @NotNull(message = "Amount is required")
    private Long amount;
}
