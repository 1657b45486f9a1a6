package com.capacityengine.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class BidRequest {

    @NotNull(message = "Amount is required")
    private Long amount;
}
