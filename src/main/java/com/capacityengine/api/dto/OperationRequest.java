package com.capacityengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * DTO naming an operation to run and its payload.
 */
@Data
public class OperationRequest {

    @NotBlank(message = "Operation is required")
    private String operation;

    private String payload;
}
