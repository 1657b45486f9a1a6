package com.capacityengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class GrantAccessRequest {

    @NotBlank(message = "Delegate is required")
    private String delegate;
}
