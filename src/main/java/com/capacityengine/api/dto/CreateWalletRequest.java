package com.capacityengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * DTO for opening a wallet.
 */
@Data
public class CreateWalletRequest {

    @NotBlank(message = "Account ID is required")
    private String accountId;

    @PositiveOrZero(message = "Initial balance cannot be negative")
    private long initialBalance;
}
