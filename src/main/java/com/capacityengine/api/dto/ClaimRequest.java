package com.capacityengine.api.dto;

import lombok.Data;

/**
 * DTO for claiming an auction. Without a beneficiary the winner owns the subscription.
 */
@Data
public class ClaimRequest {

    private String beneficiary;
}
