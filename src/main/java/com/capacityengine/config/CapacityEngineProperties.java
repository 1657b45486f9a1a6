package com.capacityengine.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Tunables of the capacity engine, bound from the {@code capacity-engine} prefix.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "capacity-engine")
public class CapacityEngineProperties {

    /**
     * How long bidding stays open after the first bid of an auction.
     */
    @NotNull
    private Duration auctionDuration = Duration.ofSeconds(100);

    /**
     * Floor for the first bid of an auction.
     */
    @Positive
    private long minimalBid = 100;

    /**
     * Cost of one reference operation. A subscription at one TPS accrues a thousandth of it per second.
     */
    @Positive
    private long referenceCallCost = 35_476_000L;

    /**
     * Weight charged for one {@code remark} operation.
     */
    @Positive
    private long remarkCost = 35_476L;

    /**
     * Locked-asset to throughput ratio in parts per million.
     */
    @Min(0)
    @Max(1_000_000)
    private long assetToTpsRatioPpm = 100;

    /**
     * Accrual rate of daily subscriptions, in micro-TPS.
     */
    @Positive
    private long dailyMicroTps = 10_000;

    /**
     * Upper bound of the free quota a subscription may hold.
     */
    @Positive
    private long weightLimit = Long.MAX_VALUE;

    /**
     * Account that holds assets locked by lifetime subscriptions.
     */
    @NotBlank
    private String custodialAccount = "capacity-custody";

    /**
     * Accounts allowed to start auctions.
     */
    private Set<String> adminAccounts = new HashSet<>();
}
