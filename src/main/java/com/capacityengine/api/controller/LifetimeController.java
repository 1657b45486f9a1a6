package com.capacityengine.api.controller;

import com.capacityengine.api.dto.StartLifetimeRequest;
import com.capacityengine.common.Origin;
import com.capacityengine.common.OriginResolver;
import com.capacityengine.config.OrderingInterceptor;
import com.capacityengine.lock.AssetLockService;
import com.capacityengine.lock.LockedAssets;
import com.capacityengine.subscription.SubscriptionService;
import com.capacityengine.subscription.SubscriptionStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for lock-backed lifetime subscriptions.
 */
@RestController
@RequestMapping("/api/v1/lifetime")
@RequiredArgsConstructor
@Tag(name = "Lifetime", description = "Lock assets for a lifetime subscription")
public class LifetimeController {

    private final AssetLockService assetLockService;
    private final SubscriptionService subscriptionService;
    private final OriginResolver originResolver;

    @PostMapping
    @Operation(summary = "Lock assets and start a lifetime subscription")
    public ResponseEntity<SubscriptionStatus> startLifetime(
            @RequestHeader(value = OrderingInterceptor.ACCOUNT_HEADER, required = false) String accountId,
            @Valid @RequestBody StartLifetimeRequest request) {
        Origin origin = originResolver.resolve(accountId);
        int localId = assetLockService.startLifetime(origin, request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(subscriptionService.getStatus(origin.getAccountId(), localId));
    }

    @DeleteMapping("/{localId}")
    @Operation(summary = "Stop a lifetime subscription and unlock its assets")
    public ResponseEntity<Map<String, Long>> stopLifetime(
            @RequestHeader(value = OrderingInterceptor.ACCOUNT_HEADER, required = false) String accountId,
            @PathVariable int localId) {
        long refunded = assetLockService.stopLifetime(originResolver.resolve(accountId), localId);
        return ResponseEntity.ok(Map.of("refunded", refunded));
    }

    @GetMapping("/{owner}")
    @Operation(summary = "List an owner's locked assets")
    public ResponseEntity<List<LockedAssets>> getLocks(@PathVariable String owner) {
        return ResponseEntity.ok(assetLockService.getLocks(owner));
    }
}
