package com.capacityengine.api.controller;

import com.capacityengine.api.dto.GrantAccessRequest;
import com.capacityengine.api.dto.OperationRequest;
import com.capacityengine.common.OriginResolver;
import com.capacityengine.config.OrderingInterceptor;
import com.capacityengine.delegation.AccessGrant;
import com.capacityengine.delegation.DelegationService;
import com.capacityengine.dispatch.DispatchResult;
import com.capacityengine.dispatch.DispatchService;
import com.capacityengine.dispatch.OperationCatalog;
import com.capacityengine.subscription.Subscription;
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

/**
 * REST API for subscriptions: queries, explicit calls and access grants.
 */
@RestController
@RequestMapping("/api/v1/subscriptions")
@RequiredArgsConstructor
@Tag(name = "Subscriptions", description = "Subscription queries, calls and delegation")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final DispatchService dispatchService;
    private final OperationCatalog operationCatalog;
    private final DelegationService delegationService;
    private final OriginResolver originResolver;

    @GetMapping("/{owner}")
    @Operation(summary = "List an owner's subscriptions")
    public ResponseEntity<List<Subscription>> getSubscriptions(@PathVariable String owner) {
        return ResponseEntity.ok(subscriptionService.getSubscriptions(owner));
    }

    @GetMapping("/{owner}/{localId}")
    @Operation(summary = "Get a subscription as stored")
    public ResponseEntity<Subscription> getSubscription(@PathVariable String owner, @PathVariable int localId) {
        return ResponseEntity.ok(subscriptionService.getSubscription(owner, localId));
    }

    @GetMapping("/{owner}/{localId}/status")
    @Operation(summary = "Get a subscription's current quota and activity")
    public ResponseEntity<SubscriptionStatus> getStatus(@PathVariable String owner, @PathVariable int localId) {
        return ResponseEntity.ok(subscriptionService.getStatus(owner, localId));
    }

    @PostMapping("/{owner}/{localId}/call")
    @Operation(summary = "Run an operation against a subscription's quota")
    public ResponseEntity<DispatchResult> call(
            @RequestHeader(value = OrderingInterceptor.ACCOUNT_HEADER, required = false) String accountId,
            @PathVariable String owner,
            @PathVariable int localId,
            @Valid @RequestBody OperationRequest request) {
        DispatchResult result = dispatchService.call(originResolver.resolve(accountId), owner, localId,
            operationCatalog.resolve(request.getOperation(), request.getPayload()));
        return ResponseEntity.ok(result);
    }

    @GetMapping("/{owner}/{localId}/grants")
    @Operation(summary = "List accounts allowed to use a subscription")
    public ResponseEntity<List<AccessGrant>> getGrants(@PathVariable String owner, @PathVariable int localId) {
        return ResponseEntity.ok(delegationService.getGrants(owner, localId));
    }

    @PostMapping("/{localId}/grants")
    @Operation(summary = "Allow another account to use the caller's subscription")
    public ResponseEntity<AccessGrant> grantAccess(
            @RequestHeader(value = OrderingInterceptor.ACCOUNT_HEADER, required = false) String accountId,
            @PathVariable int localId,
            @Valid @RequestBody GrantAccessRequest request) {
        AccessGrant grant = delegationService.grantAccess(originResolver.resolve(accountId), localId,
            request.getDelegate());
        return ResponseEntity.status(HttpStatus.CREATED).body(grant);
    }

    @DeleteMapping("/{localId}/grants/{delegate}")
    @Operation(summary = "Revoke another account's use of the caller's subscription")
    public ResponseEntity<Void> revokeAccess(
            @RequestHeader(value = OrderingInterceptor.ACCOUNT_HEADER, required = false) String accountId,
            @PathVariable int localId,
            @PathVariable String delegate) {
        delegationService.revokeAccess(originResolver.resolve(accountId), localId, delegate);
        return ResponseEntity.noContent().build();
    }
}
