package com.capacityengine.api.controller;

import com.capacityengine.api.dto.OperationRequest;
import com.capacityengine.common.OriginResolver;
import com.capacityengine.config.OrderingInterceptor;
import com.capacityengine.dispatch.DispatchResult;
import com.capacityengine.dispatch.DispatchService;
import com.capacityengine.dispatch.ExemptionRequest;
import com.capacityengine.dispatch.OperationCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collection;

/**
 * REST API for dispatching operations. Supplying both subscription headers asks for the
 * operation to run fee-exempt; omitting them pays the normal fee.
 */
@RestController
@RequestMapping("/api/v1/dispatch")
@RequiredArgsConstructor
@Tag(name = "Dispatch", description = "Run operations, optionally against a subscription")
public class DispatchController {

    static final String SUBSCRIPTION_OWNER_HEADER = "X-Subscription-Owner";
    static final String SUBSCRIPTION_ID_HEADER = "X-Subscription-Id";

    private final DispatchService dispatchService;
    private final OperationCatalog operationCatalog;
    private final OriginResolver originResolver;

    @PostMapping
    @Operation(summary = "Dispatch an operation")
    public ResponseEntity<DispatchResult> dispatch(
            @RequestHeader(value = OrderingInterceptor.ACCOUNT_HEADER, required = false) String accountId,
            @RequestHeader(value = SUBSCRIPTION_OWNER_HEADER, required = false) String subscriptionOwner,
            @RequestHeader(value = SUBSCRIPTION_ID_HEADER, required = false) Integer subscriptionId,
            @Valid @RequestBody OperationRequest request) {
        ExemptionRequest exemption = toExemption(subscriptionOwner, subscriptionId);
        DispatchResult result = dispatchService.dispatch(originResolver.resolve(accountId), exemption,
            operationCatalog.resolve(request.getOperation(), request.getPayload()));
        return ResponseEntity.ok(result);
    }

    @GetMapping("/operations")
    @Operation(summary = "List dispatchable operations")
    public ResponseEntity<Collection<String>> getOperations() {
        return ResponseEntity.ok(operationCatalog.getOperationNames());
    }

    private ExemptionRequest toExemption(String owner, Integer localId) {
        if (owner == null && localId == null) {
            return ExemptionRequest.disabled();
        }
        if (owner == null || owner.isBlank() || localId == null) {
            throw new IllegalArgumentException(SUBSCRIPTION_OWNER_HEADER + " and " + SUBSCRIPTION_ID_HEADER
                + " must be supplied together");
        }
        return ExemptionRequest.enabled(owner, localId);
    }
}
