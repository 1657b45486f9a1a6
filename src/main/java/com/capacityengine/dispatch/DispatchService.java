package com.capacityengine.dispatch;

import com.capacityengine.common.Origin;
import com.capacityengine.common.exception.CapacityEngineException;
import com.capacityengine.rules.RuleResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Runs operations through the request interceptor.
 *
 * {@link #dispatch} is the ambient path: a refused exemption means the operation does not
 * run and the caller may resubmit it paying the fee. {@link #call} is the explicit path: a
 * refused exemption is an error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispatchService {

    private final RequestInterceptor requestInterceptor;

    @Transactional
    public DispatchResult dispatch(Origin origin, ExemptionRequest request, Operation operation) {
        String signer = origin.ensureSigned();
        long estimatedCost = operation.getEstimatedCost();

        RuleResult validation = requestInterceptor.validate(signer, request, estimatedCost);
        if (!validation.isApproved()) {
            return rejected(operation, validation.getError());
        }
        PreDispatch pre = requestInterceptor.preDispatch(signer, request, estimatedCost);
        if (pre.isRejected()) {
            return rejected(operation, pre.getError());
        }
        return execute(signer, operation, pre);
    }

    /**
     * Run {@code operation} against subscription {@code owner/localId}.
     *
     * @throws CapacityEngineException the reason the subscription cannot cover the operation
     */
    @Transactional
    public DispatchResult call(Origin origin, String owner, int localId, Operation operation) {
        String signer = origin.ensureSigned();
        ExemptionRequest request = ExemptionRequest.enabled(owner, localId);
        long estimatedCost = operation.getEstimatedCost();

        RuleResult validation = requestInterceptor.validate(signer, request, estimatedCost);
        if (!validation.isApproved()) {
            throw validation.getError();
        }
        PreDispatch pre = requestInterceptor.preDispatch(signer, request, estimatedCost);
        if (pre.isRejected()) {
            throw pre.getError();
        }
        return execute(signer, operation, pre);
    }

    private DispatchResult execute(String signer, Operation operation, PreDispatch pre) {
        OperationOutcome outcome;
        try {
            outcome = operation.execute(signer);
        } catch (CapacityEngineException e) {
            if (e.isFatal()) {
                throw e;
            }
            log.warn("Operation {} by {} failed: {}", operation.getName(), signer, e.getMessage());
            outcome = OperationOutcome.failed(null, e.getMessage());
        }

        long actualCost = outcome.getActualCost() != null ? outcome.getActualCost() : operation.getEstimatedCost();
        requestInterceptor.postDispatch(pre, actualCost, outcome.isSuccess());

        if (pre.isPaysNoFee()) {
            log.info("Operation {} by {} ran against subscription {} for {}",
                operation.getName(), signer, pre.getSubscription(), actualCost);
        } else {
            log.info("Operation {} by {} ran paying the standard fee", operation.getName(), signer);
        }

        return DispatchResult.builder()
            .operation(operation.getName())
            .status(pre.getStatus())
            .executed(true)
            .success(outcome.isSuccess())
            .actualCost(actualCost)
            .message(outcome.getMessage())
            .build();
    }

    private DispatchResult rejected(Operation operation, CapacityEngineException error) {
        log.info("Exemption refused for operation {}: {}", operation.getName(), error.getMessage());
        return DispatchResult.builder()
            .operation(operation.getName())
            .status(DispatchStatus.REJECTED)
            .executed(false)
            .success(false)
            .rejectionCode(error.getCode())
            .rejectionReason(error.getMessage())
            .build();
    }
}
