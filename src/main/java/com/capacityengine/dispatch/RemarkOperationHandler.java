package com.capacityengine.dispatch;

import com.capacityengine.common.EngineClock;
import com.capacityengine.config.CapacityEngineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * The {@code remark} operation: stores an opaque payload at the configured remark cost.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RemarkOperationHandler implements OperationHandler {

    public static final String NAME = "remark";
    static final int MAX_PAYLOAD_LENGTH = 1024;

    private final RemarkRepository remarkRepository;
    private final CapacityEngineProperties properties;
    private final EngineClock clock;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Operation prepare(String payload) {
        return new RemarkOperation(payload == null ? "" : payload);
    }

    private class RemarkOperation implements Operation {

        private final String payload;

        RemarkOperation(String payload) {
            this.payload = payload;
        }

        @Override
        public String getName() {
            return NAME;
        }

        @Override
        public long getEstimatedCost() {
            return properties.getRemarkCost();
        }

        @Override
        public OperationOutcome execute(String signer) {
            if (payload.length() > MAX_PAYLOAD_LENGTH) {
                return OperationOutcome.failed(null,
                    "Remark exceeds " + MAX_PAYLOAD_LENGTH + " characters");
            }
            Remark remark = remarkRepository.save(new Remark(signer, payload, clock.now()));
            log.debug("Stored remark {} from {}", remark.getRemarkId(), signer);
            return OperationOutcome.succeeded(null, "Stored remark " + remark.getRemarkId());
        }
    }
}
