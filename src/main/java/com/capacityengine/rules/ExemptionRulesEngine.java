package com.capacityengine.rules;

import com.capacityengine.common.exception.CapacityEngineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Evaluates the exemption rules in order; the first decline wins.
 *
 * A rule that throws a non-fatal engine error counts as a decline. Fatal errors propagate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExemptionRulesEngine {

    private final List<ExemptionRule> rules;

    public RuleResult evaluateRules(ExemptionContext context) {
        log.debug("Evaluating {} exemption rules for {} on {}", rules.size(), context.getSigner(), context.getKey());

        for (ExemptionRule rule : rules) {
            RuleResult result;
            try {
                result = rule.evaluate(context);
            } catch (CapacityEngineException e) {
                if (e.isFatal()) {
                    throw e;
                }
                result = RuleResult.decline(e);
            }

            if (!result.isApproved()) {
                log.info("Rule {} declined exemption for {} on {}: {}",
                    rule.getRuleName(), context.getSigner(), context.getKey(), result.getReason());
                return result;
            }

            log.debug("Rule {} approved", rule.getRuleName());
        }

        return RuleResult.approve();
    }
}
