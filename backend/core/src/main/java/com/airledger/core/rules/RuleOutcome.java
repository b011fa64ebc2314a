package com.airledger.core.rules;

import com.airledger.core.model.AveragingPeriod;
import com.airledger.core.model.Pollutant;
import com.airledger.core.model.RuleResult;

/**
 * Outcome of looking up and applying a rule. {@link NotConfigured} is an expected miss, not an error.
 */
public sealed interface RuleOutcome permits RuleOutcome.Evaluated, RuleOutcome.NotConfigured {
    record Evaluated(RuleResult result) implements RuleOutcome {
    }

    record NotConfigured(Pollutant pollutant, AveragingPeriod period) implements RuleOutcome {
    }
}
