package com.airledger.core.rules;

import com.airledger.core.model.AveragingPeriod;
import com.airledger.core.model.Pollutant;
import com.airledger.core.model.RuleResult;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compares observed averages against the regulatory limit table. Holds no mutable state; safe to share
 * between threads.
 */
public final class RuleEngine {
    private static final Logger LOGGER = Logger.getLogger(RuleEngine.class.getName());

    private final RegulatoryLimits limits;

    public RuleEngine(RegulatoryLimits limits) {
        if (limits == null) {
            throw new RegulatoryConfigurationException("Rule engine requires a regulatory limit table");
        }
        this.limits = limits;
    }

    public OptionalDouble limit(Pollutant pollutant, AveragingPeriod period) {
        Optional<RegulatoryLimit> limit = limits.find(pollutant, period);
        return limit.isPresent() ? OptionalDouble.of(limit.get().value()) : OptionalDouble.empty();
    }

    /**
     * @throws UnknownRuleException when no limit is configured for the pair
     */
    public RuleResult evaluate(Pollutant pollutant, AveragingPeriod period, double observed) {
        RuleOutcome outcome = lookup(pollutant, period, observed);
        if (outcome instanceof RuleOutcome.Evaluated evaluated) {
            return evaluated.result();
        }
        throw new UnknownRuleException(pollutant, period);
    }

    public RuleOutcome lookup(Pollutant pollutant, AveragingPeriod period, double observed) {
        Optional<RegulatoryLimit> configured = limits.find(pollutant, period);
        if (configured.isEmpty()) {
            return new RuleOutcome.NotConfigured(pollutant, period);
        }
        RegulatoryLimit limit = configured.get();
        double limitValue = limit.value();

        boolean withinLimit = observed <= limitValue;
        double exceedance = withinLimit ? 0.0 : round(observed - limitValue, 4);
        double exceedancePercent = withinLimit ? 0.0 : round((observed / limitValue - 1.0) * 100.0, 2);

        RuleResult result = new RuleResult(
                pollutant,
                period,
                observed,
                limitValue,
                withinLimit,
                exceedance,
                exceedancePercent,
                ruleName(pollutant, period, limitValue),
                limit.citation(),
                limits.version()
        );
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Rule evaluated: " + result);
        }
        return new RuleOutcome.Evaluated(result);
    }

    public RegulatoryLimits limits() {
        return limits;
    }

    private static String ruleName(Pollutant pollutant, AveragingPeriod period, double limitValue) {
        return "NAAQS " + pollutant.label() + " " + period.label() + " limit (" + limitValue + " " + pollutant.unit() + ")";
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
