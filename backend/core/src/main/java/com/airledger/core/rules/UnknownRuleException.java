package com.airledger.core.rules;

import com.airledger.core.model.AveragingPeriod;
import com.airledger.core.model.Pollutant;

public class UnknownRuleException extends RuntimeException {
    private final Pollutant pollutant;
    private final AveragingPeriod period;

    public UnknownRuleException(Pollutant pollutant, AveragingPeriod period) {
        super("No limit defined for pollutant=" + pollutant.code() + " averaging_period=" + period.label());
        this.pollutant = pollutant;
        this.period = period;
    }

    public Pollutant pollutant() {
        return pollutant;
    }

    public AveragingPeriod period() {
        return period;
    }
}
