package com.airledger.core.rules;

import com.airledger.core.model.AveragingPeriod;
import com.airledger.core.model.Pollutant;

public record RegulatoryLimit(Pollutant pollutant, AveragingPeriod period, double value, String citation) {
}
