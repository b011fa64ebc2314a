package com.airledger.core.classification;

import com.airledger.core.model.Pollutant;

/**
 * Answers whether the station already had a 24-hour violation for the pollutant on the previous day,
 * i.e. one recorded between 48 hours and 1 hour before now.
 */
@FunctionalInterface
public interface ConsecutiveBreachProbe {
    ConsecutiveBreachProbe NONE = (stationId, pollutant) -> false;

    boolean hadPriorDayViolation(String stationId, Pollutant pollutant);
}
