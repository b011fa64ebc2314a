package com.airledger.core.model;

import java.time.Duration;
import java.util.List;

/**
 * Rolling horizons maintained per station and pollutant. Each maps onto the averaging period
 * whose regulatory limit it is compared against.
 */
public enum WindowHorizon {
    ONE_HOUR(1, AveragingPeriod.ONE_HOUR),
    EIGHT_HOURS(8, AveragingPeriod.EIGHT_HOURS),
    TWENTY_FOUR_HOURS(24, AveragingPeriod.TWENTY_FOUR_HOURS);

    private final int hours;
    private final AveragingPeriod period;

    WindowHorizon(int hours, AveragingPeriod period) {
        this.hours = hours;
        this.period = period;
    }

    public int hours() {
        return hours;
    }

    public Duration duration() {
        return Duration.ofHours(hours);
    }

    public AveragingPeriod period() {
        return period;
    }

    public static WindowHorizon longest() {
        return TWENTY_FOUR_HOURS;
    }

    /** Order in which the classifier inspects horizons. */
    public static List<WindowHorizon> classificationOrder() {
        return List.of(TWENTY_FOUR_HOURS, EIGHT_HOURS, ONE_HOUR);
    }
}
