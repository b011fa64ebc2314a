package com.airledger.core.model;

public enum Tier {
    MONITOR(WindowHorizon.ONE_HOUR, EventStatus.MONITOR),
    FLAG(WindowHorizon.EIGHT_HOURS, EventStatus.FLAG),
    VIOLATION(WindowHorizon.TWENTY_FOUR_HOURS, EventStatus.PENDING_OFFICER_REVIEW);

    private final WindowHorizon horizon;
    private final EventStatus initialStatus;

    Tier(WindowHorizon horizon, EventStatus initialStatus) {
        this.horizon = horizon;
        this.initialStatus = initialStatus;
    }

    public WindowHorizon horizon() {
        return horizon;
    }

    public EventStatus initialStatus() {
        return initialStatus;
    }

    public static Tier forHorizon(WindowHorizon horizon) {
        for (Tier tier : values()) {
            if (tier.horizon == horizon) {
                return tier;
            }
        }
        throw new IllegalArgumentException("No tier for horizon " + horizon);
    }
}
