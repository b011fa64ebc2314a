package com.airledger.core.model;

import java.util.Optional;

public enum AveragingPeriod {
    ONE_HOUR("1hr"),
    EIGHT_HOURS("8hr"),
    TWENTY_FOUR_HOURS("24hr"),
    ANNUAL("annual");

    private final String label;

    AveragingPeriod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<AveragingPeriod> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (AveragingPeriod period : values()) {
            if (period.label.equalsIgnoreCase(label.trim())) {
                return Optional.of(period);
            }
        }
        return Optional.empty();
    }
}
