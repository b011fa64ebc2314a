package com.airledger.core.model;

import java.util.List;

public record ValidationResult(boolean valid, List<String> reasons) {
    public ValidationResult {
        reasons = List.copyOf(reasons);
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult invalid(List<String> reasons) {
        return new ValidationResult(false, reasons);
    }

    @Override
    public String toString() {
        return valid ? "Valid" : "Invalid: " + String.join("; ", reasons);
    }
}
