package com.airledger.core.rules;

/**
 * The regulatory limit table is missing or unusable. The classifier cannot run without it.
 */
public class RegulatoryConfigurationException extends RuntimeException {
    public RegulatoryConfigurationException(String message) {
        super(message);
    }

    public RegulatoryConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
