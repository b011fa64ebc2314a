package com.airledger.collectors.compliance;

/**
 * Which execution context produced a window result.
 */
public enum Origin {
    POLLING,
    STREAMING
}
