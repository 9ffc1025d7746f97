package com.cape.core.model;

/**
 * Declared risk of running a capability, ordered from least to most dangerous.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean exceeds(RiskLevel other) {
        return compareTo(other) > 0;
    }
}
