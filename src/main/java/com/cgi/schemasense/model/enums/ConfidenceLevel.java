package com.cgi.schemasense.model.enums;

/**
 * Coarse confidence bands for reporting.
 */
public enum ConfidenceLevel {
    VERY_HIGH,
    HIGH,
    MEDIUM,
    LOW,
    VERY_LOW;

    public static ConfidenceLevel of(double confidence) {
        if (confidence >= 0.95) {
            return VERY_HIGH;
        }
        if (confidence >= 0.85) {
            return HIGH;
        }
        if (confidence >= 0.70) {
            return MEDIUM;
        }
        if (confidence >= 0.50) {
            return LOW;
        }
        return VERY_LOW;
    }
}
