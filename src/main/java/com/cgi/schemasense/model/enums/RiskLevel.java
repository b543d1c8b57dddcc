package com.cgi.schemasense.model.enums;

/**
 * Risk level of a classified field, ordered from lowest to highest.
 */
public enum RiskLevel {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
