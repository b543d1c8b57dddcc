package com.cgi.schemasense.model.enums;

/**
 * Enumeration of PII types.
 */
public enum PIIType {
    // Personal identification information
    NAME(RiskLevel.HIGH),
    EMAIL(RiskLevel.HIGH),
    PHONE(RiskLevel.HIGH),
    ADDRESS(RiskLevel.HIGH),
    ID(RiskLevel.MEDIUM),
    SSN(RiskLevel.CRITICAL),

    // Sensitive categories
    MEDICAL(RiskLevel.CRITICAL),
    FINANCIAL(RiskLevel.CRITICAL),
    BIOMETRIC(RiskLevel.CRITICAL),

    // Online identifiers and dates
    NETWORK(RiskLevel.MEDIUM),
    DATE(RiskLevel.MEDIUM),

    // Other
    OTHER(RiskLevel.LOW),
    NONE(RiskLevel.NONE);

    private final RiskLevel defaultRisk;

    PIIType(RiskLevel defaultRisk) {
        this.defaultRisk = defaultRisk;
    }

    /**
     * Risk level used when a pattern does not declare one.
     *
     * @return Default risk level
     */
    public RiskLevel getDefaultRisk() {
        return defaultRisk;
    }

    /**
     * Whether a column of the given SQL type is a natural carrier of this PII type.
     *
     * @param dataType SQL data type, may be null
     * @return true if the type agrees with the PII category
     */
    public boolean agreesWithDataType(String dataType) {
        if (dataType == null || dataType.isBlank()) {
            return false;
        }
        String type = dataType.toLowerCase();
        boolean textual = type.contains("char") || type.contains("text") || type.contains("string")
                || type.contains("clob");
        boolean temporal = type.contains("date") || type.contains("time");
        boolean numeric = type.contains("int") || type.contains("num") || type.contains("dec");

        switch (this) {
            case DATE:
                return temporal;
            case NAME:
            case EMAIL:
            case ADDRESS:
            case NETWORK:
            case MEDICAL:
                return textual;
            case PHONE:
            case SSN:
            case FINANCIAL:
            case ID:
                return textual || numeric;
            default:
                return false;
        }
    }
}
