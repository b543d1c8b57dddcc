package com.cgi.schemasense.model.enums;

/**
 * Stage of the classification pipeline that produced a result.
 */
public enum MatchStageType {
    OVERRIDE(0.90),
    EXACT(0.90),
    REGULATION_EXACT(0.90),
    ALIAS(0.85),
    FUZZY(0.60),
    CONTEXT(0.50),
    REGEX(0.55),
    DEFAULT(0.0),
    AI(0.0),
    CACHE(0.0);

    private final double floor;

    MatchStageType(double floor) {
        this.floor = floor;
    }

    /**
     * Minimum confidence a match from this stage can carry.
     *
     * @return Confidence floor
     */
    public double getFloor() {
        return floor;
    }
}
