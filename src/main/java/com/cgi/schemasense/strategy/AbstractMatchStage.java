package com.cgi.schemasense.strategy;

import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.model.FieldMatch;
import com.cgi.schemasense.model.enums.PIIType;
import com.cgi.schemasense.pattern.SensitivityPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base stage for pattern-driven matching.
 * Provides the shared confidence computation.
 */
public abstract class AbstractMatchStage implements MatchStage {
    protected final Logger log = LoggerFactory.getLogger(getClass());
    protected final double dataTypeBonus;

    protected AbstractMatchStage(ClassificationProperties properties) {
        this.dataTypeBonus = properties.getMatching().getDataTypeBonus();
    }

    @Override
    public String getName() {
        return getClass().getSimpleName();
    }

    /**
     * Confidence of a match: the pattern confidence scaled by the given factor, never below
     * the stage floor, plus a bonus when the SQL type agrees with the PII type. Capped at 1.0.
     *
     * @param baseConfidence Pattern confidence
     * @param factor Pattern weight, times similarity for fuzzy matches
     * @param piiType Assigned PII type
     * @param dataType SQL type of the column, may be null
     * @return Confidence in [floor, 1.0]
     */
    protected double computeConfidence(double baseConfidence, double factor, PIIType piiType, String dataType) {
        double floor = getStageType().getFloor();
        double confidence = Math.max(floor, baseConfidence * factor);
        if (piiType != null && piiType.agreesWithDataType(dataType)) {
            confidence += dataTypeBonus;
        }
        return Math.min(1.0, Math.max(floor, confidence));
    }

    /**
     * Creates a sensitive match from a library pattern.
     *
     * @param pattern Matching pattern
     * @param factor Weight factor applied to the pattern confidence
     * @param context Field being classified
     * @param rationale Human-readable reason
     * @return Field match
     */
    protected FieldMatch createMatch(SensitivityPattern pattern, double factor, FieldContext context, String rationale) {
        double confidence = computeConfidence(pattern.getConfidence(), factor, pattern.getPiiType(),
                context.getColumn().getDataType());
        log.debug("{} matched {} as {} ({})", getName(), context.getColumn().getFieldRef(),
                pattern.getPiiType(), String.format("%.2f", confidence));
        return FieldMatch.builder()
                .stage(getStageType())
                .piiType(pattern.getPiiType())
                .riskLevel(pattern.getRiskLevel())
                .confidence(confidence)
                .patternId(pattern.getId())
                .rationale(rationale)
                .patternRegulations(pattern.getRegulations())
                .build();
    }

    protected FieldMatch createNonSensitive(double confidence, String rationale) {
        return FieldMatch.builder()
                .stage(getStageType())
                .piiType(PIIType.NONE)
                .confidence(confidence)
                .rationale(rationale)
                .build();
    }
}
