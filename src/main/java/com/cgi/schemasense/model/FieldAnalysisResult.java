package com.cgi.schemasense.model;

import com.cgi.schemasense.model.enums.ConfidenceLevel;
import com.cgi.schemasense.model.enums.DomainCategory;
import com.cgi.schemasense.model.enums.MatchStageType;
import com.cgi.schemasense.model.enums.PIIType;
import com.cgi.schemasense.model.enums.Regulation;
import com.cgi.schemasense.model.enums.RiskLevel;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Classification outcome for a single column. Immutable once built.
 * A result is sensitive exactly when it carries at least one regulation.
 */
@Value
public class FieldAnalysisResult {
    ColumnMetadata column;
    boolean sensitive;
    PIIType piiType;
    RiskLevel riskLevel;
    double confidence;
    Set<Regulation> applicableRegulations;
    String rationale;
    MatchStageType stage;
    String patternId;
    DomainCategory domainCategory;
    boolean fromCache;
    boolean fromAi;

    @Builder(toBuilder = true)
    @Jacksonized
    private FieldAnalysisResult(ColumnMetadata column, boolean sensitive, PIIType piiType, RiskLevel riskLevel,
                                double confidence, Set<Regulation> applicableRegulations, String rationale,
                                MatchStageType stage, String patternId, DomainCategory domainCategory,
                                boolean fromCache, boolean fromAi) {
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Confidence must be within [0,1]: " + confidence);
        }
        if (sensitive && (piiType == null || piiType == PIIType.NONE)) {
            throw new IllegalArgumentException("A sensitive field needs a PII type");
        }
        Set<Regulation> regulations = applicableRegulations == null || applicableRegulations.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(applicableRegulations));
        if (sensitive == regulations.isEmpty()) {
            throw new IllegalArgumentException("Regulations must be present exactly when the field is sensitive: "
                    + (column != null ? column.getFieldRef() : "?"));
        }
        this.column = column;
        this.sensitive = sensitive;
        this.piiType = sensitive ? piiType : PIIType.NONE;
        this.riskLevel = sensitive ? (riskLevel != null ? riskLevel : piiType.getDefaultRisk()) : RiskLevel.NONE;
        this.confidence = confidence;
        this.applicableRegulations = regulations;
        this.rationale = rationale;
        this.stage = stage;
        this.patternId = patternId;
        this.domainCategory = domainCategory;
        this.fromCache = fromCache;
        this.fromAi = fromAi;
    }

    /**
     * Creates a non-sensitive result.
     *
     * @param column Source column
     * @param confidence Confidence that the field is not sensitive
     * @param stage Stage that decided
     * @param rationale Human-readable reason
     * @return Non-sensitive result
     */
    public static FieldAnalysisResult nonSensitive(ColumnMetadata column, double confidence,
                                                   MatchStageType stage, String rationale) {
        return FieldAnalysisResult.builder()
                .column(column)
                .sensitive(false)
                .piiType(PIIType.NONE)
                .confidence(confidence)
                .stage(stage)
                .rationale(rationale)
                .build();
    }

    @JsonIgnore
    public ConfidenceLevel getConfidenceLevel() {
        return ConfidenceLevel.of(confidence);
    }

    /**
     * Re-targets this result to another column, marking it as served from cache.
     *
     * @param target Column of the new schema
     * @return Copy bound to the target column
     */
    public FieldAnalysisResult reboundFromCache(ColumnMetadata target) {
        return toBuilder().column(target).fromCache(true).build();
    }
}
