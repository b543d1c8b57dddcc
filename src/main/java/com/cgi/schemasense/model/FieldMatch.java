package com.cgi.schemasense.model;

import com.cgi.schemasense.model.enums.MatchStageType;
import com.cgi.schemasense.model.enums.PIIType;
import com.cgi.schemasense.model.enums.Regulation;
import com.cgi.schemasense.model.enums.RiskLevel;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Raw outcome of one matching stage before regulation resolution.
 */
@Value
@Builder
public class FieldMatch {
    MatchStageType stage;
    PIIType piiType;
    RiskLevel riskLevel;
    double confidence;
    String patternId;
    String rationale;

    /**
     * Regulations the matching pattern(s) are tagged with.
     */
    @Builder.Default
    Set<Regulation> patternRegulations = Set.of();

    public boolean isSensitive() {
        return piiType != null && piiType != PIIType.NONE;
    }
}
