package com.cgi.schemasense.model;

import com.cgi.schemasense.model.enums.CacheHitType;
import com.cgi.schemasense.model.enums.PIIType;
import com.cgi.schemasense.model.enums.Regulation;
import com.cgi.schemasense.model.enums.RiskLevel;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Full outcome of one schema classification request.
 * Results follow the column order of the submitted schema.
 */
@Value
@Builder
public class ClassificationSession {
    String sessionId;
    String fingerprint;

    @Singular
    List<FieldAnalysisResult> results;

    int totalFields;
    int sensitiveFields;
    int nonSensitiveFields;

    Map<PIIType, Integer> countsByPiiType;
    Map<Regulation, Integer> countsByRegulation;
    Map<RiskLevel, Integer> countsByRiskLevel;

    int localClassifications;
    int aiClassifications;
    int cachedClassifications;

    /**
     * Percentage (0-100) of fields decided by local matching, cache included.
     */
    double localCoveragePercent;

    /**
     * Percentage (0-100) of fields decided by the AI collaborator.
     */
    double aiCoveragePercent;

    CacheHitType cacheHitType;

    /**
     * True when the time budget expired before every field was fully processed.
     */
    boolean incomplete;

    @Singular
    List<SessionDiagnostic> diagnostics;

    long processingTimeMs;

    public boolean isCacheHit() {
        return cacheHitType != null && cacheHitType != CacheHitType.NONE;
    }

    /**
     * Looks up the result of a column by table and column name, case-insensitive.
     *
     * @param tableName Table name
     * @param columnName Column name
     * @return The result if the column was part of the request
     */
    public Optional<FieldAnalysisResult> findResult(String tableName, String columnName) {
        return results.stream()
                .filter(r -> tableName.equalsIgnoreCase(r.getColumn().getTableName())
                        && columnName.equalsIgnoreCase(r.getColumn().getColumnName()))
                .findFirst();
    }
}
