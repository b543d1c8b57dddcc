package com.cgi.schemasense.model;

import com.cgi.schemasense.model.enums.DomainCategory;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Inferred domain of one table, computed fresh for every scan.
 */
@Value
@Builder
@Jacksonized
public class TableContext {
    String tableName;
    DomainCategory domainCategory;

    /**
     * Keyword score per candidate domain.
     */
    Map<DomainCategory, Double> domainScores;

    /**
     * Share of the total keyword score held by the winning domain, in [0,1].
     */
    double confidence;

    public static TableContext general(String tableName) {
        return TableContext.builder()
                .tableName(tableName)
                .domainCategory(DomainCategory.GENERAL)
                .domainScores(Map.of())
                .confidence(0.0)
                .build();
    }
}
