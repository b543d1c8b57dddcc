package com.cgi.schemasense.service;

import com.cgi.schemasense.model.ClassificationSession;
import com.cgi.schemasense.model.FieldAnalysisResult;
import com.cgi.schemasense.model.SessionDiagnostic;
import com.cgi.schemasense.model.enums.CacheHitType;
import com.cgi.schemasense.model.enums.PIIType;
import com.cgi.schemasense.model.enums.Regulation;
import com.cgi.schemasense.model.enums.RiskLevel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a session and its aggregate counters from the final results.
 */
final class SessionAggregator {

    private SessionAggregator() {
    }

    static ClassificationSession aggregate(String sessionId, String fingerprint, List<FieldAnalysisResult> results,
                                           CacheHitType cacheHitType, boolean incomplete,
                                           List<SessionDiagnostic> diagnostics, long processingTimeMs) {
        Map<PIIType, Integer> byPiiType = new EnumMap<>(PIIType.class);
        Map<Regulation, Integer> byRegulation = new EnumMap<>(Regulation.class);
        Map<RiskLevel, Integer> byRisk = new EnumMap<>(RiskLevel.class);
        int sensitive = 0;
        int local = 0;
        int ai = 0;
        int cached = 0;

        for (FieldAnalysisResult result : results) {
            if (result.isSensitive()) {
                sensitive++;
                byPiiType.merge(result.getPiiType(), 1, Integer::sum);
                for (Regulation regulation : result.getApplicableRegulations()) {
                    byRegulation.merge(regulation, 1, Integer::sum);
                }
            }
            byRisk.merge(result.getRiskLevel(), 1, Integer::sum);
            if (result.isFromCache()) {
                cached++;
            } else if (result.isFromAi()) {
                ai++;
            } else {
                local++;
            }
        }

        int total = results.size();
        return ClassificationSession.builder()
                .sessionId(sessionId)
                .fingerprint(fingerprint)
                .results(results)
                .totalFields(total)
                .sensitiveFields(sensitive)
                .nonSensitiveFields(total - sensitive)
                .countsByPiiType(Collections.unmodifiableMap(byPiiType))
                .countsByRegulation(Collections.unmodifiableMap(byRegulation))
                .countsByRiskLevel(Collections.unmodifiableMap(byRisk))
                .localClassifications(local)
                .aiClassifications(ai)
                .cachedClassifications(cached)
                .localCoveragePercent(percent(local + cached, total))
                .aiCoveragePercent(percent(ai, total))
                .cacheHitType(cacheHitType)
                .incomplete(incomplete)
                .diagnostics(diagnostics)
                .processingTimeMs(processingTimeMs)
                .build();
    }

    private static double percent(int part, int total) {
        return total == 0 ? 0.0 : Math.round(part * 10000.0 / total) / 100.0;
    }
}
