package com.cgi.schemasense.service;

import com.cgi.schemasense.model.enums.CacheHitType;
import com.cgi.schemasense.model.enums.MatchStageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Instrumentation service for collecting counters across classification sessions.
 */
@Component
public class ClassificationMetricsCollector {
    private static final Logger log = LoggerFactory.getLogger(ClassificationMetricsCollector.class);

    private final AtomicInteger sessionCount = new AtomicInteger(0);
    private final AtomicInteger incompleteSessionCount = new AtomicInteger(0);
    private final AtomicInteger fieldCount = new AtomicInteger(0);

    // Fields decided per pipeline stage
    private final Map<MatchStageType, AtomicInteger> stageCounts = new ConcurrentHashMap<>();

    // Cache outcomes
    private final AtomicInteger cacheExactHits = new AtomicInteger(0);
    private final AtomicInteger cacheSimilarHits = new AtomicInteger(0);
    private final AtomicInteger cacheMisses = new AtomicInteger(0);
    private final AtomicInteger cacheErrors = new AtomicInteger(0);

    // AI escalation
    private final AtomicInteger aiCalls = new AtomicInteger(0);
    private final AtomicInteger aiFailures = new AtomicInteger(0);
    private final AtomicInteger fieldsEscalated = new AtomicInteger(0);
    private final AtomicInteger aiOverrides = new AtomicInteger(0);

    private final AtomicInteger fieldsDegraded = new AtomicInteger(0);
    private final AtomicInteger batchFailures = new AtomicInteger(0);
    private final AtomicLong totalProcessingTimeMs = new AtomicLong(0);

    public void recordSession(int fields, long timeMs, boolean incomplete) {
        sessionCount.incrementAndGet();
        fieldCount.addAndGet(fields);
        totalProcessingTimeMs.addAndGet(timeMs);
        if (incomplete) {
            incompleteSessionCount.incrementAndGet();
        }
    }

    public void recordStage(MatchStageType stage) {
        if (stage != null) {
            stageCounts.computeIfAbsent(stage, k -> new AtomicInteger(0)).incrementAndGet();
        }
    }

    public void recordCacheLookup(CacheHitType hitType) {
        switch (hitType) {
            case EXACT:
                cacheExactHits.incrementAndGet();
                break;
            case SIMILAR:
                cacheSimilarHits.incrementAndGet();
                break;
            default:
                cacheMisses.incrementAndGet();
        }
    }

    public void recordCacheError() {
        cacheErrors.incrementAndGet();
    }

    public void recordAiCall(int fields) {
        aiCalls.incrementAndGet();
        fieldsEscalated.addAndGet(fields);
    }

    public void recordAiFailure() {
        aiFailures.incrementAndGet();
    }

    public void recordAiOverride() {
        aiOverrides.incrementAndGet();
    }

    public void recordDegradedField() {
        fieldsDegraded.incrementAndGet();
    }

    public void recordBatchFailure() {
        batchFailures.incrementAndGet();
    }

    public int getAiCallCount() {
        return aiCalls.get();
    }

    /**
     * Resets all metrics.
     */
    public void resetMetrics() {
        sessionCount.set(0);
        incompleteSessionCount.set(0);
        fieldCount.set(0);
        stageCounts.clear();
        cacheExactHits.set(0);
        cacheSimilarHits.set(0);
        cacheMisses.set(0);
        cacheErrors.set(0);
        aiCalls.set(0);
        aiFailures.set(0);
        fieldsEscalated.set(0);
        aiOverrides.set(0);
        fieldsDegraded.set(0);
        batchFailures.set(0);
        totalProcessingTimeMs.set(0);
    }

    /**
     * Generates a report of collected metrics.
     *
     * @return Map containing all metrics
     */
    public Map<String, Object> getMetricsReport() {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("sessions", sessionCount.get());
        report.put("incompleteSessions", incompleteSessionCount.get());
        report.put("fieldsProcessed", fieldCount.get());

        Map<String, Integer> stages = new LinkedHashMap<>();
        for (MatchStageType stage : MatchStageType.values()) {
            AtomicInteger count = stageCounts.get(stage);
            if (count != null) {
                stages.put(stage.name(), count.get());
            }
        }
        report.put("fieldsByStage", stages);

        report.put("cacheExactHits", cacheExactHits.get());
        report.put("cacheSimilarHits", cacheSimilarHits.get());
        report.put("cacheMisses", cacheMisses.get());
        report.put("cacheErrors", cacheErrors.get());

        report.put("aiCalls", aiCalls.get());
        report.put("aiFailures", aiFailures.get());
        report.put("fieldsEscalated", fieldsEscalated.get());
        report.put("aiOverrides", aiOverrides.get());
        int fields = fieldCount.get() > 0 ? fieldCount.get() : 1; // Avoid division by zero
        report.put("escalationPercentage", (double) fieldsEscalated.get() / fields * 100);

        report.put("fieldsDegraded", fieldsDegraded.get());
        report.put("batchFailures", batchFailures.get());
        report.put("totalProcessingTimeMs", totalProcessingTimeMs.get());
        report.put("averageSessionTimeMs", sessionCount.get() > 0
                ? (double) totalProcessingTimeMs.get() / sessionCount.get() : 0);
        return report;
    }

    /**
     * Logs a metrics report.
     */
    public void logMetricsReport() {
        Map<String, Object> report = getMetricsReport();

        log.info("=== Classification Performance Report ===");
        log.info("Sessions: {} ({} incomplete)", report.get("sessions"), report.get("incompleteSessions"));
        log.info("Fields processed: {}", report.get("fieldsProcessed"));
        log.info("Fields by stage: {}", report.get("fieldsByStage"));
        log.info("Cache: {} exact, {} similar, {} misses, {} errors", report.get("cacheExactHits"),
                report.get("cacheSimilarHits"), report.get("cacheMisses"), report.get("cacheErrors"));
        log.info("AI: {} calls, {} failures, {} fields escalated ({}%)", report.get("aiCalls"),
                report.get("aiFailures"), report.get("fieldsEscalated"),
                String.format("%.2f", report.get("escalationPercentage")));
        log.info("Degraded fields: {}", report.get("fieldsDegraded"));
    }
}
