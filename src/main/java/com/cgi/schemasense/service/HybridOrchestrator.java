package com.cgi.schemasense.service;

import com.cgi.schemasense.api.AiClassificationClient;
import com.cgi.schemasense.api.SchemaClassifier;
import com.cgi.schemasense.batch.BatchProcessor;
import com.cgi.schemasense.batch.BatchResult;
import com.cgi.schemasense.batch.ClassificationBatch;
import com.cgi.schemasense.cache.AdaptedResults;
import com.cgi.schemasense.cache.CacheLookup;
import com.cgi.schemasense.cache.SchemaCache;
import com.cgi.schemasense.cache.SchemaFingerprint;
import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.context.TableContextResolver;
import com.cgi.schemasense.engine.ClassificationEngine;
import com.cgi.schemasense.exception.CacheException;
import com.cgi.schemasense.exception.ClassificationInputException;
import com.cgi.schemasense.model.AiFieldVerdict;
import com.cgi.schemasense.model.ClassificationSession;
import com.cgi.schemasense.model.ColumnMetadata;
import com.cgi.schemasense.model.FieldAnalysisResult;
import com.cgi.schemasense.model.SessionDiagnostic;
import com.cgi.schemasense.model.TableContext;
import com.cgi.schemasense.model.enums.CacheHitType;
import com.cgi.schemasense.model.enums.DomainCategory;
import com.cgi.schemasense.model.enums.MatchStageType;
import com.cgi.schemasense.model.enums.PIIType;
import com.cgi.schemasense.model.enums.Regulation;
import com.cgi.schemasense.pattern.PatternLibrary;
import com.cgi.schemasense.pattern.PatternLibraryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Classifies whole schemas: cache lookup, table context resolution, batched local matching,
 * bounded AI escalation of low-confidence fields, then aggregation and cache store.
 * <p>
 * Only structural input errors propagate. Field, batch, cache and AI failures degrade to
 * local or fallback results and are reported as session diagnostics.
 */
@Service
public class HybridOrchestrator implements SchemaClassifier, DisposableBean {
    private static final Logger log = LoggerFactory.getLogger(HybridOrchestrator.class);
    private static final long NOT_STARTED = Long.MIN_VALUE;

    private final ClassificationEngine engine;
    private final TableContextResolver contextResolver;
    private final SchemaCache schemaCache;
    private final BatchProcessor batchProcessor;
    private final PatternLibraryRegistry libraryRegistry;
    private final AiClassificationClient aiClient;
    private final ClassificationMetricsCollector metricsCollector;

    private final double confidenceThreshold;
    private final double aiCeiling;
    private final Duration sessionTimeout;
    private final double lowContextThreshold;
    private final boolean aiEnabled;
    private final Duration aiTimeout;
    private final int maxFieldsPerCall;
    private final ExecutorService aiExecutor;
    private final AtomicInteger aiThreadCounter = new AtomicInteger(0);

    public HybridOrchestrator(ClassificationEngine engine,
                              TableContextResolver contextResolver,
                              SchemaCache schemaCache,
                              BatchProcessor batchProcessor,
                              PatternLibraryRegistry libraryRegistry,
                              AiClassificationClient aiClient,
                              ClassificationMetricsCollector metricsCollector,
                              ClassificationProperties properties) {
        this.engine = engine;
        this.contextResolver = contextResolver;
        this.schemaCache = schemaCache;
        this.batchProcessor = batchProcessor;
        this.libraryRegistry = libraryRegistry;
        this.aiClient = aiClient;
        this.metricsCollector = metricsCollector;

        ClassificationProperties.Orchestration orchestration = properties.getOrchestration();
        this.confidenceThreshold = orchestration.getConfidenceThreshold();
        this.aiCeiling = orchestration.getAiCeiling();
        this.sessionTimeout = orchestration.getSessionTimeout();
        this.lowContextThreshold = properties.getContext().getLowConfidenceThreshold();
        this.aiEnabled = properties.getAi().isEnabled() && aiClient != null;
        this.aiTimeout = properties.getAi().getTimeout();
        this.maxFieldsPerCall = Math.max(1, properties.getAi().getMaxFieldsPerCall());

        int aiThreads = Math.max(1, properties.getBatch().getWorkerLimit());
        this.aiExecutor = Executors.newFixedThreadPool(aiThreads, r -> {
            Thread t = new Thread(r);
            t.setName("ai-escalation-" + aiThreadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        log.info("Hybrid orchestrator initialized: AI {}, confidence threshold {}, AI ceiling {}, session budget {}",
                aiEnabled ? "enabled" : "disabled", confidenceThreshold, aiCeiling, sessionTimeout);
    }

    /**
     * Parses external regulation identifiers.
     *
     * @param ids Identifiers such as "GDPR" or "PCI-DSS"; null or empty means all
     * @return Requested regulations
     * @throws ClassificationInputException On an unknown identifier
     */
    public static Set<Regulation> parseRegulations(Collection<String> ids) {
        Set<Regulation> regulations = EnumSet.noneOf(Regulation.class);
        if (ids != null) {
            for (String id : ids) {
                regulations.add(Regulation.fromId(id));
            }
        }
        return regulations;
    }

    @Override
    public ClassificationSession classifySchema(List<ColumnMetadata> schema, Set<Regulation> regulations,
                                                String region, String tenant) {
        long startNanos = System.nanoTime();
        validate(schema);

        Set<Regulation> requested = regulations == null || regulations.isEmpty()
                ? EnumSet.allOf(Regulation.class)
                : EnumSet.copyOf(regulations);
        String sessionId = UUID.randomUUID().toString();
        SessionState state = new SessionState(startNanos + sessionTimeout.toNanos());
        log.info("Starting classification session {}: {} columns, regulations {}, region {}, tenant {}",
                sessionId, schema.size(), requested, region, tenant);

        PatternLibrary library = libraryRegistry.forTenant(tenant);
        SchemaFingerprint fingerprint = schemaCache.fingerprint(schema, requested, region, tenant,
                library.getVersion());

        CacheLookup lookup = CacheLookup.miss();
        boolean cacheUsable = true;
        try {
            lookup = schemaCache.lookup(fingerprint);
            metricsCollector.recordCacheLookup(lookup.getHitType());
        } catch (CacheException e) {
            cacheUsable = false;
            metricsCollector.recordCacheError();
            log.warn("Cache lookup failed for session {}, continuing uncached: {}", sessionId, e.getMessage());
            state.diagnose(null, SessionDiagnostic.Category.CACHE_BYPASS, "Cache lookup failed: " + e.getMessage());
        }

        Map<ColumnMetadata, FieldAnalysisResult> resolved = new IdentityHashMap<>();
        List<ColumnMetadata> toClassify = schema;
        if (lookup.isHit()) {
            AdaptedResults adapted = schemaCache.adapt(lookup.getEntry(), schema);
            for (FieldAnalysisResult hit : adapted.getHits()) {
                resolved.put(hit.getColumn(), hit);
            }
            toClassify = adapted.getMisses();
            log.info("Session {}: {} cache hit, {} of {} columns reused", sessionId, lookup.getHitType(),
                    adapted.getHits().size(), schema.size());
        }

        if (!toClassify.isEmpty()) {
            Map<String, TableContext> contexts = resolveContexts(schema, toClassify, state);
            reportMalformed(toClassify, state);
            List<FieldAnalysisResult> local = classifyLocally(toClassify, contexts, requested, region, library, state);
            for (int i = 0; i < toClassify.size(); i++) {
                resolved.put(toClassify.get(i), local.get(i));
            }
            if (lookup.getHitType() != CacheHitType.EXACT) {
                escalate(schema, toClassify, contexts, requested, region, state, resolved);
            }
        }

        List<FieldAnalysisResult> results = new ArrayList<>(schema.size());
        for (ColumnMetadata column : schema) {
            FieldAnalysisResult result = resolved.get(column);
            results.add(result != null ? result : fallback(column));
            metricsCollector.recordStage(results.get(results.size() - 1).getStage());
        }

        if (cacheUsable && state.isStorable() && lookup.getHitType() != CacheHitType.EXACT) {
            try {
                schemaCache.store(fingerprint, results);
            } catch (CacheException e) {
                metricsCollector.recordCacheError();
                log.warn("Cache store failed for session {}: {}", sessionId, e.getMessage());
                state.diagnose(null, SessionDiagnostic.Category.CACHE_BYPASS, "Cache store failed: " + e.getMessage());
            }
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        ClassificationSession session = SessionAggregator.aggregate(sessionId, fingerprint.getHash(), results,
                lookup.getHitType(), state.isIncomplete(), state.getDiagnostics(), elapsedMs);
        metricsCollector.recordSession(results.size(), elapsedMs, session.isIncomplete());

        log.info("Session {} completed in {} ms: {} sensitive of {} ({} local, {} AI, {} cached){}",
                sessionId, elapsedMs, session.getSensitiveFields(), session.getTotalFields(),
                session.getLocalClassifications(), session.getAiClassifications(),
                session.getCachedClassifications(), session.isIncomplete() ? " [incomplete]" : "");
        return session;
    }

    @Override
    public void destroy() {
        metricsCollector.logMetricsReport();
        aiExecutor.shutdown();
        try {
            if (!aiExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                aiExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            aiExecutor.shutdownNow();
        }
    }

    private void validate(List<ColumnMetadata> schema) {
        if (schema == null || schema.isEmpty()) {
            throw new ClassificationInputException("Schema must contain at least one column");
        }
        for (int i = 0; i < schema.size(); i++) {
            if (schema.get(i) == null) {
                throw new ClassificationInputException("Schema entry " + i + " is null");
            }
        }
    }

    private Map<String, TableContext> resolveContexts(List<ColumnMetadata> schema, List<ColumnMetadata> toClassify,
                                                      SessionState state) {
        Map<String, List<ColumnMetadata>> byTable = groupByTable(schema);
        Set<String> needed = toClassify.stream().map(HybridOrchestrator::tableKey).collect(Collectors.toSet());
        Map<String, TableContext> contexts = new HashMap<>();
        for (Map.Entry<String, List<ColumnMetadata>> entry : byTable.entrySet()) {
            if (!needed.contains(entry.getKey())) {
                continue;
            }
            String tableName = entry.getValue().get(0).getTableName();
            TableContext context = contextResolver.resolve(tableName, entry.getValue());
            contexts.put(entry.getKey(), context);
            if (context.getDomainCategory() != DomainCategory.GENERAL && context.getConfidence() < lowContextThreshold) {
                state.diagnose(tableName, SessionDiagnostic.Category.LOW_CONTEXT_CONFIDENCE,
                        String.format("Domain %s resolved with confidence %.2f", context.getDomainCategory(),
                                context.getConfidence()));
            }
        }
        return contexts;
    }

    private void reportMalformed(List<ColumnMetadata> columns, SessionState state) {
        for (ColumnMetadata column : columns) {
            if (!column.isWellFormed()) {
                metricsCollector.recordDegradedField();
                state.diagnose(column.getFieldRef(), SessionDiagnostic.Category.MALFORMED_FIELD,
                        "Missing table or column name");
            }
        }
    }

    private List<FieldAnalysisResult> classifyLocally(List<ColumnMetadata> columns, Map<String, TableContext> contexts,
                                                      Set<Regulation> requested, String region,
                                                      PatternLibrary library, SessionState state) {
        List<ClassificationBatch> batches = batchProcessor.partition(columns);
        List<BatchResult> batchResults = batchProcessor.process(batches,
                batch -> batch.getColumns().stream()
                        .map(column -> engine.classifyField(column, contexts.get(tableKey(column)), requested,
                                region, library))
                        .collect(Collectors.toList()),
                this::fallback,
                state.remainingMillis());

        for (BatchResult batchResult : batchResults) {
            if (!batchResult.isFailed()) {
                continue;
            }
            metricsCollector.recordBatchFailure();
            boolean timedOut = "timed out".equals(batchResult.getFailureReason());
            if (timedOut) {
                state.markIncomplete();
            }
            state.markUnstorable();
            for (ColumnMetadata column : batchResult.getBatch().getColumns()) {
                metricsCollector.recordDegradedField();
                state.degraded.add(column);
                state.diagnose(column.getFieldRef(),
                        timedOut ? SessionDiagnostic.Category.TIME_BUDGET : SessionDiagnostic.Category.BATCH_FAILURE,
                        "Batch " + batchResult.getBatch().describe() + " failed: " + batchResult.getFailureReason());
            }
        }
        return batchProcessor.merge(columns, batchResults, this::fallback);
    }

    private void escalate(List<ColumnMetadata> schema, List<ColumnMetadata> classified,
                          Map<String, TableContext> contexts, Set<Regulation> requested, String region,
                          SessionState state, Map<ColumnMetadata, FieldAnalysisResult> resolved) {
        if (!aiEnabled) {
            return;
        }
        Map<ColumnMetadata, Integer> positions = new IdentityHashMap<>();
        for (int i = 0; i < schema.size(); i++) {
            positions.put(schema.get(i), i);
        }

        List<ColumnMetadata> edgeCases = new ArrayList<>();
        for (ColumnMetadata column : classified) {
            FieldAnalysisResult local = resolved.get(column);
            if (column.isWellFormed() && !state.degraded.contains(column)
                    && local.getConfidence() < confidenceThreshold) {
                edgeCases.add(column);
            }
        }
        if (edgeCases.isEmpty()) {
            return;
        }

        int ceiling = (int) Math.ceil(schema.size() * aiCeiling - 1e-9);
        edgeCases.sort(Comparator
                .comparingDouble((ColumnMetadata column) -> resolved.get(column).getConfidence())
                .thenComparingInt(positions::get));
        List<ColumnMetadata> selected = new ArrayList<>(edgeCases.subList(0, Math.min(ceiling, edgeCases.size())));
        if (edgeCases.size() > selected.size()) {
            state.diagnose(null, SessionDiagnostic.Category.AI_CEILING,
                    String.format("%d edge cases kept their local result (ceiling %d of %d fields)",
                            edgeCases.size() - selected.size(), ceiling, schema.size()));
        }
        if (selected.isEmpty()) {
            return;
        }
        if (state.remainingMillis() <= 0) {
            state.markIncomplete();
            for (ColumnMetadata column : selected) {
                state.diagnose(column.getFieldRef(), SessionDiagnostic.Category.TIME_BUDGET,
                        "Time budget exhausted before AI escalation");
            }
            return;
        }

        selected.sort(Comparator.comparingInt(positions::get));
        Map<String, List<ColumnMetadata>> byTable = groupByTable(selected);
        List<AiCall> calls = new ArrayList<>();
        for (Map.Entry<String, List<ColumnMetadata>> entry : byTable.entrySet()) {
            TableContext context = contexts.get(entry.getKey());
            List<ColumnMetadata> fields = entry.getValue();
            for (int from = 0; from < fields.size(); from += maxFieldsPerCall) {
                List<ColumnMetadata> chunk = List.copyOf(fields.subList(from, Math.min(fields.size(), from + maxFieldsPerCall)));
                metricsCollector.recordAiCall(chunk.size());
                AtomicLong startedNanos = new AtomicLong(NOT_STARTED);
                CompletableFuture<List<AiFieldVerdict>> future = CompletableFuture.supplyAsync(() -> {
                    startedNanos.set(System.nanoTime());
                    return aiClient.submitBatch(chunk, context);
                }, aiExecutor);
                calls.add(new AiCall(chunk, context, future, startedNanos));
            }
        }
        log.debug("Escalating {} fields in {} AI calls", selected.size(), calls.size());

        for (AiCall call : calls) {
            try {
                applyVerdicts(call, await(call, state), requested, region, state, resolved);
            } catch (TimeoutException e) {
                call.future.cancel(true);
                metricsCollector.recordAiFailure();
                if (state.deadlineNanos - System.nanoTime() <= 0) {
                    state.markIncomplete();
                    fallBack(call, SessionDiagnostic.Category.TIME_BUDGET, "Session time budget expired during AI call",
                            state);
                } else {
                    fallBack(call, SessionDiagnostic.Category.AI_FALLBACK, "AI call timed out", state);
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                metricsCollector.recordAiFailure();
                log.warn("AI call for table {} failed, keeping local results: {}",
                        call.context.getTableName(), cause.getMessage());
                fallBack(call, SessionDiagnostic.Category.AI_FALLBACK, "AI unavailable: " + cause.getMessage(), state);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                call.future.cancel(true);
                fallBack(call, SessionDiagnostic.Category.AI_FALLBACK, "AI call interrupted", state);
            }
        }
    }

    /**
     * Waits for one AI call. The per-call timeout runs from the moment a worker picks the call
     * up, so time spent queued behind other calls only counts against the session budget.
     */
    private List<AiFieldVerdict> await(AiCall call, SessionState state)
            throws InterruptedException, ExecutionException, TimeoutException {
        long timeoutNanos = aiTimeout.toNanos();
        while (true) {
            long now = System.nanoTime();
            long wait = Math.min(state.deadlineNanos - now, call.remainingNanos(timeoutNanos, now));
            try {
                return call.future.get(Math.max(0, wait), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                long after = System.nanoTime();
                if (state.deadlineNanos - after <= 0 || call.remainingNanos(timeoutNanos, after) <= 0) {
                    throw e;
                }
                log.trace("AI call for table {} started late, extending its wait", call.context.getTableName());
            }
        }
    }

    private void applyVerdicts(AiCall call, List<AiFieldVerdict> verdicts, Set<Regulation> requested, String region,
                               SessionState state, Map<ColumnMetadata, FieldAnalysisResult> resolved) {
        Map<String, AiFieldVerdict> byRef = new HashMap<>();
        if (verdicts != null) {
            for (AiFieldVerdict verdict : verdicts) {
                if (verdict != null && verdict.getFieldRef() != null) {
                    byRef.put(verdict.getFieldRef().toLowerCase(Locale.ROOT), verdict);
                }
            }
        }
        for (ColumnMetadata column : call.fields) {
            AiFieldVerdict verdict = byRef.get(column.getFieldRef().toLowerCase(Locale.ROOT));
            if (verdict == null) {
                state.diagnose(column.getFieldRef(), SessionDiagnostic.Category.AI_FALLBACK,
                        "AI returned no verdict, local result kept");
                continue;
            }
            if (Double.isNaN(verdict.getConfidence()) || verdict.getConfidence() < 0.0 || verdict.getConfidence() > 1.0) {
                state.diagnose(column.getFieldRef(), SessionDiagnostic.Category.AI_FALLBACK,
                        "AI confidence out of range: " + verdict.getConfidence());
                continue;
            }
            FieldAnalysisResult local = resolved.get(column);
            if (verdict.getConfidence() <= local.getConfidence()) {
                continue;
            }
            resolved.put(column, toAiResult(column, verdict, call.context, requested, region));
            metricsCollector.recordAiOverride();
        }
    }

    private FieldAnalysisResult toAiResult(ColumnMetadata column, AiFieldVerdict verdict, TableContext context,
                                           Set<Regulation> requested, String region) {
        PIIType piiType = parsePiiType(verdict.getPiiType());
        if (piiType == PIIType.NONE) {
            return FieldAnalysisResult.nonSensitive(column, verdict.getConfidence(), MatchStageType.AI, "AI verdict")
                    .toBuilder()
                    .domainCategory(context.getDomainCategory())
                    .fromAi(true)
                    .build();
        }
        Set<Regulation> suggested = EnumSet.noneOf(Regulation.class);
        if (verdict.getRegulation() != null && !verdict.getRegulation().isBlank()) {
            try {
                suggested.add(Regulation.fromId(verdict.getRegulation()));
            } catch (ClassificationInputException e) {
                log.debug("Ignoring unknown regulation '{}' in AI verdict for {}", verdict.getRegulation(),
                        column.getFieldRef());
            }
        }
        Set<Regulation> regulations = engine.getRegulationResolver()
                .resolve(suggested, context.getDomainCategory(), region, requested);
        return FieldAnalysisResult.builder()
                .column(column)
                .sensitive(true)
                .piiType(piiType)
                .confidence(verdict.getConfidence())
                .applicableRegulations(regulations)
                .rationale("AI verdict")
                .stage(MatchStageType.AI)
                .domainCategory(context.getDomainCategory())
                .fromAi(true)
                .build();
    }

    private static PIIType parsePiiType(String value) {
        if (value == null || value.isBlank()) {
            return PIIType.NONE;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if ("NON_SENSITIVE".equals(normalized)) {
            return PIIType.NONE;
        }
        try {
            return PIIType.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return PIIType.OTHER;
        }
    }

    private void fallBack(AiCall call, SessionDiagnostic.Category category, String reason, SessionState state) {
        for (ColumnMetadata column : call.fields) {
            state.diagnose(column.getFieldRef(), category, reason + ", local result kept");
        }
    }

    private FieldAnalysisResult fallback(ColumnMetadata column) {
        return FieldAnalysisResult.nonSensitive(column, 0.0, MatchStageType.DEFAULT, "Local classification unavailable");
    }

    private static Map<String, List<ColumnMetadata>> groupByTable(List<ColumnMetadata> columns) {
        Map<String, List<ColumnMetadata>> byTable = new LinkedHashMap<>();
        for (ColumnMetadata column : columns) {
            byTable.computeIfAbsent(tableKey(column), k -> new ArrayList<>()).add(column);
        }
        return byTable;
    }

    private static String tableKey(ColumnMetadata column) {
        return column.getTableName() != null ? column.getTableName().trim().toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Pending AI call for one chunk of one table.
     */
    private static final class AiCall {
        private final List<ColumnMetadata> fields;
        private final TableContext context;
        private final CompletableFuture<List<AiFieldVerdict>> future;
        private final AtomicLong startedNanos;

        private AiCall(List<ColumnMetadata> fields, TableContext context,
                       CompletableFuture<List<AiFieldVerdict>> future, AtomicLong startedNanos) {
            this.fields = fields;
            this.context = context;
            this.future = future;
            this.startedNanos = startedNanos;
        }

        /**
         * Time left before the call times out; the full timeout while it is still queued.
         */
        private long remainingNanos(long timeoutNanos, long now) {
            long started = startedNanos.get();
            return started == NOT_STARTED ? timeoutNanos : started + timeoutNanos - now;
        }
    }

    /**
     * Mutable bookkeeping of one session. Only touched by the calling thread.
     */
    private static final class SessionState {
        private final long deadlineNanos;
        private final List<SessionDiagnostic> diagnostics = new ArrayList<>();
        private final Set<ColumnMetadata> degraded = Collections.newSetFromMap(new IdentityHashMap<>());
        private boolean incomplete;
        private boolean storable = true;

        private SessionState(long deadlineNanos) {
            this.deadlineNanos = deadlineNanos;
        }

        private long remainingMillis() {
            return Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
        }

        private void diagnose(String fieldRef, SessionDiagnostic.Category category, String reason) {
            diagnostics.add(SessionDiagnostic.builder()
                    .fieldRef(fieldRef)
                    .category(category)
                    .reason(reason)
                    .build());
        }

        private void markIncomplete() {
            incomplete = true;
            storable = false;
        }

        private void markUnstorable() {
            storable = false;
        }

        private boolean isIncomplete() {
            return incomplete;
        }

        private boolean isStorable() {
            return storable;
        }

        private List<SessionDiagnostic> getDiagnostics() {
            return diagnostics;
        }
    }
}
