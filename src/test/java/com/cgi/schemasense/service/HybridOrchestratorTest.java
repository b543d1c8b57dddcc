package com.cgi.schemasense.service;

import com.cgi.schemasense.SchemaFixtures;
import com.cgi.schemasense.api.AiClassificationClient;
import com.cgi.schemasense.batch.BatchProcessor;
import com.cgi.schemasense.cache.CacheEntryRepository;
import com.cgi.schemasense.cache.SchemaCache;
import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.context.TableContextResolver;
import com.cgi.schemasense.engine.ClassificationEngine;
import com.cgi.schemasense.exception.AiUnavailableException;
import com.cgi.schemasense.exception.CacheException;
import com.cgi.schemasense.exception.ClassificationInputException;
import com.cgi.schemasense.model.AiFieldVerdict;
import com.cgi.schemasense.model.ClassificationSession;
import com.cgi.schemasense.model.ColumnMetadata;
import com.cgi.schemasense.model.FieldAnalysisResult;
import com.cgi.schemasense.model.SessionDiagnostic;
import com.cgi.schemasense.model.enums.CacheHitType;
import com.cgi.schemasense.model.enums.MatchStageType;
import com.cgi.schemasense.model.enums.PIIType;
import com.cgi.schemasense.model.enums.Regulation;
import com.cgi.schemasense.pattern.PatternLibraryRegistry;
import com.cgi.schemasense.pattern.PatternRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.cgi.schemasense.SchemaFixtures.column;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class HybridOrchestratorTest {

    private ClassificationProperties properties;
    private AiClassificationClient aiClient;
    private ClassificationMetricsCollector metrics;
    private PatternLibraryRegistry registry;
    private final List<HybridOrchestrator> orchestrators = new ArrayList<>();
    private final List<BatchProcessor> processors = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new ClassificationProperties();
        properties.getAi().setEnabled(true);
        aiClient = mock(AiClassificationClient.class);
        metrics = new ClassificationMetricsCollector();
    }

    @AfterEach
    void tearDown() {
        orchestrators.forEach(HybridOrchestrator::destroy);
        processors.forEach(BatchProcessor::destroy);
    }

    private HybridOrchestrator orchestrator(CacheEntryRepository repository) {
        registry = new PatternLibraryRegistry(SchemaFixtures.defaultLibrary());
        SchemaCache cache = new SchemaCache(properties, repository, new ObjectMapper(), Ticker.systemTicker(),
                Clock.systemUTC());
        BatchProcessor processor = new BatchProcessor(properties);
        processors.add(processor);
        HybridOrchestrator orchestrator = new HybridOrchestrator(
                new ClassificationEngine(registry, properties),
                new TableContextResolver(properties),
                cache,
                processor,
                registry,
                aiClient,
                metrics,
                properties);
        orchestrators.add(orchestrator);
        return orchestrator;
    }

    private HybridOrchestrator orchestrator() {
        return orchestrator(null);
    }

    /**
     * Mixed schema plus one column no local stage recognizes.
     */
    private static List<ColumnMetadata> schemaWithEdgeCase() {
        List<ColumnMetadata> schema = new ArrayList<>(SchemaFixtures.mixedSchema());
        schema.add(column("misc_data", "misc_1"));
        return schema;
    }

    private static long count(ClassificationSession session, SessionDiagnostic.Category category) {
        return session.getDiagnostics().stream().filter(d -> d.getCategory() == category).count();
    }

    @Test
    @DisplayName("Mixed schema resolves regulations by table domain")
    void classifiesMixedSchema() {
        ClassificationSession session = orchestrator().classifySchema(SchemaFixtures.mixedSchema(), Set.of(), null,
                null);

        assertEquals(6, session.getTotalFields());
        assertEquals(6, session.getSensitiveFields());
        assertFalse(session.isIncomplete());
        assertEquals(CacheHitType.NONE, session.getCacheHitType());
        for (FieldAnalysisResult result : session.getResults()) {
            boolean patientTable = "patient_records".equals(result.getColumn().getTableName());
            assertEquals(patientTable, result.getApplicableRegulations().contains(Regulation.HIPAA),
                    result.getColumn().getFieldRef());
        }
        assertEquals(Set.of(Regulation.GDPR),
                session.findResult("customer_accounts", "email_address").orElseThrow().getApplicableRegulations());
        assertEquals(Set.of(Regulation.PCI_DSS),
                session.findResult("customer_accounts", "credit_card_number").orElseThrow().getApplicableRegulations());
        assertEquals(Set.of(Regulation.GDPR),
                session.findResult("employee_directory", "phone_number").orElseThrow().getApplicableRegulations());
        assertEquals(100.0, session.getLocalCoveragePercent());
        verifyNoInteractions(aiClient);
    }

    @Test
    void resultsFollowSchemaOrder() {
        List<ColumnMetadata> schema = new ArrayList<>(SchemaFixtures.wideTable("orders", "col", 30));
        schema.addAll(2, SchemaFixtures.mixedSchema());

        ClassificationSession session = orchestrator().classifySchema(schema, Set.of(), null, null);

        for (int i = 0; i < schema.size(); i++) {
            assertEquals(schema.get(i), session.getResults().get(i).getColumn());
        }
    }

    @Test
    @DisplayName("Only the lowest-confidence edge cases up to the ceiling are escalated")
    void aiEscalationIsCapped() {
        List<ColumnMetadata> schema = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            schema.add(i % 5 == 0
                    ? column("warehouse_stuff", "misc_" + i)
                    : column("warehouse_stuff", "field_" + i + "_date", "DATE"));
        }
        when(aiClient.submitBatch(any(), any())).thenReturn(List.of());

        ClassificationSession session = orchestrator().classifySchema(schema, Set.of(), null, null);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ColumnMetadata>> fields = ArgumentCaptor.forClass(List.class);
        verify(aiClient, times(1)).submitBatch(fields.capture(), any());
        assertEquals(Arrays.asList("misc_0", "misc_5", "misc_10", "misc_15", "misc_20"),
                fields.getValue().stream().map(ColumnMetadata::getColumnName).collect(Collectors.toList()));
        assertEquals(1, count(session, SessionDiagnostic.Category.AI_CEILING));
        assertEquals(5, count(session, SessionDiagnostic.Category.AI_FALLBACK));
        assertEquals(0, session.getAiClassifications());
        assertEquals(100, session.getTotalFields());
    }

    @Test
    void confidentAiVerdictReplacesLocalResult() {
        when(aiClient.submitBatch(any(), any())).thenReturn(List.of(
                new AiFieldVerdict("MISC_DATA.misc_1", "email", 0.92, "GDPR")));

        ClassificationSession session = orchestrator().classifySchema(schemaWithEdgeCase(), Set.of(), null, null);

        FieldAnalysisResult result = session.findResult("misc_data", "misc_1").orElseThrow();
        assertTrue(result.isFromAi());
        assertEquals(MatchStageType.AI, result.getStage());
        assertEquals(PIIType.EMAIL, result.getPiiType());
        assertEquals(Set.of(Regulation.GDPR), result.getApplicableRegulations());
        assertEquals(1, session.getAiClassifications());
        assertEquals(1, metrics.getAiCallCount());
    }

    @Test
    void lessConfidentAiVerdictIsIgnored() {
        when(aiClient.submitBatch(any(), any())).thenReturn(List.of(
                new AiFieldVerdict("misc_data.misc_1", "EMAIL", 0.01, "GDPR")));

        ClassificationSession session = orchestrator().classifySchema(schemaWithEdgeCase(), Set.of(), null, null);

        FieldAnalysisResult result = session.findResult("misc_data", "misc_1").orElseThrow();
        assertFalse(result.isFromAi());
        assertFalse(result.isSensitive());
    }

    @Test
    void outOfRangeAiConfidenceFallsBack() {
        when(aiClient.submitBatch(any(), any())).thenReturn(List.of(
                new AiFieldVerdict("misc_data.misc_1", "EMAIL", 1.5, "GDPR")));

        ClassificationSession session = orchestrator().classifySchema(schemaWithEdgeCase(), Set.of(), null, null);

        assertFalse(session.findResult("misc_data", "misc_1").orElseThrow().isFromAi());
        assertEquals(1, count(session, SessionDiagnostic.Category.AI_FALLBACK));
    }

    @Test
    @DisplayName("An unavailable AI service leaves local results in place")
    void aiFailureFallsBackToLocal() {
        when(aiClient.submitBatch(any(), any())).thenThrow(new AiUnavailableException("connection refused"));

        ClassificationSession session = orchestrator().classifySchema(schemaWithEdgeCase(), Set.of(), null, null);

        assertFalse(session.isIncomplete());
        assertEquals(7, session.getResults().size());
        SessionDiagnostic diagnostic = session.getDiagnostics().stream()
                .filter(d -> d.getCategory() == SessionDiagnostic.Category.AI_FALLBACK)
                .findFirst()
                .orElseThrow();
        assertEquals("misc_data.misc_1", diagnostic.getFieldRef());
        assertTrue(diagnostic.getReason().contains("connection refused"));
    }

    @Test
    @DisplayName("Time an AI call spends queued behind another does not count against its timeout")
    void queuedAiCallsGetTheirFullTimeout() {
        properties.getBatch().setWorkerLimit(1);
        properties.getAi().setTimeout(Duration.ofMillis(600));
        List<ColumnMetadata> schema = new ArrayList<>();
        schema.add(column("misc_data", "misc_1"));
        schema.add(column("warehouse_stuff", "misc_2"));
        for (int i = 0; i < 38; i++) {
            schema.add(column(i < 19 ? "misc_data" : "warehouse_stuff", "field_" + i + "_date", "DATE"));
        }
        when(aiClient.submitBatch(any(), any())).thenAnswer(invocation -> {
            Thread.sleep(400);
            List<ColumnMetadata> fields = invocation.getArgument(0);
            return fields.stream()
                    .map(field -> new AiFieldVerdict(field.getFieldRef(), "EMAIL", 0.92, "GDPR"))
                    .collect(Collectors.toList());
        });

        ClassificationSession session = orchestrator().classifySchema(schema, Set.of(), null, null);

        verify(aiClient, times(2)).submitBatch(any(), any());
        assertEquals(0, count(session, SessionDiagnostic.Category.AI_FALLBACK));
        assertTrue(session.findResult("misc_data", "misc_1").orElseThrow().isFromAi());
        assertTrue(session.findResult("warehouse_stuff", "misc_2").orElseThrow().isFromAi());
        assertEquals(2, session.getAiClassifications());
    }

    @Test
    void disabledAiIsNeverCalled() {
        properties.getAi().setEnabled(false);

        ClassificationSession session = orchestrator().classifySchema(schemaWithEdgeCase(), Set.of(), null, null);

        verifyNoInteractions(aiClient);
        assertEquals(0, session.getAiClassifications());
    }

    @Test
    @DisplayName("A repeated schema is served from cache without new AI calls")
    void exactCacheHitSkipsClassification() {
        when(aiClient.submitBatch(any(), any())).thenReturn(List.of(
                new AiFieldVerdict("misc_data.misc_1", "EMAIL", 0.92, "GDPR")));
        HybridOrchestrator orchestrator = orchestrator();

        ClassificationSession first = orchestrator.classifySchema(schemaWithEdgeCase(), Set.of(), null, null);
        ClassificationSession second = orchestrator.classifySchema(schemaWithEdgeCase(), Set.of(), null, null);

        assertEquals(CacheHitType.EXACT, second.getCacheHitType());
        assertEquals(first.getFingerprint(), second.getFingerprint());
        assertEquals(7, second.getCachedClassifications());
        for (int i = 0; i < 7; i++) {
            FieldAnalysisResult cached = second.getResults().get(i);
            assertTrue(cached.isFromCache());
            assertEquals(first.getResults().get(i).getPiiType(), cached.getPiiType());
            assertEquals(first.getResults().get(i).getApplicableRegulations(), cached.getApplicableRegulations());
        }
        verify(aiClient, times(1)).submitBatch(any(), any());
    }

    @Test
    void similarSchemaReusesCachedColumns() {
        properties.getAi().setEnabled(false);
        HybridOrchestrator orchestrator = orchestrator();
        List<ColumnMetadata> original = SchemaFixtures.wideTable("contacts", "email", 40);
        orchestrator.classifySchema(original, Set.of(), null, null);

        List<ColumnMetadata> changed = new ArrayList<>(original);
        changed.set(39, column("contacts", "phone_number"));
        ClassificationSession session = orchestrator.classifySchema(changed, Set.of(), null, null);

        assertEquals(CacheHitType.SIMILAR, session.getCacheHitType());
        assertEquals(39, session.getCachedClassifications());
        assertEquals(1, session.getLocalClassifications());
        FieldAnalysisResult renamed = session.getResults().get(39);
        assertFalse(renamed.isFromCache());
        assertEquals(PIIType.PHONE, renamed.getPiiType());
    }

    @Test
    @DisplayName("Registering tenant aliases makes earlier cached results unreachable")
    void tenantAliasesInvalidateCachedResults() {
        properties.getAi().setEnabled(false);
        HybridOrchestrator orchestrator = orchestrator();
        List<ColumnMetadata> schema = List.of(column("staff", "cust_ph"));

        ClassificationSession before = orchestrator.classifySchema(schema, Set.of(), null, "acme");
        assertFalse(before.getResults().get(0).isSensitive());

        registry.registerAliases("acme", List.of(PatternRecord.builder()
                .pattern("cust_ph").piiType("PHONE").confidence(0.9).build()));
        ClassificationSession after = orchestrator.classifySchema(schema, Set.of(), null, "acme");

        assertEquals(CacheHitType.NONE, after.getCacheHitType());
        assertEquals(PIIType.PHONE, after.getResults().get(0).getPiiType());
        assertEquals(MatchStageType.ALIAS, after.getResults().get(0).getStage());

        ClassificationSession again = orchestrator.classifySchema(schema, Set.of(), null, "acme");
        assertEquals(CacheHitType.EXACT, again.getCacheHitType());
    }

    @Test
    void differentRegulationsDoNotShareCacheEntries() {
        HybridOrchestrator orchestrator = orchestrator();
        orchestrator.classifySchema(SchemaFixtures.mixedSchema(), Set.of(), null, null);

        ClassificationSession session = orchestrator.classifySchema(SchemaFixtures.mixedSchema(),
                Set.of(Regulation.GDPR), null, null);

        assertEquals(CacheHitType.NONE, session.getCacheHitType());
        assertEquals(Set.of(Regulation.GDPR),
                session.findResult("customer_accounts", "credit_card_number").orElseThrow().getApplicableRegulations());
    }

    @Test
    @DisplayName("A failing cache is bypassed for the session")
    void cacheFailureIsBypassed() {
        CacheEntryRepository repository = mock(CacheEntryRepository.class);
        when(repository.findByFingerprint(anyString())).thenThrow(new CacheException("database down"));

        ClassificationSession session = orchestrator(repository).classifySchema(SchemaFixtures.mixedSchema(),
                Set.of(), null, null);

        assertEquals(6, session.getSensitiveFields());
        assertEquals(1, count(session, SessionDiagnostic.Category.CACHE_BYPASS));
        verify(repository, times(0)).upsert(any());
    }

    @Test
    void malformedFieldIsReportedAndNotEscalated() {
        List<ColumnMetadata> schema = new ArrayList<>(SchemaFixtures.mixedSchema());
        schema.add(column("customer_accounts", " "));

        ClassificationSession session = orchestrator().classifySchema(schema, Set.of(), null, null);

        FieldAnalysisResult malformed = session.getResults().get(6);
        assertFalse(malformed.isSensitive());
        assertEquals(0.0, malformed.getConfidence());
        assertEquals(1, count(session, SessionDiagnostic.Category.MALFORMED_FIELD));
        verifyNoInteractions(aiClient);
    }

    @Test
    void invalidInputIsRejected() {
        HybridOrchestrator orchestrator = orchestrator();
        List<ColumnMetadata> withNull = new ArrayList<>(SchemaFixtures.mixedSchema());
        withNull.add(null);

        assertThrows(ClassificationInputException.class,
                () -> orchestrator.classifySchema(List.of(), Set.of(), null, null));
        assertThrows(ClassificationInputException.class,
                () -> orchestrator.classifySchema(null, Set.of(), null, null));
        assertThrows(ClassificationInputException.class,
                () -> orchestrator.classifySchema(withNull, Set.of(), null, null));
    }

    @Test
    void regulationIdsAreParsed() {
        assertEquals(Set.of(Regulation.GDPR, Regulation.PCI_DSS),
                HybridOrchestrator.parseRegulations(List.of("gdpr", "PCI-DSS")));
        assertTrue(HybridOrchestrator.parseRegulations(null).isEmpty());
        assertThrows(ClassificationInputException.class,
                () -> HybridOrchestrator.parseRegulations(List.of("SOX")));
    }

    @Test
    @DisplayName("An expired time budget marks the session incomplete")
    void timeBudgetExpiry() {
        properties.getOrchestration().setSessionTimeout(Duration.ofMillis(300));
        when(aiClient.submitBatch(any(), any())).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return List.of();
        });

        ClassificationSession session = orchestrator().classifySchema(schemaWithEdgeCase(), Set.of(), null, null);

        assertTrue(session.isIncomplete());
        assertTrue(count(session, SessionDiagnostic.Category.TIME_BUDGET) > 0);
        assertEquals(7, session.getResults().size());
    }
}
