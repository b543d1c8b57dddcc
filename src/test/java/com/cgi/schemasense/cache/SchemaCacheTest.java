package com.cgi.schemasense.cache;

import com.cgi.schemasense.SchemaFixtures;
import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.exception.CacheException;
import com.cgi.schemasense.model.ColumnMetadata;
import com.cgi.schemasense.model.FieldAnalysisResult;
import com.cgi.schemasense.model.enums.CacheHitType;
import com.cgi.schemasense.model.enums.MatchStageType;
import com.cgi.schemasense.model.enums.PIIType;
import com.cgi.schemasense.model.enums.Regulation;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static com.cgi.schemasense.SchemaFixtures.column;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SchemaCacheTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AtomicLong nanos = new AtomicLong(0);
    private final Ticker ticker = nanos::get;

    private static List<FieldAnalysisResult> classify(List<ColumnMetadata> schema) {
        List<FieldAnalysisResult> results = new ArrayList<>();
        for (ColumnMetadata column : schema) {
            if (column.getColumnName().startsWith("email")) {
                results.add(FieldAnalysisResult.builder()
                        .column(column)
                        .sensitive(true)
                        .piiType(PIIType.EMAIL)
                        .confidence(0.97)
                        .applicableRegulations(Set.of(Regulation.GDPR))
                        .stage(MatchStageType.EXACT)
                        .rationale("test")
                        .build());
            } else {
                results.add(FieldAnalysisResult.nonSensitive(column, 0.05, MatchStageType.DEFAULT, "test"));
            }
        }
        return results;
    }

    private static List<ColumnMetadata> renameLast(List<ColumnMetadata> schema, int renamed) {
        List<ColumnMetadata> copy = new ArrayList<>(schema);
        for (int i = 0; i < renamed; i++) {
            int index = copy.size() - 1 - i;
            copy.set(index, copy.get(index).toBuilder().columnName("renamed_" + i).build());
        }
        return copy;
    }

    /**
     * Wall clock that moves with the fast-tier ticker.
     */
    private final class TickerClock extends Clock {
        private final Instant start;

        private TickerClock(Instant start) {
            this.start = start;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return start.plusNanos(nanos.get());
        }
    }

    private SchemaCache memoryCache(ClassificationProperties properties) {
        return new SchemaCache(properties, null, MAPPER, ticker, Clock.systemUTC());
    }

    @Test
    @DisplayName("Stored results come back unchanged on an exact lookup")
    void exactRoundTrip() {
        SchemaCache cache = memoryCache(new ClassificationProperties());
        List<ColumnMetadata> schema = SchemaFixtures.wideTable("contacts", "email", 5);
        SchemaFingerprint fingerprint = cache.fingerprint(schema, Set.of(), null, null, null);
        List<FieldAnalysisResult> results = classify(schema);

        cache.store(fingerprint, results);
        CacheLookup lookup = cache.lookup(cache.fingerprint(schema, Set.of(), null, null, null));

        assertEquals(CacheHitType.EXACT, lookup.getHitType());
        AdaptedResults adapted = cache.adapt(lookup.getEntry(), schema);
        assertTrue(adapted.getMisses().isEmpty());
        for (int i = 0; i < schema.size(); i++) {
            FieldAnalysisResult hit = adapted.getHits().get(i);
            assertTrue(hit.isFromCache());
            assertEquals(results.get(i).getPiiType(), hit.getPiiType());
            assertEquals(results.get(i).getConfidence(), hit.getConfidence());
            assertEquals(results.get(i).getApplicableRegulations(), hit.getApplicableRegulations());
        }
    }

    @Test
    @DisplayName("One renamed column out of forty reuses the other thirty-nine results")
    void similarHitReusesUnchangedColumns() {
        SchemaCache cache = memoryCache(new ClassificationProperties());
        List<ColumnMetadata> original = SchemaFixtures.wideTable("contacts", "email", 40);
        cache.store(cache.fingerprint(original, Set.of(), null, null, null), classify(original));

        List<ColumnMetadata> changed = renameLast(original, 1);
        CacheLookup lookup = cache.lookup(cache.fingerprint(changed, Set.of(), null, null, null));

        assertEquals(CacheHitType.SIMILAR, lookup.getHitType());
        assertEquals(39.0 / 41.0, lookup.getSimilarity(), 1e-9);
        AdaptedResults adapted = cache.adapt(lookup.getEntry(), changed);
        assertEquals(39, adapted.getHits().size());
        assertEquals(1, adapted.getMisses().size());
        assertEquals("renamed_0", adapted.getMisses().get(0).getColumnName());
    }

    @Test
    void dissimilarSchemaMisses() {
        SchemaCache cache = memoryCache(new ClassificationProperties());
        List<ColumnMetadata> original = SchemaFixtures.wideTable("contacts", "email", 40);
        cache.store(cache.fingerprint(original, Set.of(), null, null, null), classify(original));

        CacheLookup renamedThree = cache.lookup(cache.fingerprint(renameLast(original, 3), Set.of(), null, null, null));
        CacheLookup otherRegulations = cache.lookup(cache.fingerprint(original, Set.of(Regulation.GDPR), null, null, null));

        assertFalse(renamedThree.isHit());
        assertFalse(otherRegulations.isHit());
    }

    @Test
    void changedDataTypeIsReclassified() {
        SchemaCache cache = memoryCache(new ClassificationProperties());
        List<ColumnMetadata> schema = List.of(column("contacts", "email", "VARCHAR"), column("contacts", "age", "INT"));
        cache.store(cache.fingerprint(schema, Set.of(), null, null, null), classify(schema));
        CacheEntry entry = cache.lookup(cache.fingerprint(schema, Set.of(), null, null, null)).getEntry();

        AdaptedResults adapted = cache.adapt(entry,
                List.of(column("CONTACTS", "EMAIL", "varchar"), column("contacts", "age", "BIGINT")));

        assertEquals(1, adapted.getHits().size());
        assertEquals("EMAIL", adapted.getHits().get(0).getColumn().getColumnName());
        assertEquals("age", adapted.getMisses().get(0).getColumnName());
    }

    @Test
    void entriesExpireAfterTtl() {
        ClassificationProperties properties = new ClassificationProperties();
        properties.getCache().setTtl(Duration.ofHours(1));
        SchemaCache cache = memoryCache(properties);
        List<ColumnMetadata> schema = SchemaFixtures.mixedSchema();
        SchemaFingerprint fingerprint = cache.fingerprint(schema, Set.of(), null, null, null);
        cache.store(fingerprint, classify(schema));

        nanos.addAndGet(Duration.ofMinutes(59).toNanos());
        assertTrue(cache.lookup(fingerprint).isHit());

        nanos.addAndGet(Duration.ofMinutes(2).toNanos());
        assertFalse(cache.lookup(fingerprint).isHit());
    }

    @Test
    void storeIsIdempotent() {
        SchemaCache cache = memoryCache(new ClassificationProperties());
        List<ColumnMetadata> schema = SchemaFixtures.mixedSchema();
        SchemaFingerprint fingerprint = cache.fingerprint(schema, Set.of(), null, null, null);

        cache.store(fingerprint, classify(schema));
        cache.store(fingerprint, classify(schema));

        assertEquals(1L, cache.getStatistics().get("fastTierSize"));
        assertEquals(2L, cache.getStatistics().get("stores"));
    }

    @Test
    void repositoryFailuresSurfaceAsCacheException() {
        CacheEntryRepository repository = mock(CacheEntryRepository.class);
        when(repository.findByFingerprint(anyString())).thenThrow(new CacheException("database down"));
        SchemaCache cache = new SchemaCache(new ClassificationProperties(), repository, MAPPER, ticker,
                Clock.systemUTC());

        SchemaFingerprint fingerprint = cache.fingerprint(SchemaFixtures.mixedSchema(), Set.of(), null, null, null);

        assertThrows(CacheException.class, () -> cache.lookup(fingerprint));
    }

    @Nested
    class PersistentTier {
        private EmbeddedDatabase database;
        private CacheEntryRepository repository;

        @BeforeEach
        void setUp() {
            database = new EmbeddedDatabaseBuilder()
                    .generateUniqueName(true)
                    .setType(EmbeddedDatabaseType.H2)
                    .addScript("schema.sql")
                    .build();
            repository = new CacheEntryRepository(database);
        }

        @AfterEach
        void tearDown() {
            database.shutdown();
        }

        private SchemaCache persistentCache(ClassificationProperties properties, Clock clock) {
            return new SchemaCache(properties, repository, MAPPER, nanos::get, clock);
        }

        @Test
        @DisplayName("A fresh cache instance finds entries written by another one")
        void survivesFastTierLoss() {
            ClassificationProperties properties = new ClassificationProperties();
            List<ColumnMetadata> schema = SchemaFixtures.mixedSchema();
            SchemaFingerprint fingerprint = SchemaFingerprint.of(schema, Set.of(), null, null, null);
            persistentCache(properties, Clock.systemUTC()).store(fingerprint, classify(schema));

            SchemaCache restarted = persistentCache(properties, Clock.systemUTC());
            CacheLookup lookup = restarted.lookup(fingerprint);

            assertEquals(CacheHitType.EXACT, lookup.getHitType());
            assertEquals(classify(schema), lookup.getEntry().getResults());
            assertEquals(1, repository.count());
            assertEquals(1, repository.findByFingerprint(fingerprint.getHash()).orElseThrow().getHitCount());
        }

        @Test
        void similarLookupSearchesPersistedRows() {
            ClassificationProperties properties = new ClassificationProperties();
            List<ColumnMetadata> original = SchemaFixtures.wideTable("contacts", "email", 40);
            persistentCache(properties, Clock.systemUTC())
                    .store(SchemaFingerprint.of(original, Set.of(), null, null, null), classify(original));

            SchemaCache restarted = persistentCache(properties, Clock.systemUTC());
            CacheLookup lookup = restarted.lookup(SchemaFingerprint.of(renameLast(original, 1), Set.of(), null, null, null));

            assertEquals(CacheHitType.SIMILAR, lookup.getHitType());
            assertEquals(40, lookup.getEntry().getResults().size());
            assertNull(repository.findCandidatesBySalt(lookup.getEntry().getFingerprint().getSalt()).get(0)
                    .getResultsJson());
        }

        @Test
        @DisplayName("An entry promoted from the database keeps the deadline of its first write")
        void promotedEntriesKeepTheirOriginalDeadline() {
            ClassificationProperties properties = new ClassificationProperties();
            properties.getCache().setTtl(Duration.ofHours(24));
            Clock clock = new TickerClock(Instant.parse("2024-01-01T00:00:00Z"));
            List<ColumnMetadata> schema = SchemaFixtures.mixedSchema();
            SchemaFingerprint fingerprint = SchemaFingerprint.of(schema, Set.of(), null, null, null);
            persistentCache(properties, clock).store(fingerprint, classify(schema));

            SchemaCache restarted = persistentCache(properties, clock);
            nanos.addAndGet(Duration.ofHours(23).toNanos());
            assertEquals(CacheHitType.EXACT, restarted.lookup(fingerprint).getHitType());

            nanos.addAndGet(Duration.ofHours(7).toNanos());
            assertFalse(restarted.lookup(fingerprint).isHit());
        }

        @Test
        void expiredRowsAreIgnoredAndPurged() {
            ClassificationProperties properties = new ClassificationProperties();
            properties.getCache().setTtl(Duration.ofHours(1));
            Instant start = Instant.parse("2024-01-01T00:00:00Z");
            List<ColumnMetadata> schema = SchemaFixtures.mixedSchema();
            SchemaFingerprint fingerprint = SchemaFingerprint.of(schema, Set.of(), null, null, null);
            persistentCache(properties, Clock.fixed(start, ZoneOffset.UTC)).store(fingerprint, classify(schema));

            Clock later = Clock.fixed(start.plus(Duration.ofHours(2)), ZoneOffset.UTC);
            assertFalse(persistentCache(properties, later).lookup(fingerprint).isHit());

            List<ColumnMetadata> other = SchemaFixtures.wideTable("audit", "email", 3);
            persistentCache(properties, later).store(SchemaFingerprint.of(other, Set.of(), null, null, null),
                    classify(other));
            assertEquals(1, repository.count());
        }

        @Test
        void persistentTierIsBounded() {
            ClassificationProperties properties = new ClassificationProperties();
            properties.getCache().setMaxPersistentEntries(2);
            SchemaCache cache = persistentCache(properties, Clock.systemUTC());

            for (int i = 0; i < 4; i++) {
                List<ColumnMetadata> schema = SchemaFixtures.wideTable("table_" + i, "email", 2);
                cache.store(SchemaFingerprint.of(schema, Set.of(), null, null, null), classify(schema));
            }

            assertEquals(2, repository.count());
        }

        @Test
        void clearEmptiesBothTiers() {
            SchemaCache cache = persistentCache(new ClassificationProperties(), Clock.systemUTC());
            List<ColumnMetadata> schema = SchemaFixtures.mixedSchema();
            SchemaFingerprint fingerprint = SchemaFingerprint.of(schema, Set.of(), null, null, null);
            cache.store(fingerprint, classify(schema));

            cache.clear();

            assertFalse(cache.lookup(fingerprint).isHit());
            assertEquals(0, repository.count());
        }

        @Test
        void databaseErrorsAreWrapped() {
            database.shutdown();

            assertThrows(CacheException.class, () -> repository.count());
        }
    }
}
