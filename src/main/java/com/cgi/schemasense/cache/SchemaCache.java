package com.cgi.schemasense.cache;

import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.exception.CacheException;
import com.cgi.schemasense.model.ColumnMetadata;
import com.cgi.schemasense.model.FieldAnalysisResult;
import com.cgi.schemasense.model.enums.CacheHitType;
import com.cgi.schemasense.model.enums.Regulation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Two-tier cache of classification results keyed by schema fingerprint.
 * The fast tier is an in-memory Caffeine cache; the persistent tier is the embedded database.
 * Lookups try an exact fingerprint first, then the most similar cached schema with the same salt.
 * Concurrent writes for one fingerprint are last-writer-wins.
 */
@Component
public class SchemaCache {
    private static final Logger log = LoggerFactory.getLogger(SchemaCache.class);

    private static final TypeReference<List<FieldAnalysisResult>> RESULT_LIST = new TypeReference<>() {};

    private final Cache<String, CacheEntry> fastTier;
    private final CacheEntryRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration ttl;
    private final double similarityThreshold;
    private final int maxPersistentEntries;

    private final AtomicLong exactHits = new AtomicLong(0);
    private final AtomicLong similarHits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);
    private final AtomicLong stores = new AtomicLong(0);

    @Autowired
    public SchemaCache(ClassificationProperties properties, CacheEntryRepository repository, ObjectMapper objectMapper) {
        this(properties, properties.getCache().isPersistentEnabled() ? repository : null, objectMapper,
                Ticker.systemTicker(), Clock.systemUTC());
    }

    /**
     * Creates a cache with explicit time sources.
     *
     * @param properties Configuration
     * @param repository Persistent tier, or null for a memory-only cache
     * @param objectMapper Mapper used to serialize results for the persistent tier
     * @param ticker Time source of the fast tier
     * @param clock Time source of the persistent tier
     */
    public SchemaCache(ClassificationProperties properties, CacheEntryRepository repository, ObjectMapper objectMapper,
                       Ticker ticker, Clock clock) {
        ClassificationProperties.Cache config = properties.getCache();
        this.ttl = config.getTtl();
        this.similarityThreshold = config.getSimilarityThreshold();
        this.maxPersistentEntries = config.getMaxPersistentEntries();
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.fastTier = Caffeine.newBuilder()
                .recordStats()
                .expireAfter(new CreatedAtExpiry())
                .maximumSize(config.getMaxEntries())
                .ticker(ticker)
                .build();
        log.info("Schema cache initialized: ttl={}, fast tier size={}, persistent tier {}",
                ttl, config.getMaxEntries(), repository != null ? "enabled" : "disabled");
    }

    public SchemaFingerprint fingerprint(Collection<ColumnMetadata> schema, Set<Regulation> regulations,
                                         String region, String tenant, String libraryVersion) {
        return SchemaFingerprint.of(schema, regulations, region, tenant, libraryVersion);
    }

    /**
     * Looks up cached results for a fingerprint.
     *
     * @param fingerprint Fingerprint of the incoming schema
     * @return Exact hit, similar hit or miss
     * @throws CacheException When the persistent tier cannot be read
     */
    public CacheLookup lookup(SchemaFingerprint fingerprint) {
        CacheEntry exact = fastTier.getIfPresent(fingerprint.getHash());
        if (exact != null && isExpired(exact.getCreatedAt().toEpochMilli())) {
            fastTier.invalidate(fingerprint.getHash());
            exact = null;
        }
        if (exact == null && repository != null) {
            exact = loadPersistent(fingerprint.getHash()).orElse(null);
            if (exact != null) {
                fastTier.put(fingerprint.getHash(), exact);
            }
        }
        if (exact != null) {
            touch(fingerprint.getHash());
            exactHits.incrementAndGet();
            log.debug("Exact cache hit for fingerprint {}", fingerprint.getHash());
            return new CacheLookup(CacheHitType.EXACT, exact, 1.0);
        }

        CacheEntry best = null;
        double bestScore = 0.0;
        Set<String> seen = new LinkedHashSet<>();
        for (CacheEntry candidate : fastTier.asMap().values()) {
            seen.add(candidate.getFingerprint().getHash());
            if (isExpired(candidate.getCreatedAt().toEpochMilli())) {
                continue;
            }
            double score = fingerprint.similarity(candidate.getFingerprint());
            if (isBetter(score, candidate, bestScore, best)) {
                best = candidate;
                bestScore = score;
            }
        }
        if (repository != null) {
            // Rows are scored on their tuples; only the winner's results are read.
            String bestRow = null;
            double rowScore = bestScore;
            for (PersistedCacheEntry row : repository.findCandidatesBySalt(fingerprint.getSalt())) {
                if (seen.contains(row.getFingerprint()) || isExpired(row.getCreatedAt())) {
                    continue;
                }
                double score = fingerprint.similarity(fingerprintOf(row));
                if (score >= similarityThreshold && score > rowScore) {
                    bestRow = row.getFingerprint();
                    rowScore = score;
                }
            }
            if (bestRow != null) {
                Optional<CacheEntry> loaded = loadPersistent(bestRow);
                if (loaded.isPresent()) {
                    best = loaded.get();
                    bestScore = rowScore;
                }
            }
        }

        if (best != null && bestScore >= similarityThreshold) {
            touch(best.getFingerprint().getHash());
            similarHits.incrementAndGet();
            log.debug("Similar cache hit for fingerprint {} (similarity {})", fingerprint.getHash(),
                    String.format("%.3f", bestScore));
            return new CacheLookup(CacheHitType.SIMILAR, best, bestScore);
        }
        misses.incrementAndGet();
        return CacheLookup.miss();
    }

    /**
     * Stores the results of a complete session. Both tiers are written; the persistent tier is
     * then trimmed by age and size.
     *
     * @param fingerprint Fingerprint of the classified schema
     * @param results Results in schema order
     * @throws CacheException When the persistent tier cannot be written
     */
    public void store(SchemaFingerprint fingerprint, List<FieldAnalysisResult> results) {
        Instant now = clock.instant();
        CacheEntry entry = CacheEntry.builder()
                .fingerprint(fingerprint)
                .results(List.copyOf(results))
                .createdAt(now)
                .build();
        fastTier.put(fingerprint.getHash(), entry);
        stores.incrementAndGet();

        if (repository == null) {
            return;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(results);
        } catch (JsonProcessingException e) {
            throw new CacheException("Unable to serialize results for fingerprint " + fingerprint.getHash(), e);
        }
        repository.upsert(PersistedCacheEntry.builder()
                .fingerprint(fingerprint.getHash())
                .salt(fingerprint.getSalt())
                .columnTuples(String.join("\n", fingerprint.getColumnTuples()))
                .resultsJson(json)
                .createdAt(now.toEpochMilli())
                .lastUsedAt(now.toEpochMilli())
                .hitCount(0)
                .build());
        int expired = repository.deleteOlderThan(now.minus(ttl).toEpochMilli());
        int evicted = repository.evictLeastRecentlyUsed(maxPersistentEntries);
        if (expired > 0 || evicted > 0) {
            log.debug("Persistent cache trimmed: {} expired, {} evicted", expired, evicted);
        }
    }

    /**
     * Re-binds cached results to a new schema. A cached result is reused only when both the
     * column (table and name) and its data type match; every other column is a miss.
     *
     * @param entry Cached entry
     * @param schema Incoming schema
     * @return Hits bound to the new columns, plus the columns left to classify
     */
    public AdaptedResults adapt(CacheEntry entry, List<ColumnMetadata> schema) {
        Map<String, FieldAnalysisResult> cached = new HashMap<>();
        for (FieldAnalysisResult result : entry.getResults()) {
            cached.put(result.getColumn().getColumnKey(), result);
        }
        List<FieldAnalysisResult> hits = new ArrayList<>();
        List<ColumnMetadata> misses = new ArrayList<>();
        for (ColumnMetadata column : schema) {
            FieldAnalysisResult result = cached.get(column.getColumnKey());
            if (result != null && sameType(result.getColumn().getDataType(), column.getDataType())) {
                hits.add(result.reboundFromCache(column));
            } else {
                misses.add(column);
            }
        }
        log.debug("Adapted cached entry: {} reused, {} to classify", hits.size(), misses.size());
        return new AdaptedResults(hits, misses);
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("exactHits", exactHits.get());
        stats.put("similarHits", similarHits.get());
        stats.put("misses", misses.get());
        stats.put("stores", stores.get());
        stats.put("fastTierSize", fastTier.estimatedSize());
        CacheStats caffeineStats = fastTier.stats();
        stats.put("fastTierHitRate", caffeineStats.hitRate());
        stats.put("fastTierEvictions", caffeineStats.evictionCount());
        stats.put("persistentEnabled", repository != null);
        if (repository != null) {
            try {
                stats.put("persistentSize", repository.count());
            } catch (CacheException e) {
                log.warn("Persistent cache size unavailable: {}", e.getMessage());
                stats.put("persistentSize", "unavailable");
            }
        }
        return stats;
    }

    public void clear() {
        fastTier.invalidateAll();
        if (repository != null) {
            repository.deleteAll();
        }
        log.info("Schema cache cleared");
    }

    private Optional<CacheEntry> loadPersistent(String hash) {
        Optional<PersistedCacheEntry> row = repository.findByFingerprint(hash);
        if (row.isEmpty()) {
            return Optional.empty();
        }
        if (isExpired(row.get().getCreatedAt())) {
            log.debug("Persistent cache entry {} expired", hash);
            return Optional.empty();
        }
        return Optional.of(toEntry(row.get(), fingerprintOf(row.get())));
    }

    private CacheEntry toEntry(PersistedCacheEntry row, SchemaFingerprint fingerprint) {
        try {
            List<FieldAnalysisResult> results = objectMapper.readValue(row.getResultsJson(), RESULT_LIST);
            return CacheEntry.builder()
                    .fingerprint(fingerprint)
                    .results(results)
                    .createdAt(Instant.ofEpochMilli(row.getCreatedAt()))
                    .build();
        } catch (JsonProcessingException e) {
            throw new CacheException("Corrupt cache entry " + row.getFingerprint(), e);
        }
    }

    private static SchemaFingerprint fingerprintOf(PersistedCacheEntry row) {
        Set<String> tuples = new TreeSet<>(Arrays.asList(row.getColumnTuples().split("\n")));
        return new SchemaFingerprint(row.getFingerprint(), row.getSalt(), tuples);
    }

    private long remainingNanos(CacheEntry entry) {
        Duration remaining = Duration.between(clock.instant(), entry.getCreatedAt().plus(ttl));
        return remaining.isNegative() ? 0L : remaining.toNanos();
    }

    private boolean isExpired(long createdAt) {
        return createdAt < clock.instant().minus(ttl).toEpochMilli();
    }

    private void touch(String hash) {
        if (repository != null) {
            repository.touch(hash, clock.millis());
        }
    }

    private boolean isBetter(double score, CacheEntry candidate, double bestScore, CacheEntry best) {
        if (score < similarityThreshold) {
            return false;
        }
        if (best == null || score > bestScore) {
            return true;
        }
        return score == bestScore && candidate.getCreatedAt().isAfter(best.getCreatedAt());
    }

    private static boolean sameType(String left, String right) {
        if (left == null || right == null) {
            return left == null && right == null;
        }
        return left.trim().toLowerCase(Locale.ROOT).equals(right.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Fast-tier lifetime measured from when the results were computed, so an entry promoted
     * from the persistent tier keeps its original deadline.
     */
    private final class CreatedAtExpiry implements Expiry<String, CacheEntry> {
        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
