package com.cgi.schemasense.cache;

import com.cgi.schemasense.exception.CacheException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Persistent tier of the schema cache, stored in the {@code schema_cache_entry} table.
 */
@Repository
public class CacheEntryRepository {
    private static final Logger log = LoggerFactory.getLogger(CacheEntryRepository.class);

    private static final String COLUMNS =
            "fingerprint, salt, column_tuples, results_json, created_at, last_used_at, hit_count";

    private static final String CANDIDATE_COLUMNS =
            "fingerprint, salt, column_tuples, created_at, last_used_at, hit_count";

    private static final RowMapper<PersistedCacheEntry> CANDIDATE_MAPPER = (rs, rowNum) -> PersistedCacheEntry.builder()
            .fingerprint(rs.getString("fingerprint"))
            .salt(rs.getString("salt"))
            .columnTuples(rs.getString("column_tuples"))
            .createdAt(rs.getLong("created_at"))
            .lastUsedAt(rs.getLong("last_used_at"))
            .hitCount(rs.getInt("hit_count"))
            .build();

    private static final RowMapper<PersistedCacheEntry> ROW_MAPPER = (rs, rowNum) -> PersistedCacheEntry.builder()
            .fingerprint(rs.getString("fingerprint"))
            .salt(rs.getString("salt"))
            .columnTuples(rs.getString("column_tuples"))
            .resultsJson(rs.getString("results_json"))
            .createdAt(rs.getLong("created_at"))
            .lastUsedAt(rs.getLong("last_used_at"))
            .hitCount(rs.getInt("hit_count"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public CacheEntryRepository(DataSource dataSource) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setQueryTimeout(10);
    }

    public Optional<PersistedCacheEntry> findByFingerprint(String fingerprint) {
        return execute("find cache entry", jdbc -> jdbc.query(
                "SELECT " + COLUMNS + " FROM schema_cache_entry WHERE fingerprint = ?",
                ROW_MAPPER, fingerprint).stream().findFirst());
    }

    /**
     * Entries salted identically, candidates for similarity reuse. The stored results are not
     * read; {@code resultsJson} is null on the returned rows.
     */
    public List<PersistedCacheEntry> findCandidatesBySalt(String salt) {
        return execute("find cache candidates by salt", jdbc -> jdbc.query(
                "SELECT " + CANDIDATE_COLUMNS + " FROM schema_cache_entry WHERE salt = ?", CANDIDATE_MAPPER, salt));
    }

    public void upsert(PersistedCacheEntry entry) {
        execute("store cache entry", jdbc -> jdbc.update(
                "MERGE INTO schema_cache_entry (" + COLUMNS + ") KEY (fingerprint) VALUES (?, ?, ?, ?, ?, ?, ?)",
                entry.getFingerprint(), entry.getSalt(), entry.getColumnTuples(), entry.getResultsJson(),
                entry.getCreatedAt(), entry.getLastUsedAt(), entry.getHitCount()));
    }

    public void touch(String fingerprint, long usedAt) {
        execute("touch cache entry", jdbc -> jdbc.update(
                "UPDATE schema_cache_entry SET last_used_at = ?, hit_count = hit_count + 1 WHERE fingerprint = ?",
                usedAt, fingerprint));
    }

    /**
     * Deletes entries written before the cutoff.
     *
     * @return Number of deleted rows
     */
    public int deleteOlderThan(long cutoff) {
        return execute("expire cache entries", jdbc -> jdbc.update(
                "DELETE FROM schema_cache_entry WHERE created_at < ?", cutoff));
    }

    /**
     * Keeps at most {@code maxEntries} rows, dropping the least recently used first.
     *
     * @return Number of deleted rows
     */
    public int evictLeastRecentlyUsed(int maxEntries) {
        return execute("evict cache entries", jdbc -> {
            Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM schema_cache_entry", Integer.class);
            int excess = (count != null ? count : 0) - maxEntries;
            if (excess <= 0) {
                return 0;
            }
            List<String> victims = jdbc.queryForList(
                    "SELECT fingerprint FROM schema_cache_entry ORDER BY last_used_at ASC, created_at ASC LIMIT ?",
                    String.class, excess);
            int deleted = 0;
            for (String fingerprint : victims) {
                deleted += jdbc.update("DELETE FROM schema_cache_entry WHERE fingerprint = ?", fingerprint);
            }
            return deleted;
        });
    }

    public int count() {
        Integer count = execute("count cache entries",
                jdbc -> jdbc.queryForObject("SELECT COUNT(*) FROM schema_cache_entry", Integer.class));
        return count != null ? count : 0;
    }

    public void deleteAll() {
        execute("clear cache entries", jdbc -> jdbc.update("DELETE FROM schema_cache_entry"));
    }

    /**
     * Executes a statement with standardized error handling.
     *
     * @param operationName Operation name for logging
     * @param operation Function that runs the statement
     * @return Statement result
     * @throws CacheException On database error
     */
    private <T> T execute(String operationName, Function<JdbcTemplate, T> operation) {
        try {
            log.debug("Executing cache operation: {}", operationName);
            return operation.apply(jdbcTemplate);
        } catch (DataAccessException e) {
            log.error("Database error during {}: {}", operationName, e.getMessage(), e);
            throw new CacheException("Error during " + operationName, e);
        }
    }
}
