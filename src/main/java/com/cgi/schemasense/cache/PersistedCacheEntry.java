package com.cgi.schemasense.cache;

import lombok.Builder;
import lombok.Value;

/**
 * Row of the {@code schema_cache_entry} table.
 */
@Value
@Builder
public class PersistedCacheEntry {
    String fingerprint;
    String salt;

    /**
     * Column tuples joined by newlines.
     */
    String columnTuples;

    String resultsJson;
    long createdAt;
    long lastUsedAt;
    int hitCount;
}
