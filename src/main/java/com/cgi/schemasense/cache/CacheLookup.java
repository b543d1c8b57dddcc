package com.cgi.schemasense.cache;

import com.cgi.schemasense.model.enums.CacheHitType;
import lombok.Value;

/**
 * Outcome of a cache lookup. {@code entry} is null on a miss.
 */
@Value
public class CacheLookup {
    CacheHitType hitType;
    CacheEntry entry;
    double similarity;

    public static CacheLookup miss() {
        return new CacheLookup(CacheHitType.NONE, null, 0.0);
    }

    public boolean isHit() {
        return hitType != CacheHitType.NONE;
    }
}
