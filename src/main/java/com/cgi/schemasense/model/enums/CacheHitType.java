package com.cgi.schemasense.model.enums;

/**
 * How a session was served by the schema cache.
 */
public enum CacheHitType {
    NONE,
    EXACT,
    SIMILAR
}
