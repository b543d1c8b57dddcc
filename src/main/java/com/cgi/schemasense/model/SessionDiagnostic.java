package com.cgi.schemasense.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Explains why a field was degraded or served by a fallback path.
 */
@Value
@Builder
@Jacksonized
public class SessionDiagnostic {

    public enum Category {
        MALFORMED_FIELD,
        LOW_CONTEXT_CONFIDENCE,
        AI_FALLBACK,
        AI_CEILING,
        BATCH_FAILURE,
        TIME_BUDGET,
        CACHE_BYPASS
    }

    String fieldRef;
    Category category;
    String reason;
}
