package com.cgi.schemasense.cache;

import com.cgi.schemasense.model.FieldAnalysisResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Results of one complete classification session, keyed by its fingerprint.
 */
@Value
@Builder
public class CacheEntry {
    SchemaFingerprint fingerprint;
    List<FieldAnalysisResult> results;
    Instant createdAt;
}
