package com.cgi.schemasense.cache;

import com.cgi.schemasense.model.ColumnMetadata;
import com.cgi.schemasense.model.FieldAnalysisResult;
import lombok.Value;

import java.util.List;

/**
 * Cached results re-bound to a new schema: reusable hits plus the columns still to classify.
 */
@Value
public class AdaptedResults {
    List<FieldAnalysisResult> hits;
    List<ColumnMetadata> misses;
}
