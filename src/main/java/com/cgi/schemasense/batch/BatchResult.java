package com.cgi.schemasense.batch;

import com.cgi.schemasense.model.FieldAnalysisResult;
import lombok.Value;

import java.util.List;

/**
 * Results of one batch. A failed batch carries fallback results for all of its columns.
 */
@Value
public class BatchResult {
    ClassificationBatch batch;
    List<FieldAnalysisResult> results;
    boolean failed;
    String failureReason;

    public static BatchResult success(ClassificationBatch batch, List<FieldAnalysisResult> results) {
        return new BatchResult(batch, results, false, null);
    }

    public static BatchResult failure(ClassificationBatch batch, List<FieldAnalysisResult> fallback, String reason) {
        return new BatchResult(batch, fallback, true, reason);
    }
}
