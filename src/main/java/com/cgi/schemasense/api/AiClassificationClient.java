package com.cgi.schemasense.api;

import com.cgi.schemasense.model.AiFieldVerdict;
import com.cgi.schemasense.model.ColumnMetadata;
import com.cgi.schemasense.model.TableContext;

import java.util.List;

/**
 * Client of the external AI classifier used for edge cases.
 */
public interface AiClassificationClient {
    /**
     * Submits fields of one table for classification.
     *
     * @param fields Fields to classify, all from the same table
     * @param tableContext Context of that table
     * @return One verdict per classified field, identified by {@code table.column}
     * @throws com.cgi.schemasense.exception.AiUnavailableException On failure or timeout
     */
    List<AiFieldVerdict> submitBatch(List<ColumnMetadata> fields, TableContext tableContext);
}
