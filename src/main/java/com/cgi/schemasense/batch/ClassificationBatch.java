package com.cgi.schemasense.batch;

import com.cgi.schemasense.model.ColumnMetadata;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Unit of work handed to one worker. Columns keep their schema order.
 */
@Value
@Builder
public class ClassificationBatch {
    int batchId;

    /**
     * Table of the batch, or null when a small schema is processed as one mixed batch.
     */
    String tableName;

    List<ColumnMetadata> columns;

    /**
     * 1-based index of this part when a large table is split.
     */
    int part;

    int partCount;

    public String describe() {
        String scope = tableName != null ? tableName : "schema";
        return partCount > 1 ? scope + " [" + part + "/" + partCount + "]" : scope;
    }
}
