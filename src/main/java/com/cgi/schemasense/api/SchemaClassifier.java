package com.cgi.schemasense.api;

import com.cgi.schemasense.model.ClassificationSession;
import com.cgi.schemasense.model.ColumnMetadata;
import com.cgi.schemasense.model.enums.Regulation;

import java.util.List;
import java.util.Set;

/**
 * Entry point for classifying a whole schema.
 */
public interface SchemaClassifier {
    /**
     * Classifies every column of a schema.
     *
     * @param schema Columns of the schema, in order
     * @param regulations Requested regulations; empty means all
     * @param region Region code, may be null
     * @param tenant Tenant whose alias patterns apply, may be null
     * @return Session with one result per column, in schema order
     * @throws com.cgi.schemasense.exception.ClassificationInputException If the schema is structurally invalid
     */
    ClassificationSession classifySchema(List<ColumnMetadata> schema, Set<Regulation> regulations,
                                         String region, String tenant);
}
