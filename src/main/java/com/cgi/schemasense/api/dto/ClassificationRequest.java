package com.cgi.schemasense.api.dto;

import com.cgi.schemasense.model.ColumnMetadata;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body of a schema scan.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationRequest {
    /**
     * Columns to classify, possibly spanning several tables.
     */
    private List<ColumnMetadata> schema;

    /**
     * Regulation identifiers to evaluate ("GDPR", "PCI-DSS", ...). Empty means all.
     */
    private List<String> regulations;

    /**
     * Jurisdiction such as "EU" or "US-CA", optional.
     */
    private String region;

    /**
     * Tenant whose alias patterns apply, optional.
     */
    private String tenant;
}
