package com.cgi.schemasense;

import com.cgi.schemasense.model.ColumnMetadata;
import com.cgi.schemasense.pattern.ClasspathPatternSource;
import com.cgi.schemasense.pattern.PatternLibrary;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared builders for tests.
 */
public final class SchemaFixtures {
    private static PatternLibrary defaultLibrary;

    private SchemaFixtures() {
    }

    /**
     * Library built from the bundled pattern file, loaded once per JVM.
     */
    public static synchronized PatternLibrary defaultLibrary() {
        if (defaultLibrary == null) {
            defaultLibrary = PatternLibrary.load(
                    new ClasspathPatternSource("patterns/sensitivity-patterns.json", new ObjectMapper()).loadRecords());
        }
        return defaultLibrary;
    }

    public static ColumnMetadata column(String table, String name, String dataType) {
        return ColumnMetadata.builder()
                .tableName(table)
                .columnName(name)
                .dataType(dataType)
                .nullable(true)
                .build();
    }

    public static ColumnMetadata column(String table, String name) {
        return column(table, name, "VARCHAR");
    }

    /**
     * {@code patient_records}, {@code customer_accounts} and {@code employee_directory}.
     */
    public static List<ColumnMetadata> mixedSchema() {
        List<ColumnMetadata> schema = new ArrayList<>();
        schema.add(column("patient_records", "patient_id", "INT"));
        schema.add(column("patient_records", "first_name"));
        schema.add(column("patient_records", "medical_record_number"));
        schema.add(column("customer_accounts", "email_address"));
        schema.add(column("customer_accounts", "credit_card_number"));
        schema.add(column("employee_directory", "phone_number"));
        return schema;
    }

    /**
     * One table of {@code count} columns named {@code prefix_1 .. prefix_count}.
     */
    public static List<ColumnMetadata> wideTable(String table, String prefix, int count) {
        List<ColumnMetadata> columns = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            columns.add(column(table, prefix + "_" + i, "VARCHAR"));
        }
        return columns;
    }
}
