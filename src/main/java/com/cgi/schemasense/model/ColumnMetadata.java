package com.cgi.schemasense.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Locale;

/**
 * Represents the metadata of a database column as supplied by the schema extractor.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ColumnMetadata {
    /**
     * Schema (database namespace) the table lives in, may be null.
     */
    String schemaName;

    /**
     * Name of the table to which this column belongs.
     */
    String tableName;

    /**
     * Column name as declared in the schema.
     */
    String columnName;

    /**
     * SQL data type of the column (VARCHAR, INT, etc.).
     */
    String dataType;

    /**
     * Indicates whether the column can contain NULL values.
     */
    boolean nullable;

    /**
     * Ordinal position of the column in the table.
     */
    int ordinalPosition;

    /**
     * Reference used in diagnostics and AI exchanges: {@code table.column}.
     *
     * @return Field reference
     */
    @JsonIgnore
    public String getFieldRef() {
        return tableName + "." + columnName;
    }

    /**
     * Case-insensitive key identifying this column within a schema, independent of its position.
     *
     * @return Lower-cased {@code table.column}
     */
    @JsonIgnore
    public String getColumnKey() {
        return String.valueOf(tableName).toLowerCase(Locale.ROOT) + "."
                + String.valueOf(columnName).toLowerCase(Locale.ROOT);
    }

    /**
     * Whether the column carries a usable name.
     *
     * @return false for null or blank table names and for column names without a letter or digit
     */
    @JsonIgnore
    public boolean isWellFormed() {
        return tableName != null && !tableName.isBlank()
                && columnName != null && columnName.chars().anyMatch(Character::isLetterOrDigit);
    }
}
