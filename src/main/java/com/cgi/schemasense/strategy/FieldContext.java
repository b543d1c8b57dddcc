package com.cgi.schemasense.strategy;

import com.cgi.schemasense.model.ColumnMetadata;
import com.cgi.schemasense.model.TableContext;
import com.cgi.schemasense.model.enums.Regulation;
import com.cgi.schemasense.pattern.PatternLibrary;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Everything a match stage may look at for one column.
 */
@Value
@Builder
public class FieldContext {
    ColumnMetadata column;
    String normalizedName;
    TableContext tableContext;

    /**
     * Regulations the caller asked for; never empty (an empty request is expanded to all).
     */
    Set<Regulation> requestedRegulations;

    /**
     * Regulation the table domain maps to, tried first when a name is claimed by several regulations.
     */
    Regulation preferredRegulation;

    PatternLibrary library;
}
