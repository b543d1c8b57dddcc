package com.cgi.schemasense.pattern;

import java.util.List;

/**
 * Supplies the flat records a {@link PatternLibrary} is built from.
 */
public interface PatternSource {
    /**
     * Reads all pattern records.
     *
     * @return Records in source order
     * @throws com.cgi.schemasense.exception.PatternLoadException if the source cannot be read at all
     */
    List<PatternRecord> loadRecords();
}
