package com.cgi.schemasense.pattern;

import lombok.Value;

/**
 * A pattern found by a scored lookup, with its similarity to the queried name.
 */
@Value
public class PatternMatch {
    SensitivityPattern pattern;
    double score;
}
