package com.cgi.schemasense.pattern;

/**
 * Kind of a sensitivity pattern, deciding which lookup structure it lands in.
 */
public enum PatternKind {
    EXACT,
    ALIAS,
    FUZZY,
    REGEX,
    CONTEXT
}
