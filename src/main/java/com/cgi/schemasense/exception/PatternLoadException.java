package com.cgi.schemasense.exception;

/**
 * Raised when a pattern record or pattern source cannot be read.
 */
public class PatternLoadException extends BaseException {
    private static final long serialVersionUID = 1L;

    public PatternLoadException(String message) {
        super(message, "PATTERN_LOAD_ERROR");
    }

    public PatternLoadException(String message, Throwable cause) {
        super(message, cause, "PATTERN_LOAD_ERROR");
    }
}
