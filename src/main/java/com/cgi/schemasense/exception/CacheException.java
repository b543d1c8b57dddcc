package com.cgi.schemasense.exception;

/**
 * Exception for schema cache read/write failures.
 */
public class CacheException extends BaseException {
    private static final long serialVersionUID = 1L;

    public CacheException(String message) {
        super(message, null, "CACHE_ERROR", true);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause, "CACHE_ERROR", true);
    }
}
