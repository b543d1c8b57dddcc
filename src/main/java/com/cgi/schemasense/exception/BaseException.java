package com.cgi.schemasense.exception;

/**
 * Root of the classification exception hierarchy.
 * The error code is reported to REST callers as is; transient failures of
 * collaborators (cache store, alias store, AI service) are flagged so callers may retry.
 */
public abstract class BaseException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Error code for categorizing exceptions.
     */
    private final String errorCode;

    /**
     * Whether the failure comes from an unavailable collaborator rather than the request.
     */
    private final boolean transientFailure;

    /**
     * Creates a non-transient exception with the specified message and error code.
     *
     * @param message Exception message
     * @param errorCode Error code
     */
    protected BaseException(String message, String errorCode) {
        this(message, null, errorCode, false);
    }

    /**
     * Creates a non-transient exception with the specified message, cause and error code.
     *
     * @param message Exception message
     * @param cause The cause of the exception
     * @param errorCode Error code
     */
    protected BaseException(String message, Throwable cause, String errorCode) {
        this(message, cause, errorCode, false);
    }

    /**
     * Creates an exception with an explicit transient flag.
     *
     * @param message Exception message
     * @param cause The cause of the exception, may be null
     * @param errorCode Error code
     * @param transientFailure True when the same request may succeed later
     */
    protected BaseException(String message, Throwable cause, String errorCode, boolean transientFailure) {
        super(message, cause);
        this.errorCode = errorCode;
        this.transientFailure = transientFailure;
    }

    /**
     * Gets the error code.
     *
     * @return Error code
     */
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * @return true when the same request may succeed later without changes
     */
    public boolean isTransientFailure() {
        return transientFailure;
    }
}
