package com.cgi.schemasense.exception;

/**
 * Raised when the AI collaborator fails or does not answer in time.
 */
public class AiUnavailableException extends BaseException {
    private static final long serialVersionUID = 1L;

    public AiUnavailableException(String message) {
        super(message, null, "AI_UNAVAILABLE", true);
    }

    public AiUnavailableException(String message, Throwable cause) {
        super(message, cause, "AI_UNAVAILABLE", true);
    }
}
