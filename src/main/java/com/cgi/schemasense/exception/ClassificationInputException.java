package com.cgi.schemasense.exception;

/**
 * Raised for structurally invalid requests: empty or malformed schemas and unknown regulation ids.
 */
public class ClassificationInputException extends BaseException {
    private static final long serialVersionUID = 1L;

    public ClassificationInputException(String message) {
        super(message, "INPUT_ERROR");
    }

    public ClassificationInputException(String message, Throwable cause) {
        super(message, cause, "INPUT_ERROR");
    }
}
