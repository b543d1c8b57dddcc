package com.cgi.schemasense.exception;

/**
 * Raised when tenant alias records cannot be read from or written to the alias store.
 */
public class AliasStoreException extends BaseException {
    private static final long serialVersionUID = 1L;

    public AliasStoreException(String message, Throwable cause) {
        super(message, cause, "ALIAS_STORE_ERROR", true);
    }
}
