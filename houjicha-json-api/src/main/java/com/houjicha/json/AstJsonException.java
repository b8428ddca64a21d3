package com.houjicha.json;

/**
 * A parse result could not be written or read as JSON, or no JSON binding
 * could be found.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
