package com.netbet.trustedsession.cache;

/**
 * Raised to every caller attached to a refresh that failed. The cached value is left as it was.
 */
public class TokenGenerationException extends RuntimeException {

    public TokenGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
