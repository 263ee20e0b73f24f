package com.netbet.trustedsession.producer;

/** Thrown when a single producer run fails. Recoverable by retry or by another worker. */
public class TokenProducerException extends Exception {

    public TokenProducerException(String message) {
        super(message);
    }

    public TokenProducerException(String message, Throwable cause) {
        super(message, cause);
    }
}
