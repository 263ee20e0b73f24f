package com.netbet.trustedsession.generation;

/** A second generation was requested while one is running. Not retried. */
public class GenerationInProgressException extends GenerationException {

    public GenerationInProgressException(String message) {
        super(message);
    }
}
