package com.netbet.trustedsession.generation;

import com.netbet.trustedsession.model.GenerationAttempt;

import java.util.List;

/** The overall deadline elapsed before any producer succeeded. */
public class GenerationTimeoutException extends GenerationException {

    public GenerationTimeoutException(String message) {
        super(message);
    }

    public GenerationTimeoutException(String message, List<GenerationAttempt> attempts) {
        super(message, attempts);
    }
}
