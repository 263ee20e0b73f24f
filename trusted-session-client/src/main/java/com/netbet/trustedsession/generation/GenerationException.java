package com.netbet.trustedsession.generation;

import com.netbet.trustedsession.model.GenerationAttempt;

import java.util.List;

/**
 * A whole generation cycle failed: prerequisite missing, every worker failed, or every attempt exhausted.
 */
public class GenerationException extends Exception {

    private final List<GenerationAttempt> attempts;

    public GenerationException(String message) {
        this(message, null, List.of());
    }

    public GenerationException(String message, Throwable cause) {
        this(message, cause, List.of());
    }

    public GenerationException(String message, List<GenerationAttempt> attempts) {
        this(message, null, attempts);
    }

    private GenerationException(String message, Throwable cause, List<GenerationAttempt> attempts) {
        super(message, cause);
        this.attempts = attempts != null ? List.copyOf(attempts) : List.of();
    }

    /** Sequential attempts made before giving up; empty for parallel or prerequisite failures. */
    public List<GenerationAttempt> getAttempts() {
        return attempts;
    }
}
