package com.netbet.trustedsession.model;

import java.time.Instant;

/**
 * One sequential generation attempt. Lives only for the duration of a generation cycle.
 */
public record GenerationAttempt(int attemptNumber, Instant deadline, Outcome outcome, String detail) {

    public enum Outcome { PENDING, SUCCESS, FAILURE, TIMEOUT, INVALID }

    public static GenerationAttempt pending(int attemptNumber, Instant deadline) {
        return new GenerationAttempt(attemptNumber, deadline, Outcome.PENDING, null);
    }

    public GenerationAttempt settle(Outcome outcome, String detail) {
        return new GenerationAttempt(attemptNumber, deadline, outcome, detail);
    }

    @Override
    public String toString() {
        return "#" + attemptNumber + " " + outcome + (detail != null ? " (" + detail + ")" : "");
    }
}
