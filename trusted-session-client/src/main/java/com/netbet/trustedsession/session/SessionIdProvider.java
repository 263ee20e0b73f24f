package com.netbet.trustedsession.session;

/**
 * Source of the session identifier (visitorData) a proof token is derived for.
 * Called once per generation cycle, before any producer is started.
 */
public interface SessionIdProvider {

    /**
     * @return non-null, non-blank session identifier
     * @throws SessionIdException if the identifier cannot be fetched or located
     */
    String fetchSessionId() throws SessionIdException;

    /** Thrown when the session identifier cannot be obtained. */
    class SessionIdException extends Exception {
        public SessionIdException(String message) {
            super(message);
        }
        public SessionIdException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
