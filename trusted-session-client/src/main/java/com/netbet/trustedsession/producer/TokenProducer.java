package com.netbet.trustedsession.producer;

import com.netbet.trustedsession.model.Credentials;

/**
 * One-shot, stateful proof derivation for a single session identifier.
 * Instances are never reused across attempts.
 */
public interface TokenProducer {

    /**
     * Runs the derivation on the calling thread until it yields credentials or fails.
     *
     * @throws ProducerStoppedException if {@link #stop()} was called before or during the run
     * @throws TokenProducerException   if the derivation failed for any other reason
     */
    Credentials start() throws TokenProducerException;

    /**
     * Cancels a running derivation and releases its resources. Idempotent; safe after completion.
     */
    void stop();
}
