package com.netbet.trustedsession.producer;

/**
 * The run ended because stop() was requested, not because derivation failed.
 */
public class ProducerStoppedException extends TokenProducerException {

    public ProducerStoppedException(String message) {
        super(message);
    }
}
