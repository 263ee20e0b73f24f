package com.netbet.trustedsession.producer;

@FunctionalInterface
public interface TokenProducerFactory {

    TokenProducer create(String sessionId);
}
