package com.netbet.trustedsession.producer;

import com.netbet.trustedsession.model.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Creates {@link ProcessTokenProducer}s for the configured generator command
 * (comma-separated argv, e.g. {@code node,scripts/potoken.js}).
 */
@Component
public class ProcessTokenProducerFactory implements TokenProducerFactory {

    private static final Logger log = LoggerFactory.getLogger(ProcessTokenProducerFactory.class);

    private final List<String> command;

    public ProcessTokenProducerFactory(@Value("${trusted-session.producer.command:}") String command) {
        this.command = command == null ? List.of() : Arrays.stream(command.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        if (this.command.isEmpty()) {
            log.warn("trusted-session.producer.command is not set; every generation attempt will fail");
        } else {
            log.info("Token producer command: {}", this.command);
        }
    }

    public List<String> getCommand() {
        return command;
    }

    @Override
    public TokenProducer create(String sessionId) {
        if (command.isEmpty()) {
            return new UnconfiguredProducer();
        }
        return new ProcessTokenProducer(command, sessionId);
    }

    private static final class UnconfiguredProducer implements TokenProducer {
        @Override
        public Credentials start() throws TokenProducerException {
            throw new TokenProducerException("No producer command configured (trusted-session.producer.command)");
        }

        @Override
        public void stop() {
        }
    }
}
