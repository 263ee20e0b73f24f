package com.netbet.trustedsession.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netbet.trustedsession.generation.GenerationCoordinator;
import com.netbet.trustedsession.generation.GenerationException;
import com.netbet.trustedsession.generation.GenerationMode;
import com.netbet.trustedsession.model.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Arrays;

/**
 * One-shot mode (--oneshot): a single sequential generation, credentials printed as JSON on stdout.
 * No HTTP server, no auto refresh. Exit code 1 when generation fails.
 */
@Component
@ConditionalOnProperty(name = "trusted-session.oneshot", havingValue = "true")
public class OneShotRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(OneShotRunner.class);
    public static final String ONESHOT_FLAG = "--oneshot";

    private final GenerationCoordinator coordinator;
    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private volatile int exitCode = 1;

    @Autowired
    public OneShotRunner(GenerationCoordinator coordinator, ObjectMapper objectMapper) {
        this(coordinator, objectMapper, System.out);
    }

    OneShotRunner(GenerationCoordinator coordinator, ObjectMapper objectMapper, PrintStream out) {
        this.coordinator = coordinator;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    public static boolean isOneShot(String... args) {
        return args != null && Arrays.asList(args).contains(ONESHOT_FLAG);
    }

    @Override
    public void run(String... args) {
        log.info("One-shot mode");
        try {
            Credentials credentials = coordinator.generate(GenerationMode.SEQUENTIAL);
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(credentials));
            log.info("Tokens generated successfully");
            exitCode = 0;
        } catch (GenerationException e) {
            log.error("One-shot generation failed: {}", e.getMessage());
            exitCode = 1;
        } catch (JsonProcessingException e) {
            log.error("Could not write credentials: {}", e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
