package com.netbet.trustedsession.producer;

import com.netbet.trustedsession.model.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs an external generator command for one session identifier.
 * The session identifier is passed as the last argument and in {@value #SESSION_ID_ENV};
 * the last non-blank line the command prints to stdout is taken as the proof.
 */
public class ProcessTokenProducer implements TokenProducer {

    private static final Logger log = LoggerFactory.getLogger(ProcessTokenProducer.class);
    public static final String SESSION_ID_ENV = "VISITOR_DATA";

    private final List<String> command;
    private final String sessionId;

    private Process process;
    private boolean stopped;

    public ProcessTokenProducer(List<String> command, String sessionId) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Producer command must not be empty");
        }
        this.command = List.copyOf(command);
        this.sessionId = sessionId;
    }

    @Override
    public Credentials start() throws TokenProducerException {
        List<String> argv = new ArrayList<>(command);
        argv.add(sessionId);
        ProcessBuilder pb = new ProcessBuilder(argv)
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        pb.environment().put(SESSION_ID_ENV, sessionId);

        Process p;
        synchronized (this) {
            if (stopped) {
                throw new ProducerStoppedException("Producer stopped before start");
            }
            try {
                p = pb.start();
            } catch (IOException e) {
                throw new TokenProducerException("Failed to launch producer command " + command.get(0) + ": " + e.getMessage(), e);
            }
            process = p;
        }
        log.debug("Producer process started pid={}", p.pid());

        String proof = null;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) proof = line.trim();
            }
        } catch (IOException e) {
            if (isStopped()) throw new ProducerStoppedException("Producer stopped");
            throw new TokenProducerException("Failed to read producer output: " + e.getMessage(), e);
        }

        int exitCode;
        try {
            exitCode = p.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new ProducerStoppedException("Producer interrupted");
        }

        if (isStopped()) {
            throw new ProducerStoppedException("Producer stopped");
        }
        if (exitCode != 0) {
            throw new TokenProducerException("Producer exited with code " + exitCode);
        }
        if (proof == null) {
            throw new TokenProducerException("Producer printed no token");
        }
        return new Credentials(sessionId, proof);
    }

    @Override
    public void stop() {
        Process p;
        synchronized (this) {
            if (stopped) return;
            stopped = true;
            p = process;
        }
        if (p != null && p.isAlive()) {
            p.descendants().forEach(ProcessHandle::destroyForcibly);
            p.destroyForcibly();
            log.debug("Producer process destroyed pid={}", p.pid());
        }
    }

    private synchronized boolean isStopped() {
        return stopped;
    }
}
