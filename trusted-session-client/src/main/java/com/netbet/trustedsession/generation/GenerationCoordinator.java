package com.netbet.trustedsession.generation;

import com.netbet.trustedsession.model.Credentials;
import com.netbet.trustedsession.session.SessionIdProvider;
import com.netbet.trustedsession.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one generation cycle: fetch visitorData, then derive the token with the worker race or the
 * sequential fallback under an overall deadline. Only one cycle may run at a time; a second caller
 * is rejected rather than queued (queuing is the cache's job).
 */
@Component
public class GenerationCoordinator implements CredentialsGenerator {

    private static final Logger log = LoggerFactory.getLogger(GenerationCoordinator.class);
    private static final long DEFAULT_TIMEOUT_MS = 120_000;

    private final SessionIdProvider sessionIdProvider;
    private final WorkerPool workerPool;
    private final SequentialTokenGenerator sequentialGenerator;
    private final Clock clock;
    private final GenerationMode mode;
    private final Duration timeout;
    private final int workerCount;
    private final AtomicBoolean busy = new AtomicBoolean(false);

    public GenerationCoordinator(SessionIdProvider sessionIdProvider,
                                 WorkerPool workerPool,
                                 SequentialTokenGenerator sequentialGenerator,
                                 Clock clock,
                                 @Value("${trusted-session.generation.mode:parallel}") String mode,
                                 @Value("${trusted-session.generation.timeout-ms:120000}") long timeoutMs,
                                 @Value("${trusted-session.workers.count:0}") int workerCount) {
        this.sessionIdProvider = sessionIdProvider;
        this.workerPool = workerPool;
        this.sequentialGenerator = sequentialGenerator;
        this.clock = clock;
        this.mode = GenerationMode.fromProperty(mode);
        this.timeout = Duration.ofMillis(timeoutMs > 0 ? timeoutMs : DEFAULT_TIMEOUT_MS);
        this.workerCount = workerCount > 0 ? workerCount : WorkerPool.defaultWorkerCount();
        log.info("GenerationCoordinator ready (mode={}, workers={}, timeoutMs={})",
                this.mode, this.workerCount, this.timeout.toMillis());
    }

    public GenerationMode getMode() {
        return mode;
    }

    public boolean isBusy() {
        return busy.get();
    }

    @Override
    public Credentials generate() throws GenerationException {
        return generate(mode);
    }

    public Credentials generate(GenerationMode generationMode) throws GenerationException {
        if (!busy.compareAndSet(false, true)) {
            log.warn("Token generation already in progress, rejecting this attempt");
            throw new GenerationInProgressException("Token generation already in progress");
        }
        try {
            log.info("Generating tokens ({} mode)...", generationMode);
            String sessionId;
            try {
                sessionId = sessionIdProvider.fetchSessionId();
            } catch (SessionIdProvider.SessionIdException e) {
                throw new GenerationException("visitorData unavailable: " + e.getMessage(), e);
            }

            Deadline deadline = Deadline.after(clock, timeout);
            Credentials credentials = switch (generationMode) {
                case PARALLEL -> workerPool.race(sessionId, workerCount, deadline);
                case SEQUENTIAL -> sequentialGenerator.run(sessionId, deadline);
            };
            log.info("Token generated successfully");
            return credentials;
        } catch (GenerationException e) {
            log.error("Token generation failed: {}", e.getMessage());
            throw e;
        } finally {
            busy.set(false);
        }
    }
}
