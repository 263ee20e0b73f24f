package com.netbet.trustedsession.worker;

import com.netbet.trustedsession.generation.Deadline;
import com.netbet.trustedsession.generation.GenerationException;
import com.netbet.trustedsession.generation.GenerationTimeoutException;
import com.netbet.trustedsession.model.Credentials;
import com.netbet.trustedsession.producer.TokenProducerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Races a fresh set of {@link ProducerWorker}s for one session identifier. The first success wins;
 * the race fails when every worker has failed or the deadline passes. Whatever the outcome, every
 * worker is sent STOP exactly once and joined before {@link #race} returns.
 */
@Component
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private static final long DEFAULT_SHUTDOWN_GRACE_MS = 5_000;

    private final TokenProducerFactory producerFactory;
    private final int proofLength;
    private final Duration shutdownGrace;
    private volatile List<ProducerWorker> current = List.of();

    public WorkerPool(TokenProducerFactory producerFactory,
                      @Value("${trusted-session.proof-length:160}") int proofLength,
                      @Value("${trusted-session.workers.shutdown-grace-ms:5000}") long shutdownGraceMs) {
        this.producerFactory = producerFactory;
        this.proofLength = proofLength > 0 ? proofLength : Credentials.DEFAULT_PROOF_LENGTH;
        this.shutdownGrace = Duration.ofMillis(shutdownGraceMs > 0 ? shutdownGraceMs : DEFAULT_SHUTDOWN_GRACE_MS);
    }

    /** Available processors minus one, at least 1. */
    public static int defaultWorkerCount() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    /** Workers of the race in progress; empty between races. */
    public List<WorkerState> currentWorkers() {
        return current.stream().map(ProducerWorker::state).toList();
    }

    public Credentials race(String sessionId, int workerCount, Deadline deadline) throws GenerationException {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1");
        }
        BlockingQueue<WorkerMessage> outbox = new LinkedBlockingQueue<>();
        List<ProducerWorker> workers = new ArrayList<>(workerCount);
        log.info("Starting {} worker threads...", workerCount);
        try {
            for (int i = 1; i <= workerCount; i++) {
                ProducerWorker worker = new ProducerWorker(i, producerFactory, proofLength, outbox);
                workers.add(worker);
                worker.spawn();
            }
            current = List.copyOf(workers);
            for (ProducerWorker worker : workers) {
                worker.send(WorkerCommand.start(sessionId));
            }

            int failed = 0;
            while (true) {
                Duration remaining = deadline.remaining();
                if (remaining.isZero()) {
                    log.error("Token generation timeout - no worker succeeded within {} ms", deadline.timeout().toMillis());
                    throw new GenerationTimeoutException(
                            "Token generation timeout after " + deadline.timeout().toMillis() + " ms");
                }
                WorkerMessage message = outbox.poll(remaining.toNanos(), TimeUnit.NANOSECONDS);
                if (message instanceof WorkerMessage.Success s) {
                    log.info("Worker {} generated a token", s.workerId());
                    return s.credentials();
                }
                if (message instanceof WorkerMessage.Failure f) {
                    failed++;
                    log.warn("Worker {} failed: {}", f.workerId(), f.reason());
                    if (failed >= workerCount) {
                        throw new GenerationException("All " + workerCount + " workers failed to generate tokens");
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Token generation interrupted", e);
        } finally {
            stopAll(workers);
            current = List.of();
        }
    }

    private void stopAll(List<ProducerWorker> workers) {
        for (ProducerWorker worker : workers) {
            worker.send(WorkerCommand.stop());
        }
        // one grace period for the whole pool, not one per worker
        long graceEnd = System.nanoTime() + shutdownGrace.toNanos();
        boolean interrupted = false;
        for (ProducerWorker worker : workers) {
            try {
                Duration left = Duration.ofNanos(Math.max(0, graceEnd - System.nanoTime()));
                if (!worker.awaitTermination(left)) {
                    log.warn("Worker {} still running {} ms after STOP", worker.id(), shutdownGrace.toMillis());
                }
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
