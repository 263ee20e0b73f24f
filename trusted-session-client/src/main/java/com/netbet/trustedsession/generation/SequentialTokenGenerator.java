package com.netbet.trustedsession.generation;

import com.netbet.trustedsession.model.Credentials;
import com.netbet.trustedsession.model.GenerationAttempt;
import com.netbet.trustedsession.model.GenerationAttempt.Outcome;
import com.netbet.trustedsession.producer.TokenProducer;
import com.netbet.trustedsession.producer.TokenProducerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single-producer strategy: up to maxAttempts runs, each with its own timeout, fixed backoff in between.
 * Producers run on one executor thread per call, so at most one is ever live; each is stopped before
 * the next attempt starts. Results with the wrong proof length count as failed attempts.
 */
@Component
public class SequentialTokenGenerator {

    private static final Logger log = LoggerFactory.getLogger(SequentialTokenGenerator.class);
    private static final int DEFAULT_MAX_ATTEMPTS = 5;
    private static final long DEFAULT_ATTEMPT_TIMEOUT_MS = 30_000;
    private static final long DEFAULT_BACKOFF_MS = 2_000;

    private final TokenProducerFactory producerFactory;
    private final Sleeper sleeper;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration attemptTimeout;
    private final Duration backoff;
    private final int proofLength;

    public SequentialTokenGenerator(TokenProducerFactory producerFactory,
                                    Sleeper sleeper,
                                    Clock clock,
                                    @Value("${trusted-session.sequential.max-attempts:5}") int maxAttempts,
                                    @Value("${trusted-session.sequential.attempt-timeout-ms:30000}") long attemptTimeoutMs,
                                    @Value("${trusted-session.sequential.backoff-ms:2000}") long backoffMs,
                                    @Value("${trusted-session.proof-length:160}") int proofLength) {
        this.producerFactory = producerFactory;
        this.sleeper = sleeper;
        this.clock = clock;
        this.maxAttempts = maxAttempts > 0 ? maxAttempts : DEFAULT_MAX_ATTEMPTS;
        this.attemptTimeout = Duration.ofMillis(attemptTimeoutMs > 0 ? attemptTimeoutMs : DEFAULT_ATTEMPT_TIMEOUT_MS);
        this.backoff = Duration.ofMillis(backoffMs >= 0 ? backoffMs : DEFAULT_BACKOFF_MS);
        this.proofLength = proofLength > 0 ? proofLength : Credentials.DEFAULT_PROOF_LENGTH;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Credentials run(String sessionId, Deadline deadline) throws GenerationException {
        List<GenerationAttempt> attempts = new ArrayList<>(maxAttempts);
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "token-attempt");
            t.setDaemon(true);
            return t;
        });
        try {
            for (int n = 1; n <= maxAttempts; n++) {
                if (deadline.isExpired()) {
                    throw new GenerationTimeoutException(
                            "Token generation timeout after " + deadline.timeout().toMillis() + " ms", attempts);
                }
                Duration timeout = deadline.cap(attemptTimeout);
                GenerationAttempt attempt = GenerationAttempt.pending(n, clock.instant().plus(timeout));
                log.info("Token generation attempt {}/{}", n, maxAttempts);

                TokenProducer producer = null;
                Future<Credentials> result = null;
                try {
                    producer = producerFactory.create(sessionId);
                    result = executor.submit(producer::start);
                    Credentials credentials = result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                    if (credentials != null && credentials.hasValidProof(proofLength)) {
                        attempts.add(attempt.settle(Outcome.SUCCESS, null));
                        log.info("Token generated on attempt {}/{}", n, maxAttempts);
                        return credentials;
                    }
                    int length = credentials == null || credentials.proof() == null ? 0 : credentials.proof().length();
                    attempt = attempt.settle(Outcome.INVALID, "token length " + length + ", expected " + proofLength);
                } catch (TimeoutException e) {
                    attempt = attempt.settle(Outcome.TIMEOUT, "no token within " + timeout.toMillis() + " ms");
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    attempt = attempt.settle(Outcome.FAILURE, cause.getMessage());
                } catch (RuntimeException e) {
                    // factory could not build a producer
                    attempt = attempt.settle(Outcome.FAILURE, e.getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new GenerationException("Token generation interrupted", e);
                } finally {
                    if (producer != null) producer.stop();
                    if (result != null) result.cancel(true);
                }

                attempts.add(attempt);
                log.warn("Token generation attempt {}/{} failed: {}", n, maxAttempts, attempt);

                if (n < maxAttempts) {
                    try {
                        sleeper.sleep(deadline.cap(backoff));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new GenerationException("Token generation interrupted", e);
                    }
                }
            }
        } finally {
            executor.shutdownNow();
        }
        if (deadline.isExpired()) {
            throw new GenerationTimeoutException(
                    "Token generation timeout after " + deadline.timeout().toMillis() + " ms", attempts);
        }
        throw new GenerationException("Token generation failed after " + maxAttempts + " attempts " + attempts, attempts);
    }
}
