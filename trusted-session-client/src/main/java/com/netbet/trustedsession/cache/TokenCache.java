package com.netbet.trustedsession.cache;

import com.netbet.trustedsession.generation.CredentialsGenerator;
import com.netbet.trustedsession.generation.GenerationException;
import com.netbet.trustedsession.model.CacheEntry;
import com.netbet.trustedsession.model.Credentials;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Latest credentials plus a single-flight refresh. Concurrent callers that need a refresh all wait
 * on the same future; a fresh entry is returned without blocking. The entry is only replaced, whole,
 * by a successful refresh, and only with a proof of the expected length.
 */
@Component
public class TokenCache {

    private static final Logger log = LoggerFactory.getLogger(TokenCache.class);
    private static final long DEFAULT_REFRESH_INTERVAL_MS = 30_000;

    private final CredentialsGenerator generator;
    private final Clock clock;
    private final Duration refreshInterval;
    private final int proofLength;
    private final ExecutorService refreshExecutor;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile CacheEntry entry = CacheEntry.EMPTY;
    // guarded by lock
    private CompletableFuture<Credentials> inFlight;

    public TokenCache(CredentialsGenerator generator,
                      Clock clock,
                      @Value("${trusted-session.refresh-interval-ms:30000}") long refreshIntervalMs,
                      @Value("${trusted-session.proof-length:160}") int proofLength) {
        this.generator = generator;
        this.clock = clock;
        this.refreshInterval = Duration.ofMillis(refreshIntervalMs > 0 ? refreshIntervalMs : DEFAULT_REFRESH_INTERVAL_MS);
        this.proofLength = proofLength > 0 ? proofLength : Credentials.DEFAULT_PROOF_LENGTH;
        this.refreshExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "token-refresh");
            t.setDaemon(true);
            return t;
        });
        log.info("TokenCache created (refreshIntervalMs={})", this.refreshInterval.toMillis());
    }

    public Duration refreshInterval() {
        return refreshInterval;
    }

    public CacheEntry snapshot() {
        return entry;
    }

    public boolean isRefreshing() {
        lock.lock();
        try {
            return inFlight != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns cached credentials, refreshing first when forced, empty or older than the refresh interval.
     *
     * @throws TokenGenerationException if the refresh this call waited on failed
     */
    public Credentials get(boolean forceUpdate) {
        CacheEntry current = entry;
        if (!forceUpdate && isFresh(current)) {
            return current.credentials();
        }

        CompletableFuture<Credentials> refresh;
        lock.lock();
        try {
            current = entry;
            if (!forceUpdate && isFresh(current)) {
                return current.credentials();
            }
            if (inFlight != null) {
                log.debug("Refresh already in flight, waiting for it");
                refresh = inFlight;
            } else {
                if (forceUpdate) {
                    log.info("Force updating tokens...");
                } else if (current.isEmpty()) {
                    log.info("Generating initial tokens...");
                } else {
                    log.info("Refreshing expired tokens...");
                }
                refresh = startRefresh();
            }
        } finally {
            lock.unlock();
        }
        return await(refresh);
    }

    public Credentials get() {
        return get(false);
    }

    private boolean isFresh(CacheEntry e) {
        if (e.isEmpty() || e.lastUpdated() == null) return false;
        return Duration.between(e.lastUpdated(), clock.instant()).compareTo(refreshInterval) <= 0;
    }

    // caller holds lock
    private CompletableFuture<Credentials> startRefresh() {
        CompletableFuture<Credentials> refresh = new CompletableFuture<>();
        inFlight = refresh;
        try {
            refreshExecutor.execute(() -> runRefresh(refresh));
        } catch (RejectedExecutionException e) {
            inFlight = null;
            refresh.completeExceptionally(new GenerationException("Token cache is shut down", e));
        }
        return refresh;
    }

    private void runRefresh(CompletableFuture<Credentials> refresh) {
        Credentials result = null;
        Throwable failure = null;
        try {
            Credentials generated = generator.generate();
            if (generated == null || !generated.hasValidProof(proofLength)) {
                throw new GenerationException("Generated token rejected: expected length " + proofLength);
            }
            result = generated;
        } catch (GenerationException | RuntimeException e) {
            failure = e;
        } finally {
            lock.lock();
            try {
                if (result != null) {
                    entry = new CacheEntry(result, clock.instant());
                }
                if (inFlight == refresh) {
                    inFlight = null;
                }
            } finally {
                lock.unlock();
            }
            if (result != null) {
                refresh.complete(result);
            } else {
                refresh.completeExceptionally(failure != null ? failure
                        : new GenerationException("Token refresh ended without a result"));
            }
        }
    }

    private Credentials await(CompletableFuture<Credentials> refresh) {
        try {
            return refresh.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenGenerationException("Interrupted while waiting for token refresh", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TokenGenerationException(cause.getMessage(), cause);
        }
    }

    @PreDestroy
    public void shutdown() {
        refreshExecutor.shutdownNow();
    }
}
