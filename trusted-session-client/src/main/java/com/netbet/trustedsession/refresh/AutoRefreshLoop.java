package com.netbet.trustedsession.refresh;

import com.netbet.trustedsession.cache.TokenCache;
import com.netbet.trustedsession.generation.Sleeper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Keeps the cache warm: asks for a non-forced token, then waits the refresh interval.
 * Failures are logged and retried after the shorter recovery delay; the loop only ends on stop().
 */
@Component
public class AutoRefreshLoop {

    private static final Logger log = LoggerFactory.getLogger(AutoRefreshLoop.class);
    private static final long DEFAULT_RECOVERY_DELAY_MS = 5_000;

    private final TokenCache tokenCache;
    private final Sleeper sleeper;
    private final Duration recoveryDelay;
    private volatile Thread worker;

    public AutoRefreshLoop(TokenCache tokenCache,
                           Sleeper sleeper,
                           @Value("${trusted-session.auto-refresh.recovery-delay-ms:5000}") long recoveryDelayMs) {
        this.tokenCache = tokenCache;
        this.sleeper = sleeper;
        this.recoveryDelay = Duration.ofMillis(recoveryDelayMs > 0 ? recoveryDelayMs : DEFAULT_RECOVERY_DELAY_MS);
    }

    public boolean isRunning() {
        return worker != null;
    }

    public synchronized void start() {
        if (worker != null) return;
        Thread t = new Thread(this::runLoop, "auto-refresh");
        t.setDaemon(true);
        worker = t;
        t.start();
        log.info("Auto refresh started (interval={} ms, recovery={} ms)",
                tokenCache.refreshInterval().toMillis(), recoveryDelay.toMillis());
    }

    @PreDestroy
    public synchronized void stop() {
        Thread t = worker;
        if (t == null) return;
        worker = null;
        t.interrupt();
        log.info("Auto refresh stopped");
    }

    // a loop thread keeps going only while it is still the current worker
    private boolean isCurrent() {
        return worker == Thread.currentThread();
    }

    private void runLoop() {
        while (isCurrent()) {
            Duration pause;
            try {
                tokenCache.get(false);
                pause = tokenCache.refreshInterval();
            } catch (RuntimeException e) {
                if (!isCurrent()) break;
                log.error("Auto-update error: {}", e.getMessage());
                pause = recoveryDelay;
            }
            try {
                sleeper.sleep(pause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }
}
