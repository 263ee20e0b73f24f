package com.netbet.trustedsession.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.netbet.trustedsession.generation.CredentialsGenerator;
import com.netbet.trustedsession.generation.GenerationException;
import com.netbet.trustedsession.model.Credentials;
import com.netbet.trustedsession.testing.MutableClock;
import com.netbet.trustedsession.testing.StubProducer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TokenCacheTest {

    private static final long INTERVAL_MS = 30_000;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final AtomicInteger generations = new AtomicInteger();
    private final ExecutorService callers = Executors.newFixedThreadPool(8);
    private TokenCache cache;

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
        if (cache != null) cache.shutdown();
    }

    private CredentialsGenerator counting(CredentialsGenerator delegate) {
        return () -> {
            generations.incrementAndGet();
            return delegate.generate();
        };
    }

    private static Credentials credentials(String sessionId) {
        return new Credentials(sessionId, StubProducer.VALID_PROOF);
    }

    @Test
    void emptyCacheGeneratesOnceAndThenServesCachedValue() {
        cache = new TokenCache(counting(() -> credentials("visitor-1")), clock, INTERVAL_MS, 160);

        Credentials first = cache.get(false);
        Credentials second = cache.get(false);

        assertThat(first.sessionId()).isEqualTo("visitor-1");
        assertThat(second).isSameAs(first);
        assertThat(generations).hasValue(1);
        assertThat(cache.snapshot().credentials()).isSameAs(first);
        assertThat(cache.snapshot().lastUpdated()).isEqualTo(clock.instant());
    }

    @Test
    void concurrentCallersOnEmptyCacheShareOneGeneration() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        cache = new TokenCache(counting(() -> {
            await(release);
            return credentials("shared");
        }), clock, INTERVAL_MS, 160);

        List<Future<Credentials>> results = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            results.add(callers.submit(() -> cache.get(false)));
        }
        waitUntilRefreshing();
        release.countDown();

        Credentials expected = results.get(0).get(5, TimeUnit.SECONDS);
        for (Future<Credentials> result : results) {
            assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(expected);
        }
        assertThat(generations).hasValue(1);
        assertThat(cache.isRefreshing()).isFalse();
    }

    @Test
    void entryWithinIntervalIsNotRefreshed() {
        cache = new TokenCache(counting(() -> credentials("v")), clock, INTERVAL_MS, 160);
        cache.get(false);

        clock.advance(Duration.ofMillis(INTERVAL_MS));
        cache.get(false);

        assertThat(generations).hasValue(1);
    }

    @Test
    void entryOlderThanIntervalTriggersNewGeneration() {
        AtomicInteger n = new AtomicInteger();
        cache = new TokenCache(counting(() -> credentials("v" + n.incrementAndGet())), clock, INTERVAL_MS, 160);
        cache.get(false);

        clock.advance(Duration.ofMillis(40_000));
        Credentials refreshed = cache.get(false);

        assertThat(generations).hasValue(2);
        assertThat(refreshed.sessionId()).isEqualTo("v2");
    }

    @Test
    void forcedUpdateAlwaysGenerates() {
        cache = new TokenCache(counting(() -> credentials("v")), clock, INTERVAL_MS, 160);
        cache.get(false);

        cache.get(true);

        assertThat(generations).hasValue(2);
    }

    @Test
    void forcedUpdateJoinsRefreshAlreadyInFlight() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        cache = new TokenCache(counting(() -> {
            await(release);
            return credentials("loop");
        }), clock, INTERVAL_MS, 160);

        Future<Credentials> background = callers.submit(() -> cache.get(false));
        waitUntilRefreshing();
        Future<Credentials> forced = callers.submit(() -> cache.get(true));
        Thread.sleep(50);
        release.countDown();

        assertThat(forced.get(5, TimeUnit.SECONDS)).isSameAs(background.get(5, TimeUnit.SECONDS));
        assertThat(generations).hasValue(1);
    }

    @Test
    void failureReachesCallerAndKeepsLastGoodValue() {
        AtomicInteger calls = new AtomicInteger();
        cache = new TokenCache(counting(() -> {
            if (calls.incrementAndGet() == 2) throw new GenerationException("All 3 workers failed to generate tokens");
            return credentials("v" + calls.get());
        }), clock, INTERVAL_MS, 160);
        Credentials good = cache.get(false);
        clock.advance(Duration.ofMinutes(1));

        assertThatThrownBy(() -> cache.get(false))
                .isInstanceOf(TokenGenerationException.class)
                .hasMessageContaining("All 3 workers failed")
                .hasCauseInstanceOf(GenerationException.class);
        assertThat(cache.snapshot().credentials()).isSameAs(good);
        assertThat(cache.isRefreshing()).isFalse();

        Credentials recovered = cache.get(false);
        assertThat(recovered.sessionId()).isEqualTo("v3");
        assertThat(generations).hasValue(3);
    }

    @Test
    void concurrentWaitersAllSeeTheSameFailure() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        GenerationException boom = new GenerationException("Token generation timeout after 120000 ms");
        cache = new TokenCache(counting(() -> {
            await(release);
            throw boom;
        }), clock, INTERVAL_MS, 160);

        List<Future<Throwable>> results = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            results.add(callers.submit(() -> {
                try {
                    cache.get(false);
                    return null;
                } catch (TokenGenerationException e) {
                    return e.getCause();
                }
            }));
        }
        waitUntilRefreshing();
        Thread.sleep(50);
        release.countDown();

        for (Future<Throwable> result : results) {
            assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(boom);
        }
        assertThat(generations).hasValue(1);
    }

    @Test
    void proofOfWrongLengthIsNeverCached() {
        cache = new TokenCache(counting(() -> new Credentials("v", "short")), clock, INTERVAL_MS, 160);

        assertThatThrownBy(() -> cache.get(false))
                .isInstanceOf(TokenGenerationException.class)
                .hasMessageContaining("expected length 160");
        assertThat(cache.snapshot().isEmpty()).isTrue();
    }

    private void waitUntilRefreshing() throws InterruptedException {
        long until = System.currentTimeMillis() + 5_000;
        while (!cache.isRefreshing() && System.currentTimeMillis() < until) {
            Thread.sleep(5);
        }
        assertThat(cache.isRefreshing()).isTrue();
    }

    private static void await(CountDownLatch latch) throws GenerationException {
        try {
            if (!latch.await(10, TimeUnit.SECONDS)) throw new GenerationException("test latch not released");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("interrupted", e);
        }
    }
}
