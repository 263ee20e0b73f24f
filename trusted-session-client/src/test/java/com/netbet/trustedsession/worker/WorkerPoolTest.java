package com.netbet.trustedsession.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.netbet.trustedsession.generation.Deadline;
import com.netbet.trustedsession.generation.GenerationException;
import com.netbet.trustedsession.generation.GenerationTimeoutException;
import com.netbet.trustedsession.model.Credentials;
import com.netbet.trustedsession.producer.TokenProducerException;
import com.netbet.trustedsession.producer.TokenProducerFactory;
import com.netbet.trustedsession.testing.StubProducer;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import org.junit.jupiter.api.Test;

class WorkerPoolTest {

    private final Clock clock = Clock.systemUTC();
    private final List<StubProducer> producers = new CopyOnWriteArrayList<>();

    private TokenProducerFactory scripted(BiFunction<Integer, String, StubProducer> script) {
        AtomicInteger created = new AtomicInteger();
        return sessionId -> {
            StubProducer p = script.apply(created.incrementAndGet(), sessionId);
            producers.add(p);
            return p;
        };
    }

    @Test
    void firstSuccessWinsAndEveryWorkerIsStoppedExactlyOnce() throws Exception {
        WorkerPool pool = new WorkerPool(scripted((n, sid) -> switch (n) {
            case 1 -> StubProducer.succeedingAfter(sid, Duration.ofMillis(100));
            case 2 -> StubProducer.failing(sid, "script error");
            default -> StubProducer.hanging(sid);
        }), 160, 5_000);

        Credentials credentials = pool.race("visitor", 4, Deadline.after(clock, Duration.ofSeconds(10)));

        assertThat(credentials.sessionId()).isEqualTo("visitor");
        assertThat(credentials.proof()).isEqualTo(StubProducer.VALID_PROOF);
        assertThat(producers).hasSize(4)
                .allSatisfy(p -> assertThat(p.stopCount()).isEqualTo(1));
        assertThat(pool.currentWorkers()).isEmpty();
    }

    @Test
    void failsWhenEveryWorkerFails() {
        WorkerPool pool = new WorkerPool(scripted((n, sid) -> StubProducer.failing(sid, "boom " + n)), 160, 5_000);

        assertThatThrownBy(() -> pool.race("visitor", 3, Deadline.after(clock, Duration.ofSeconds(10))))
                .isInstanceOf(GenerationException.class)
                .isNotInstanceOf(GenerationTimeoutException.class)
                .hasMessage("All 3 workers failed to generate tokens");
        assertThat(producers).hasSize(3)
                .allSatisfy(p -> assertThat(p.stopCount()).isEqualTo(1));
    }

    @Test
    void invalidProofLengthCountsAsWorkerFailure() {
        WorkerPool pool = new WorkerPool(scripted((n, sid) -> StubProducer.returningProof(sid, "x".repeat(159))), 160, 5_000);

        assertThatThrownBy(() -> pool.race("visitor", 2, Deadline.after(clock, Duration.ofSeconds(10))))
                .hasMessage("All 2 workers failed to generate tokens");
    }

    @Test
    void factoryErrorIsReportedAsFailure() {
        WorkerPool pool = new WorkerPool(sessionId -> {
            throw new IllegalStateException("no script loaded");
        }, 160, 5_000);

        assertThatThrownBy(() -> pool.race("visitor", 2, Deadline.after(clock, Duration.ofSeconds(10))))
                .hasMessage("All 2 workers failed to generate tokens");
    }

    @Test
    void timesOutAtTheDeadlineWhenNoWorkerSettles() {
        WorkerPool pool = new WorkerPool(scripted((n, sid) -> StubProducer.hanging(sid)), 160, 5_000);

        long started = System.nanoTime();
        assertThatThrownBy(() -> pool.race("visitor", 3, Deadline.after(clock, Duration.ofMillis(300))))
                .isInstanceOf(GenerationTimeoutException.class)
                .hasMessageContaining("timeout");
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertThat(elapsedMs).isGreaterThanOrEqualTo(300).isLessThan(3_000);
        assertThat(producers).hasSize(3)
                .allSatisfy(p -> assertThat(p.stopCount()).isEqualTo(1));
    }

    @Test
    void laterSuccessesAfterSettlementAreIgnored() throws Exception {
        WorkerPool pool = new WorkerPool(scripted((n, sid) -> n == 1
                ? StubProducer.succeeding(sid)
                : StubProducer.succeedingAfter(sid, Duration.ofMillis(50))), 160, 5_000);

        Credentials credentials = pool.race("visitor", 3, Deadline.after(clock, Duration.ofSeconds(10)));

        assertThat(credentials.proof()).isEqualTo(StubProducer.VALID_PROOF);
        assertThat(producers).allSatisfy(p -> assertThat(p.stopCount()).isEqualTo(1));
    }

    @Test
    void rejectsNonPositiveWorkerCount() {
        WorkerPool pool = new WorkerPool(scripted((n, sid) -> StubProducer.succeeding(sid)), 160, 5_000);

        assertThatThrownBy(() -> pool.race("visitor", 0, Deadline.after(clock, Duration.ofSeconds(1))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultWorkerCountIsAtLeastOne() {
        assertThat(WorkerPool.defaultWorkerCount()).isGreaterThanOrEqualTo(1);
    }

    /** Producer that ignores stop and interrupts until {@code holdFor} has passed. */
    private static StubProducer ignoringStop(String sessionId, Duration holdFor) {
        return new StubProducer(sessionId, self -> {
            long end = System.nanoTime() + holdFor.toNanos();
            while (System.nanoTime() < end) {
                try {
                    Thread.sleep(20);
                } catch (InterruptedException e) {
                    // keep holding
                }
            }
            throw new TokenProducerException("released");
        });
    }

    @Test
    void stuckWorkersShareOneShutdownGrace() {
        WorkerPool pool = new WorkerPool(scripted((n, sid) -> ignoringStop(sid, Duration.ofSeconds(4))), 160, 500);

        long started = System.nanoTime();
        assertThatThrownBy(() -> pool.race("visitor", 4, Deadline.after(clock, Duration.ofMillis(200))))
                .isInstanceOf(GenerationTimeoutException.class);
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        // four sequential grace periods would take over 2 s
        assertThat(elapsedMs).isGreaterThanOrEqualTo(200).isLessThan(1_600);
        assertThat(producers).hasSize(4)
                .allSatisfy(p -> assertThat(p.stopCount()).isEqualTo(1));
    }
}
