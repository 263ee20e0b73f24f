package com.netbet.trustedsession.worker;

import com.netbet.trustedsession.model.Credentials;
import com.netbet.trustedsession.producer.ProducerStoppedException;
import com.netbet.trustedsession.producer.TokenProducer;
import com.netbet.trustedsession.producer.TokenProducerException;
import com.netbet.trustedsession.producer.TokenProducerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Isolated race participant. A control thread consumes START/STOP commands from the inbox;
 * the producer itself runs on a separate runner thread so STOP is handled while it is busy.
 * The only way out is a message on the pool's outbox; nothing is shared with other workers.
 */
final class ProducerWorker {

    private static final Logger log = LoggerFactory.getLogger(ProducerWorker.class);

    private final int id;
    private final TokenProducerFactory producerFactory;
    private final int proofLength;
    private final BlockingQueue<WorkerCommand> inbox = new LinkedBlockingQueue<>();
    private final BlockingQueue<WorkerMessage> outbox;
    private final Thread control;
    private final ExecutorService runner;

    private volatile WorkerStatus status = WorkerStatus.IDLE;
    private volatile String assignedSessionId;
    private volatile boolean stopRequested;
    // control thread only
    private TokenProducer producer;

    ProducerWorker(int id, TokenProducerFactory producerFactory, int proofLength, BlockingQueue<WorkerMessage> outbox) {
        this.id = id;
        this.producerFactory = producerFactory;
        this.proofLength = proofLength;
        this.outbox = outbox;
        this.control = new Thread(this::runControl, "token-worker-" + id);
        this.control.setDaemon(true);
        this.runner = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "token-worker-" + id + "-producer");
            t.setDaemon(true);
            return t;
        });
    }

    int id() {
        return id;
    }

    WorkerState state() {
        return new WorkerState(id, status, assignedSessionId);
    }

    void spawn() {
        control.start();
    }

    void send(WorkerCommand command) {
        inbox.offer(command);
    }

    /**
     * Wait for the control and runner threads to exit after STOP.
     *
     * @return false if either is still alive when the grace period ends
     */
    boolean awaitTermination(Duration grace) throws InterruptedException {
        long deadlineNanos = System.nanoTime() + grace.toNanos();
        control.join(Math.max(1, grace.toMillis()));
        long left = deadlineNanos - System.nanoTime();
        return !control.isAlive() && runner.awaitTermination(Math.max(0, left), TimeUnit.NANOSECONDS);
    }

    private void runControl() {
        try {
            while (true) {
                WorkerCommand command = inbox.take();
                if (command.action() == WorkerCommand.Action.START) {
                    handleStart(command.sessionId());
                } else {
                    handleStop();
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handleStop();
        }
    }

    private void handleStart(String sessionId) {
        if (status != WorkerStatus.IDLE) {
            log.warn("Worker {} ignoring START in state {}", id, status);
            return;
        }
        assignedSessionId = sessionId;
        status = WorkerStatus.RUNNING;
        TokenProducer p;
        try {
            p = producerFactory.create(sessionId);
        } catch (RuntimeException e) {
            outbox.offer(new WorkerMessage.Failure(id, "could not create producer: " + e.getMessage()));
            return;
        }
        producer = p;
        runner.execute(() -> runProducer(p));
    }

    private void runProducer(TokenProducer p) {
        WorkerMessage result = null;
        try {
            Credentials credentials = p.start();
            if (credentials != null && credentials.hasValidProof(proofLength)) {
                result = new WorkerMessage.Success(id, credentials);
            } else {
                int length = credentials == null || credentials.proof() == null ? 0 : credentials.proof().length();
                result = new WorkerMessage.Failure(id, "invalid token length " + length + ", expected " + proofLength);
            }
        } catch (ProducerStoppedException e) {
            result = new WorkerMessage.Failure(id, "stopped: " + e.getMessage());
        } catch (TokenProducerException e) {
            result = new WorkerMessage.Failure(id, e.getMessage());
        } catch (RuntimeException e) {
            result = new WorkerMessage.Failure(id, "unexpected error: " + e);
        } finally {
            if (stopRequested) {
                log.debug("Worker {} finished after STOP, result discarded", id);
            } else {
                outbox.offer(result != null ? result
                        : new WorkerMessage.Failure(id, "exited without reporting a result"));
            }
        }
    }

    private void handleStop() {
        stopRequested = true;
        status = WorkerStatus.STOPPED;
        TokenProducer p = producer;
        if (p != null) {
            p.stop();
        }
        runner.shutdownNow();
    }
}
