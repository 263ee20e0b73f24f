package com.netbet.trustedsession.worker;

import com.netbet.trustedsession.model.Credentials;

/**
 * Terminal message a worker posts up to the pool. Exactly one per worker unless it was stopped first.
 */
interface WorkerMessage {

    int workerId();

    record Success(int workerId, Credentials credentials) implements WorkerMessage {}

    record Failure(int workerId, String reason) implements WorkerMessage {}
}
