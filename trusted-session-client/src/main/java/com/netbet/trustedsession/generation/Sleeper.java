package com.netbet.trustedsession.generation;

import java.time.Duration;

/**
 * Blocking pause used for backoff and refresh waits. Replaced by a recording sleeper in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
