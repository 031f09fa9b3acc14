package com.eventboard.fetch;

/**
 * Pause between page requests; replaced in tests to avoid real waits.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
