package com.vestpod.common;

/**
 * Pause between retry attempts. Swapped out in tests to record delays without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;

    static Sleeper threadSleep() {
        return millis -> Thread.sleep(Math.max(0L, millis));
    }
}
