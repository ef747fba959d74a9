package com.novelforge.pipeline;

/**
 * Blocking wait used by retries and polling gates, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleepSeconds(long seconds) throws InterruptedException;

    Sleeper SYSTEM = seconds -> Thread.sleep(seconds * 1000L);
}
