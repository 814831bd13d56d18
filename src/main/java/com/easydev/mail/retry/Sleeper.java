package com.easydev.mail.retry;

/**
 * Blocks the calling thread between retry attempts. Swapped for a recording
 * implementation in tests so back-off timing can be asserted without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
