package dao.bridge.relayer.util;

/**
 * Blocking pause, injectable so that backoff and throttling can be asserted without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
