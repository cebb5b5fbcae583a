package io.github.hotbrkm.outreach.dispatcher.send.worker;

/**
 * Blocking pause used between messages and before retries.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = millis -> {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    };

    void sleep(long millis) throws InterruptedException;
}
