package io.github.hotbrkm.outreach.dispatcher.send.limit;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide send suspension raised after the relay rejects our credentials.
 * Sending stays suspended until {@link #resume()} is called.
 */
@Slf4j
public class SendSuspensionGuard {

    private final AtomicReference<String> reason = new AtomicReference<>();

    public boolean suspend(String cause) {
        String value = cause == null || cause.isBlank() ? "suspended" : cause;
        boolean changed = reason.compareAndSet(null, value);
        if (changed) {
            log.error("event=sending_suspended, reason={}", value);
        }
        return changed;
    }

    public void resume() {
        String previous = reason.getAndSet(null);
        if (previous != null) {
            log.info("event=sending_resumed, previousReason={}", previous);
        }
    }

    public boolean isSuspended() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }
}
