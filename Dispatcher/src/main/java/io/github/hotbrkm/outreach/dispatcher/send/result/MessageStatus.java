package io.github.hotbrkm.outreach.dispatcher.send.result;

public enum MessageStatus {
    SENT,
    FAILED,
    /** Recipient was skip-listed before any attempt. */
    SKIPPED,
    /** Not attempted in this run; stays pending for a later tick. */
    DEFERRED
}
