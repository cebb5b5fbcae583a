package io.github.hotbrkm.outreach.dispatcher.event;

import java.time.Instant;

/**
 * Structured event published by the dispatcher. Every event names its campaign (null for process-wide events)
 * and the time it was raised.
 */
public interface DispatchEvent {

    String campaignId();

    Instant timestamp();

    /**
     * Wire name of the event, e.g. {@code campaign-progress}.
     */
    String type();
}
