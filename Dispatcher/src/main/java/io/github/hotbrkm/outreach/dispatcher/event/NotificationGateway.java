package io.github.hotbrkm.outreach.dispatcher.event;

import io.github.hotbrkm.outreach.dispatcher.schedule.DailyReport;

/**
 * Receives dispatcher events and daily reports for display or delivery elsewhere.
 * Implementations must not block for long; they run on the dispatching thread.
 */
public interface NotificationGateway {

    void onEvent(DispatchEvent event);

    default void onReport(DailyReport report) {
    }
}
