package io.github.hotbrkm.outreach.dispatcher.schedule;

import io.github.hotbrkm.outreach.dispatcher.event.CampaignCompleteEvent;
import io.github.hotbrkm.outreach.dispatcher.event.CampaignProgressEvent;
import io.github.hotbrkm.outreach.dispatcher.event.DispatchEvent;
import io.github.hotbrkm.outreach.dispatcher.event.EmailErrorEvent;
import io.github.hotbrkm.outreach.dispatcher.event.EmailSentEvent;
import io.github.hotbrkm.outreach.dispatcher.event.NotificationGateway;
import io.github.hotbrkm.outreach.dispatcher.event.ServerLogEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded in-memory history of recent dispatch activity, newest last.
 * Progress events are not kept; they are superseded too quickly to be useful here.
 */
public class DispatchActivityLog implements NotificationGateway {

    private final int hardLimit;
    private final Deque<Entry> entries = new ArrayDeque<>();

    public DispatchActivityLog(int hardLimit) {
        this.hardLimit = Math.max(1, hardLimit);
    }

    @Override
    public synchronized void onEvent(DispatchEvent event) {
        if (event instanceof CampaignProgressEvent) {
            return;
        }
        entries.addLast(new Entry(event.timestamp(), event.campaignId(), event.type(), describe(event)));
        while (entries.size() > hardLimit) {
            entries.removeFirst();
        }
    }

    /**
     * Drops entries older than {@code retention} and keeps at most {@code depth} of the newest.
     *
     * @return number of entries removed
     */
    public synchronized int trim(int depth, Duration retention, Instant now) {
        int removed = 0;
        if (retention != null) {
            Instant cutoff = now.minus(retention);
            Iterator<Entry> iterator = entries.iterator();
            while (iterator.hasNext()) {
                if (iterator.next().timestamp().isBefore(cutoff)) {
                    iterator.remove();
                    removed++;
                }
            }
        }
        while (entries.size() > Math.max(0, depth)) {
            entries.removeFirst();
            removed++;
        }
        return removed;
    }

    public synchronized List<Entry> recent(int limit) {
        List<Entry> all = new ArrayList<>(entries);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return List.copyOf(all.subList(from, all.size()));
    }

    public synchronized int size() {
        return entries.size();
    }

    private static String describe(DispatchEvent event) {
        if (event instanceof EmailSentEvent sent) {
            return "Sent to " + sent.recipient();
        }
        if (event instanceof EmailErrorEvent error) {
            return "Failed " + error.recipient() + ": " + error.errorMessage();
        }
        if (event instanceof CampaignCompleteEvent complete) {
            return "Completed with " + complete.totalEmailsSent() + " sent in " + complete.durationDays() + " day(s)";
        }
        if (event instanceof ServerLogEvent serverLog) {
            return serverLog.level() + ": " + serverLog.message();
        }
        return event.type();
    }

    public record Entry(Instant timestamp, String campaignId, String type, String message) {
    }
}
