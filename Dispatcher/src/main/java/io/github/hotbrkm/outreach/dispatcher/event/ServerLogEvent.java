package io.github.hotbrkm.outreach.dispatcher.event;

import java.time.Instant;

public record ServerLogEvent(String campaignId, Instant timestamp, Level level, String message) implements DispatchEvent {

    public enum Level {
        INFO,
        WARNING,
        ERROR,
        SUCCESS
    }

    @Override
    public String type() {
        return "server-log";
    }
}
