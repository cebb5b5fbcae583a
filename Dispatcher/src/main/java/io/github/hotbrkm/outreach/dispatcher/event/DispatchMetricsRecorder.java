package io.github.hotbrkm.outreach.dispatcher.event;

import io.github.hotbrkm.outreach.dispatcher.send.limit.RateLimitReason;
import io.github.hotbrkm.outreach.dispatcher.send.result.MessageStatus;
import io.github.hotbrkm.outreach.dispatcher.send.transport.ErrorCategory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class DispatchMetricsRecorder {

    private final MeterRegistry registry;

    public DispatchMetricsRecorder(MeterRegistry registry) {
        this.registry = registry == null ? new SimpleMeterRegistry() : registry;
    }

    public void recordMessage(MessageStatus status, ErrorCategory category) {
        if (status == null) {
            return;
        }
        registry.counter("outreach.dispatch.message.total",
                "status", status.name(),
                "category", category == null ? "none" : category.name())
                .increment();
    }

    public void recordRetry(ErrorCategory category) {
        registry.counter("outreach.dispatch.retry.total",
                "category", category == null ? "none" : category.name())
                .increment();
    }

    public void recordDenied(RateLimitReason reason) {
        if (reason == null || reason == RateLimitReason.NONE) {
            return;
        }
        registry.counter("outreach.dispatch.ratelimit.denied",
                "reason", reason.name())
                .increment();
    }

    public void recordDelay(long delayMillis) {
        if (delayMillis > 0) {
            registry.summary("outreach.dispatch.delay.millis").record(delayMillis);
        }
    }

    public void recordCampaignCompleted() {
        registry.counter("outreach.campaign.completed.total").increment();
    }

    public MeterRegistry registry() {
        return registry;
    }
}
