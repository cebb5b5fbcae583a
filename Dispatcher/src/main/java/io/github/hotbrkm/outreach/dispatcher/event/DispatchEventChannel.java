package io.github.hotbrkm.outreach.dispatcher.event;

import io.github.hotbrkm.outreach.dispatcher.schedule.DailyReport;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Single typed channel the dispatcher publishes to. Fans every event out to all registered gateways;
 * a failing gateway is logged and never affects the publisher or the other gateways.
 */
@Slf4j
public class DispatchEventChannel {

    private final List<NotificationGateway> gateways = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public DispatchEventChannel(Clock clock, List<NotificationGateway> gateways) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (gateways != null) {
            this.gateways.addAll(gateways);
        }
    }

    public void register(NotificationGateway gateway) {
        gateways.add(Objects.requireNonNull(gateway, "gateway must not be null"));
    }

    public void publish(DispatchEvent event) {
        for (NotificationGateway gateway : gateways) {
            try {
                gateway.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("event=gateway_failed, type={}, gateway={}", event.type(), gateway.getClass().getSimpleName(), e);
            }
        }
    }

    public void publishReport(DailyReport report) {
        for (NotificationGateway gateway : gateways) {
            try {
                gateway.onReport(report);
            } catch (RuntimeException e) {
                log.warn("event=gateway_report_failed, kind={}, gateway={}", report.kind(), gateway.getClass().getSimpleName(), e);
            }
        }
    }

    public void serverLog(String campaignId, ServerLogEvent.Level level, String message) {
        publish(new ServerLogEvent(campaignId, clock.instant(), level, message));
    }

    public Clock clock() {
        return clock;
    }
}
