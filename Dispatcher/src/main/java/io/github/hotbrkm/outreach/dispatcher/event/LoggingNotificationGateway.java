package io.github.hotbrkm.outreach.dispatcher.event;

import io.github.hotbrkm.outreach.dispatcher.schedule.DailyReport;
import lombok.extern.slf4j.Slf4j;

/**
 * Default gateway: writes every event and report to the application log.
 */
@Slf4j
public class LoggingNotificationGateway implements NotificationGateway {

    @Override
    public void onEvent(DispatchEvent event) {
        if (event instanceof ServerLogEvent serverLog) {
            switch (serverLog.level()) {
                case ERROR -> log.error("campaignId={}, event={}, message={}", serverLog.campaignId(), event.type(), serverLog.message());
                case WARNING -> log.warn("campaignId={}, event={}, message={}", serverLog.campaignId(), event.type(), serverLog.message());
                default -> log.info("campaignId={}, event={}, message={}", serverLog.campaignId(), event.type(), serverLog.message());
            }
            return;
        }
        log.debug("campaignId={}, event={}, payload={}", event.campaignId(), event.type(), event);
    }

    @Override
    public void onReport(DailyReport report) {
        log.info("event=daily_report, kind={}, date={}, activeCampaigns={}, sentToday={}/{}, pending={}",
                report.kind(), report.date(), report.activeCampaigns(), report.sentToday(), report.dailyLimit(),
                report.totalPending());
    }
}
