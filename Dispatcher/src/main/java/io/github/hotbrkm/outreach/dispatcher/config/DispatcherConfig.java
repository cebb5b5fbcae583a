package io.github.hotbrkm.outreach.dispatcher.config;

import io.github.hotbrkm.outreach.dispatcher.campaign.CampaignService;
import io.github.hotbrkm.outreach.dispatcher.campaign.store.CampaignStore;
import io.github.hotbrkm.outreach.dispatcher.campaign.store.FileCampaignStore;
import io.github.hotbrkm.outreach.dispatcher.event.DispatchEventChannel;
import io.github.hotbrkm.outreach.dispatcher.event.DispatchMetricsRecorder;
import io.github.hotbrkm.outreach.dispatcher.event.LoggingNotificationGateway;
import io.github.hotbrkm.outreach.dispatcher.event.NotificationGateway;
import io.github.hotbrkm.outreach.dispatcher.schedule.CampaignReportAggregator;
import io.github.hotbrkm.outreach.dispatcher.schedule.CampaignScheduler;
import io.github.hotbrkm.outreach.dispatcher.schedule.DispatchActivityLog;
import io.github.hotbrkm.outreach.dispatcher.schedule.RecurringTaskScheduler;
import io.github.hotbrkm.outreach.dispatcher.send.health.RecipientHealthTracker;
import io.github.hotbrkm.outreach.dispatcher.send.limit.RateLimiter;
import io.github.hotbrkm.outreach.dispatcher.send.limit.SendSuspensionGuard;
import io.github.hotbrkm.outreach.dispatcher.send.transport.DeliveryTransport;
import io.github.hotbrkm.outreach.dispatcher.send.transport.JakartaMailDeliveryTransport;
import io.github.hotbrkm.outreach.dispatcher.send.transport.MessagePreparer;
import io.github.hotbrkm.outreach.dispatcher.send.transport.PlaceholderMessagePreparer;
import io.github.hotbrkm.outreach.dispatcher.send.worker.BatchDispatcher;
import io.github.hotbrkm.outreach.dispatcher.send.worker.Sleeper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.List;

@Configuration
public class DispatcherConfig {

    /**
     * Every date-based rule (day counters, daily logs, active window) uses this clock's zone.
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock dispatcherClock(DispatcherProperties properties) {
        return Clock.system(properties.getSchedule().resolveZone());
    }

    @Bean
    public DispatchMetricsRecorder dispatchMetricsRecorder(ObjectProvider<MeterRegistry> meterRegistry) {
        return new DispatchMetricsRecorder(meterRegistry.getIfAvailable());
    }

    @Bean
    public RateLimiter rateLimiter(DispatcherProperties properties, Clock clock) {
        return new RateLimiter(properties.getRate(), properties.getLimits().resolveGlobalDailyLimit(), clock);
    }

    @Bean
    public RecipientHealthTracker recipientHealthTracker(DispatcherProperties properties) {
        return new RecipientHealthTracker(properties.getHealth());
    }

    @Bean
    public SendSuspensionGuard sendSuspensionGuard() {
        return new SendSuspensionGuard();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeliveryTransport deliveryTransport(DispatcherProperties properties) {
        return new JakartaMailDeliveryTransport(properties.getMail());
    }

    @Bean
    @ConditionalOnMissingBean
    public MessagePreparer messagePreparer() {
        return new PlaceholderMessagePreparer();
    }

    @Bean(destroyMethod = "shutdown")
    public BatchDispatcher batchDispatcher(DeliveryTransport deliveryTransport, RateLimiter rateLimiter,
                                           RecipientHealthTracker recipientHealthTracker,
                                           SendSuspensionGuard sendSuspensionGuard, DispatcherProperties properties,
                                           DispatchMetricsRecorder dispatchMetricsRecorder) {
        return new BatchDispatcher(deliveryTransport, rateLimiter, recipientHealthTracker, sendSuspensionGuard,
                properties, dispatchMetricsRecorder, Sleeper.SYSTEM);
    }

    @Bean(destroyMethod = "close")
    public CampaignStore campaignStore(DispatcherProperties properties, Clock clock) {
        return new FileCampaignStore(properties.getStore(), clock);
    }

    @Bean
    public LoggingNotificationGateway loggingNotificationGateway() {
        return new LoggingNotificationGateway();
    }

    @Bean
    public DispatchActivityLog dispatchActivityLog(DispatcherProperties properties) {
        return new DispatchActivityLog(properties.getSchedule().getActivityLogDepth() * 2);
    }

    @Bean
    public DispatchEventChannel dispatchEventChannel(Clock clock, List<NotificationGateway> gateways) {
        return new DispatchEventChannel(clock, gateways);
    }

    @Bean
    public RecurringTaskScheduler recurringTaskScheduler(TaskScheduler taskScheduler, Clock clock) {
        return new RecurringTaskScheduler(taskScheduler, clock);
    }

    /**
     * Calls start() on application startup and shutdown() on termination.
     */
    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public CampaignScheduler campaignScheduler(CampaignStore campaignStore, BatchDispatcher batchDispatcher,
                                               RateLimiter rateLimiter, SendSuspensionGuard sendSuspensionGuard,
                                               MessagePreparer messagePreparer, DispatchEventChannel dispatchEventChannel,
                                               DispatchMetricsRecorder dispatchMetricsRecorder,
                                               DispatchActivityLog dispatchActivityLog,
                                               RecurringTaskScheduler recurringTaskScheduler,
                                               DispatcherProperties properties, Clock clock) {
        return new CampaignScheduler(campaignStore, batchDispatcher, rateLimiter, sendSuspensionGuard, messagePreparer,
                dispatchEventChannel, dispatchMetricsRecorder, new CampaignReportAggregator(), dispatchActivityLog,
                recurringTaskScheduler, properties, clock);
    }

    @Bean
    public CampaignService campaignService(CampaignStore campaignStore, DispatcherProperties properties, Clock clock,
                                           CampaignScheduler campaignScheduler) {
        return new CampaignService(campaignStore, properties, clock, campaignScheduler::submitImmediate);
    }
}
