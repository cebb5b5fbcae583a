package io.github.hotbrkm.outreach.dispatcher.schedule;

import io.github.hotbrkm.outreach.dispatcher.campaign.CampaignState;
import io.github.hotbrkm.outreach.dispatcher.campaign.CampaignStatus;
import io.github.hotbrkm.outreach.dispatcher.campaign.Contact;
import io.github.hotbrkm.outreach.dispatcher.campaign.RecipientRecord;
import io.github.hotbrkm.outreach.dispatcher.campaign.store.CampaignStore;
import io.github.hotbrkm.outreach.dispatcher.config.DispatcherProperties;
import io.github.hotbrkm.outreach.dispatcher.event.CampaignCompleteEvent;
import io.github.hotbrkm.outreach.dispatcher.event.CampaignProgressEvent;
import io.github.hotbrkm.outreach.dispatcher.event.DispatchEventChannel;
import io.github.hotbrkm.outreach.dispatcher.event.DispatchMetricsRecorder;
import io.github.hotbrkm.outreach.dispatcher.event.EmailErrorEvent;
import io.github.hotbrkm.outreach.dispatcher.event.EmailSentEvent;
import io.github.hotbrkm.outreach.dispatcher.event.ServerLogEvent;
import io.github.hotbrkm.outreach.dispatcher.send.limit.RateLimiter;
import io.github.hotbrkm.outreach.dispatcher.send.limit.SendSuspensionGuard;
import io.github.hotbrkm.outreach.dispatcher.send.result.BatchOutcome;
import io.github.hotbrkm.outreach.dispatcher.send.result.DispatchProgress;
import io.github.hotbrkm.outreach.dispatcher.send.result.DispatchProgressListener;
import io.github.hotbrkm.outreach.dispatcher.send.result.MessageOutcome;
import io.github.hotbrkm.outreach.dispatcher.send.transport.MessagePreparer;
import io.github.hotbrkm.outreach.dispatcher.send.transport.OutreachMessage;
import io.github.hotbrkm.outreach.dispatcher.send.worker.BatchDispatcher;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives campaign dispatch across days.
 * <p>
 * Registers four recurring tasks:
 * <ul>
 *   <li><b>campaign-processing</b>: inside the active window, sends the next allowed batch of every active campaign.</li>
 *   <li><b>status-check</b>: completes active campaigns whose counts already reached the total.</li>
 *   <li><b>housekeeping</b>: prunes the progress cache, the activity log and expired store cache entries.</li>
 *   <li><b>reporting</b>: publishes the OPEN and CLOSE daily reports once per day.</li>
 * </ul>
 * Campaigns are processed one after another; an exception in one campaign is logged and does not affect the others.
 */
@Slf4j
public class CampaignScheduler {

    static final String PROCESSING_TASK = "campaign-processing";
    static final String STATUS_TASK = "status-check";
    static final String HOUSEKEEPING_TASK = "housekeeping";
    static final String REPORTING_TASK = "reporting";

    private static final long DAY_MILLIS = Duration.ofDays(1).toMillis();

    private final CampaignStore store;
    private final BatchDispatcher dispatcher;
    private final RateLimiter rateLimiter;
    private final SendSuspensionGuard suspensionGuard;
    private final MessagePreparer messagePreparer;
    private final DispatchEventChannel events;
    private final DispatchMetricsRecorder metrics;
    private final CampaignReportAggregator reportAggregator;
    private final DispatchActivityLog activityLog;
    private final RecurringTaskScheduler taskScheduler;
    private final DispatcherProperties properties;
    private final ActiveWindow window;
    private final Clock clock;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Map<String, ProgressSnapshot> progressCache = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile LocalDate openReportDate;
    private volatile LocalDate closeReportDate;

    public CampaignScheduler(CampaignStore store, BatchDispatcher dispatcher, RateLimiter rateLimiter,
                             SendSuspensionGuard suspensionGuard, MessagePreparer messagePreparer,
                             DispatchEventChannel events, DispatchMetricsRecorder metrics,
                             CampaignReportAggregator reportAggregator, DispatchActivityLog activityLog,
                             RecurringTaskScheduler taskScheduler, DispatcherProperties properties, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
        this.suspensionGuard = Objects.requireNonNull(suspensionGuard, "suspensionGuard must not be null");
        this.messagePreparer = Objects.requireNonNull(messagePreparer, "messagePreparer must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.metrics = metrics != null ? metrics : new DispatchMetricsRecorder(null);
        this.reportAggregator = Objects.requireNonNull(reportAggregator, "reportAggregator must not be null");
        this.activityLog = Objects.requireNonNull(activityLog, "activityLog must not be null");
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "taskScheduler must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        DispatcherProperties.Schedule schedule = properties.getSchedule();
        this.window = new ActiveWindow(clock, schedule.getActiveWindowStartHour(), schedule.getActiveWindowEndHour());
    }

    /**
     * Seeds today's global counter from the campaign logs and registers the recurring tasks.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        restoreDailyCount();

        DispatcherProperties.Schedule schedule = properties.getSchedule();
        taskScheduler.scheduleEvery(PROCESSING_TASK, schedule.getCampaignTickInterval(), this::processCampaignsTick);
        taskScheduler.scheduleEvery(STATUS_TASK, schedule.getStatusCheckInterval(), this::reconcileStatuses);
        taskScheduler.scheduleEvery(HOUSEKEEPING_TASK, schedule.getHousekeepingInterval(), this::housekeeping);
        taskScheduler.scheduleEvery(REPORTING_TASK, schedule.getReportCheckInterval(), this::publishDueReports);

        log.info("Campaign scheduler started. window={}-{}h, globalDailyLimit={}, sentToday={}",
                window.startHour(), window.endHour(), rateLimiter.dailyLimit(), rateLimiter.sentToday());
        events.serverLog(null, ServerLogEvent.Level.INFO, "Campaign scheduler started");
    }

    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        taskScheduler.cancelAll();
        log.info("Campaign scheduler stopped");
    }

    /**
     * Scheduled entry point: does nothing outside the active window.
     *
     * @return number of campaigns that dispatched a batch
     */
    public int processCampaignsTick() {
        if (!window.isOpen()) {
            log.debug("event=tick_skipped, reason=outside_active_window");
            return 0;
        }
        return processActiveCampaigns();
    }

    /**
     * Sends the next allowed batch of every active campaign, regardless of the active window.
     *
     * @return number of campaigns that dispatched a batch
     */
    public int processActiveCampaigns() {
        if (!canSend()) {
            return 0;
        }
        List<CampaignState> active = store.findByStatus(CampaignStatus.ACTIVE);
        if (active.isEmpty()) {
            log.debug("event=tick_idle, reason=no_active_campaigns");
            return 0;
        }

        int dispatched = 0;
        for (CampaignState campaign : active) {
            if (rateLimiter.remainingToday() <= 0 || suspensionGuard.isSuspended()) {
                log.info("event=tick_stopped, remainingToday={}, suspended={}", rateLimiter.remainingToday(),
                        suspensionGuard.isSuspended());
                break;
            }
            try {
                if (processCampaign(campaign.getId())) {
                    dispatched++;
                }
            } catch (RuntimeException e) {
                log.error("campaignId={}, event=campaign_processing_failed", campaign.getId(), e);
                events.serverLog(campaign.getId(), ServerLogEvent.Level.ERROR,
                        "Campaign processing failed: " + e.getClass().getSimpleName());
            }
        }
        return dispatched;
    }

    /**
     * Processes a newly created campaign once without waiting for the active window.
     * The global daily allowance still applies.
     */
    public boolean processNewCampaignImmediately(String campaignId) {
        if (!canSend()) {
            return false;
        }
        try {
            return processCampaign(campaignId);
        } catch (RuntimeException e) {
            log.error("campaignId={}, event=immediate_processing_failed", campaignId, e);
            events.serverLog(campaignId, ServerLogEvent.Level.ERROR,
                    "Immediate processing failed: " + e.getClass().getSimpleName());
            return false;
        }
    }

    /**
     * Queues {@link #processNewCampaignImmediately(String)} on the scheduler pool.
     */
    public void submitImmediate(String campaignId) {
        taskScheduler.runOnce("immediate-" + campaignId, () -> processNewCampaignImmediately(campaignId));
    }

    /**
     * Sends one batch for the campaign if it is active and has allowance left today.
     *
     * @return true when a batch was handed to the dispatcher
     */
    boolean processCampaign(String campaignId) {
        if (!inFlight.add(campaignId)) {
            log.debug("campaignId={}, event=campaign_skipped, reason=already_in_flight", campaignId);
            return false;
        }
        try {
            CampaignState campaign = store.find(campaignId).orElse(null);
            if (campaign == null || !campaign.isActive()) {
                return false;
            }
            if (completeIfDone(campaign)) {
                return false;
            }

            LocalDate today = window.today();
            int batchSize = resolveBatchSize(campaign, today);
            if (batchSize <= 0) {
                log.debug("campaignId={}, event=campaign_skipped, reason=no_allowance_today", campaignId);
                return false;
            }
            List<Contact> contacts = campaign.nextBatch(batchSize);
            if (contacts.isEmpty()) {
                completeIfDone(campaign);
                return false;
            }

            List<OutreachMessage> messages = new ArrayList<>(contacts.size());
            for (Contact contact : contacts) {
                messages.add(messagePreparer.prepare(campaign, contact));
            }

            long delayMs = properties.getBatch().resolveDelayMs(campaign.getDelayMs());
            log.info("campaignId={}, event=batch_started, size={}, delayMs={}, processed={}/{}",
                    campaignId, messages.size(), delayMs, campaign.getProcessedEmails(), campaign.getTotalEmails());

            BatchOutcome outcome = dispatcher.dispatch(messages, delayMs, progressListener(campaign));
            persist(campaignId, today, outcome);
            return true;
        } finally {
            inFlight.remove(campaignId);
        }
    }

    /**
     * {@code min(campaign daily remaining, global daily remaining, per-tick ceiling)}.
     */
    int resolveBatchSize(CampaignState campaign, LocalDate today) {
        int campaignLimit = properties.getLimits().resolveCampaignDailyLimit(campaign.getDailyLimit());
        int remainingForCampaign = campaignLimit - campaign.attemptedOn(today);
        int remainingGlobal = rateLimiter.remainingToday();
        int perTick = properties.getBatch().resolveBatchSize(campaign.getBatchSize());
        return Math.min(remainingForCampaign, Math.min(remainingGlobal, perTick));
    }

    /**
     * Completes every active campaign whose counts already reached the total.
     *
     * @return number of campaigns completed
     */
    public int reconcileStatuses() {
        int completed = 0;
        for (CampaignState campaign : store.findByStatus(CampaignStatus.ACTIVE)) {
            try {
                if (completeIfDone(campaign)) {
                    completed++;
                }
            } catch (RuntimeException e) {
                log.error("campaignId={}, event=status_check_failed", campaign.getId(), e);
            }
        }
        return completed;
    }

    public void housekeeping() {
        Instant now = clock.instant();
        Instant progressCutoff = now.minus(properties.getSchedule().getProgressRetention());
        int prunedProgress = 0;
        for (Map.Entry<String, ProgressSnapshot> entry : progressCache.entrySet()) {
            if (entry.getValue().updatedAt().isBefore(progressCutoff) && progressCache.remove(entry.getKey(), entry.getValue())) {
                prunedProgress++;
            }
        }
        DispatcherProperties.Schedule schedule = properties.getSchedule();
        int trimmedActivity = activityLog.trim(schedule.getActivityLogDepth(), schedule.getActivityRetention(), now);
        int evicted = store.evictExpired();
        log.debug("event=housekeeping_done, prunedProgress={}, trimmedActivity={}, evictedCache={}",
                prunedProgress, trimmedActivity, evicted);
    }

    /**
     * Publishes the OPEN report once the window has opened today and the CLOSE report once it has closed.
     */
    public void publishDueReports() {
        LocalDate today = window.today();
        if (window.isOpen() && !today.equals(openReportDate)) {
            openReportDate = today;
            publishReport(DailyReport.Kind.OPEN, today);
        }
        if (window.hasClosedToday() && today.equals(openReportDate) && !today.equals(closeReportDate)) {
            closeReportDate = today;
            publishReport(DailyReport.Kind.CLOSE, today);
        }
    }

    public DailyReport publishReport(DailyReport.Kind kind, LocalDate date) {
        DailyReport report = reportAggregator.aggregate(kind, date, store.findAll(), rateLimiter.sentToday(),
                rateLimiter.dailyLimit());
        events.publishReport(report);
        return report;
    }

    public SchedulerStatistics statistics() {
        return new SchedulerStatistics(running.get(), taskScheduler.taskNames(), window.isOpen(),
                suspensionGuard.isSuspended(), rateLimiter.sentToday(), rateLimiter.dailyLimit(),
                rateLimiter.remainingToday(), inFlight.size());
    }

    public DispatchProgress lastProgress(String campaignId) {
        ProgressSnapshot snapshot = progressCache.get(campaignId);
        return snapshot == null ? null : snapshot.progress();
    }

    int progressCacheSize() {
        return progressCache.size();
    }

    private boolean canSend() {
        if (suspensionGuard.isSuspended()) {
            log.warn("event=tick_skipped, reason=sending_suspended, detail={}", suspensionGuard.reason());
            events.serverLog(null, ServerLogEvent.Level.WARNING, "Sending suspended: " + suspensionGuard.reason());
            return false;
        }
        if (rateLimiter.remainingToday() <= 0) {
            log.info("event=tick_skipped, reason=global_daily_limit_reached, sentToday={}", rateLimiter.sentToday());
            return false;
        }
        return true;
    }

    private void restoreDailyCount() {
        LocalDate today = window.today();
        int sentToday = 0;
        for (CampaignState campaign : store.findAll()) {
            sentToday += campaign.sentOn(today);
        }
        rateLimiter.restoreDailyCount(sentToday);
    }

    private DispatchProgressListener progressListener(CampaignState campaign) {
        int baseSent = campaign.getSentEmails();
        int baseFailed = campaign.getFailedEmails();
        return progress -> {
            progressCache.put(campaign.getId(), new ProgressSnapshot(progress, clock.instant()));
            MessageOutcome latest = progress.latest();
            Instant now = clock.instant();
            switch (latest.status()) {
                case SENT -> events.publish(new EmailSentEvent(campaign.getId(), now, latest.recipient(),
                        latest.message().companyName(), latest.providerMessageId()));
                case FAILED -> events.publish(new EmailErrorEvent(campaign.getId(), now, latest.recipient(),
                        latest.message().companyName(), latest.errorMessage()));
                case DEFERRED -> events.serverLog(campaign.getId(), ServerLogEvent.Level.ERROR, latest.errorMessage());
                default -> {
                }
            }
            int successCount = baseSent + progress.successful();
            int failureCount = baseFailed + progress.failed() + progress.skipped();
            events.publish(new CampaignProgressEvent(campaign.getId(), now, successCount + failureCount,
                    campaign.getTotalEmails(), successCount, failureCount));
        };
    }

    private void persist(String campaignId, LocalDate today, BatchOutcome outcome) {
        Instant now = clock.instant();
        List<RecipientRecord> records = new ArrayList<>(outcome.outcomes().size());
        for (MessageOutcome messageOutcome : outcome.outcomes()) {
            OutreachMessage message = messageOutcome.message();
            Contact contact = new Contact(message.to(), message.companyName());
            switch (messageOutcome.status()) {
                case SENT -> records.add(RecipientRecord.sent(contact, messageOutcome.providerMessageId(), now));
                case FAILED -> records.add(RecipientRecord.failed(contact, messageOutcome.errorMessage(), now));
                case SKIPPED -> {
                    records.add(RecipientRecord.skipped(contact, messageOutcome.errorMessage(), now));
                    events.serverLog(campaignId, ServerLogEvent.Level.WARNING,
                            "Skipped " + message.to() + " after repeated failures");
                }
                case DEFERRED -> {
                }
            }
        }

        AtomicBoolean completedNow = new AtomicBoolean(false);
        CampaignState updated = store.update(campaignId, campaign -> {
            campaign.recordOutcomes(today, records, now);
            completedNow.set(campaign.completeIfFullyProcessed(now));
            return campaign;
        });

        log.info("campaignId={}, event=batch_dispatched, sent={}, failed={}, skipped={}, deferred={}, progress={}/{}",
                campaignId, outcome.successful(), outcome.failed(), outcome.skipped(), outcome.deferred(),
                updated.getProcessedEmails(), updated.getTotalEmails());
        events.publish(new CampaignProgressEvent(campaignId, now, updated.getProcessedEmails(), updated.getTotalEmails(),
                updated.getSentEmails(), updated.getFailedEmails()));

        if (completedNow.get()) {
            announceCompletion(updated);
        }
    }

    private boolean completeIfDone(CampaignState campaign) {
        if (!campaign.isActive() || !campaign.isFullyProcessed()) {
            return false;
        }
        AtomicBoolean completedNow = new AtomicBoolean(false);
        CampaignState updated = store.update(campaign.getId(), current -> {
            completedNow.set(current.completeIfFullyProcessed(clock.instant()));
            return current;
        });
        if (completedNow.get()) {
            announceCompletion(updated);
        }
        return completedNow.get();
    }

    private void announceCompletion(CampaignState campaign) {
        long durationDays = durationDays(campaign);
        log.info("campaignId={}, event=campaign_completed, sent={}, failed={}, durationDays={}",
                campaign.getId(), campaign.getSentEmails(), campaign.getFailedEmails(), durationDays);
        metrics.recordCampaignCompleted();
        events.publish(new CampaignCompleteEvent(campaign.getId(), clock.instant(), campaign.getSentEmails(), durationDays));
        events.serverLog(campaign.getId(), ServerLogEvent.Level.SUCCESS,
                "Campaign \"" + campaign.getName() + "\" completed");
    }

    /**
     * Whole days from creation to completion, rounded up.
     */
    static long durationDays(CampaignState campaign) {
        if (campaign.getCreatedAt() == null || campaign.getCompletedAt() == null) {
            return 0;
        }
        long elapsed = Math.max(0L, campaign.getCompletedAt().toEpochMilli() - campaign.getCreatedAt().toEpochMilli());
        return (elapsed + DAY_MILLIS - 1) / DAY_MILLIS;
    }

    private record ProgressSnapshot(DispatchProgress progress, Instant updatedAt) {
    }
}
