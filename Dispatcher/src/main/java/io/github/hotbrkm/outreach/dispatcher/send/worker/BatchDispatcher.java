package io.github.hotbrkm.outreach.dispatcher.send.worker;

import io.github.hotbrkm.outreach.dispatcher.config.DispatcherProperties;
import io.github.hotbrkm.outreach.dispatcher.event.DispatchMetricsRecorder;
import io.github.hotbrkm.outreach.dispatcher.send.health.RecipientHealthTracker;
import io.github.hotbrkm.outreach.dispatcher.send.limit.RateLimitDecision;
import io.github.hotbrkm.outreach.dispatcher.send.limit.RateLimiter;
import io.github.hotbrkm.outreach.dispatcher.send.limit.SendPermit;
import io.github.hotbrkm.outreach.dispatcher.send.limit.SendSuspensionGuard;
import io.github.hotbrkm.outreach.dispatcher.send.result.BatchOutcome;
import io.github.hotbrkm.outreach.dispatcher.send.result.DispatchProgress;
import io.github.hotbrkm.outreach.dispatcher.send.result.DispatchProgressListener;
import io.github.hotbrkm.outreach.dispatcher.send.result.MessageOutcome;
import io.github.hotbrkm.outreach.dispatcher.send.result.MessageStatus;
import io.github.hotbrkm.outreach.dispatcher.send.transport.DeliveryReceipt;
import io.github.hotbrkm.outreach.dispatcher.send.transport.DeliveryTransport;
import io.github.hotbrkm.outreach.dispatcher.send.transport.ErrorCategory;
import io.github.hotbrkm.outreach.dispatcher.send.transport.ErrorClassifier;
import io.github.hotbrkm.outreach.dispatcher.send.transport.ErrorSanitizer;
import io.github.hotbrkm.outreach.dispatcher.send.transport.OutreachMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sends prepared messages one at a time through the delivery transport.
 * <p>
 * Each message is checked against the {@link RateLimiter} and the {@link RecipientHealthTracker} before it is sent.
 * Network and provider rate-limit failures are retried with a linearly growing wait; other failures are terminal.
 * A limiter denial, an authentication failure or an interrupt stops the run and leaves the remaining messages
 * deferred for a later tick.
 * <p>
 * Sending is strictly sequential: spacing and backoff are enforced by the calling thread.
 */
@Slf4j
public class BatchDispatcher implements AutoCloseable {

    private final RateLimiter rateLimiter;
    private final RecipientHealthTracker healthTracker;
    private final SendSuspensionGuard suspensionGuard;
    private final DispatchMetricsRecorder metrics;
    private final Sleeper sleeper;
    private final TransportInvoker invoker;

    private final int maxRetries;
    private final long retryDelayMs;
    private final long minDelayMs;
    private final long maxDelayMs;
    private final int maxMessagesInMemory;
    private final int chunkSize;
    private final boolean adaptiveDelay;

    public BatchDispatcher(DeliveryTransport transport, RateLimiter rateLimiter, RecipientHealthTracker healthTracker,
                           SendSuspensionGuard suspensionGuard, DispatcherProperties properties,
                           DispatchMetricsRecorder metrics, Sleeper sleeper) {
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
        this.healthTracker = Objects.requireNonNull(healthTracker, "healthTracker must not be null");
        this.suspensionGuard = Objects.requireNonNull(suspensionGuard, "suspensionGuard must not be null");
        this.metrics = metrics != null ? metrics : new DispatchMetricsRecorder(null);
        this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;

        DispatcherProperties.Batch batch = properties.getBatch();
        this.invoker = new TransportInvoker(transport, batch.getMessageTimeoutMs());
        this.maxRetries = batch.resolveMaxMessageRetries();
        this.retryDelayMs = Math.max(0L, batch.getRetryDelayMs());
        this.minDelayMs = Math.max(0L, batch.getDelayMsMin());
        this.maxDelayMs = Math.max(minDelayMs, batch.getDelayMsMax());
        this.maxMessagesInMemory = Math.max(1, batch.getMaxMessagesInMemory());
        this.chunkSize = Math.max(1, Math.min(batch.getChunkSize(), maxMessagesInMemory));
        this.adaptiveDelay = properties.getRate().isAdaptiveThrottlingEnabled();
    }

    /**
     * Dispatches the messages in list order.
     *
     * @param messages           prepared messages, all belonging to the same campaign
     * @param perMessageDelayMs  base spacing between two sends
     * @param listener           called after every handled message with cumulative counts
     * @return aggregate outcome with one {@link MessageOutcome} per input message
     */
    public BatchOutcome dispatch(List<OutreachMessage> messages, long perMessageDelayMs, DispatchProgressListener listener) {
        if (messages == null || messages.isEmpty()) {
            return BatchOutcome.empty();
        }
        DispatchProgressListener progressListener = listener != null ? listener : DispatchProgressListener.NOOP;
        Run run = new Run(messages.get(0).campaignId(), messages.size(), Math.max(0L, perMessageDelayMs), progressListener);

        if (messages.size() <= maxMessagesInMemory) {
            return dispatchChunk(messages, run);
        }

        log.info("campaignId={}, event=chunked_dispatch, messages={}, chunkSize={}", run.campaignId, messages.size(), chunkSize);
        BatchOutcome merged = BatchOutcome.empty();
        for (int from = 0; from < messages.size(); from += chunkSize) {
            List<OutreachMessage> chunk = messages.subList(from, Math.min(messages.size(), from + chunkSize));
            if (run.stopped) {
                merged = merged.merge(deferAll(chunk, run.stopReason));
                continue;
            }
            merged = merged.merge(dispatchChunk(chunk, run));
        }
        return merged;
    }

    private BatchOutcome dispatchChunk(List<OutreachMessage> chunk, Run run) {
        RecipientHealthTracker.Partition<OutreachMessage> partition = healthTracker.partition(chunk, OutreachMessage::to);
        List<MessageOutcome> outcomes = new ArrayList<>(chunk.size());
        Map<ErrorCategory, Integer> errorCounts = new EnumMap<>(ErrorCategory.class);
        int successful = 0;
        int failed = 0;
        int deferred = 0;
        int providerRateLimited = 0;
        RateLimitDecision stopDecision = null;
        boolean suspended = false;

        for (OutreachMessage skippedMessage : partition.skipped()) {
            log.info("campaignId={}, event=recipient_skipped, to={}", skippedMessage.campaignId(), skippedMessage.to());
            metrics.recordMessage(MessageStatus.SKIPPED, null);
            run.skipped++;
        }

        List<OutreachMessage> accepted = partition.accepted();
        for (int i = 0; i < accepted.size(); i++) {
            OutreachMessage message = accepted.get(i);

            if (!run.stopped && run.handled > 0) {
                long delay = run.currentDelay();
                metrics.recordDelay(delay);
                if (!pause(delay, run)) {
                    run.stop("Dispatch interrupted");
                }
            }
            if (!run.stopped && suspensionGuard.isSuspended()) {
                suspended = true;
                run.stop("Sending suspended: " + suspensionGuard.reason());
            }
            SendPermit permit = null;
            if (!run.stopped) {
                permit = rateLimiter.tryAcquire(message.destinationDomain());
                if (!permit.granted()) {
                    RateLimitDecision decision = permit.decision();
                    metrics.recordDenied(decision.reason());
                    log.info("campaignId={}, event=dispatch_deferred, reason={}, retryAfterMs={}, remaining={}",
                            run.campaignId, decision.reason(), decision.retryAfterMs(), accepted.size() - i);
                    stopDecision = decision;
                    run.stop(decision.message());
                }
            }
            if (run.stopped) {
                for (int j = i; j < accepted.size(); j++) {
                    outcomes.add(MessageOutcome.deferred(accepted.get(j), run.stopReason));
                    deferred++;
                }
                break;
            }

            Attempt attempt = deliver(message, permit, run);
            MessageOutcome outcome = attempt.outcome();
            providerRateLimited += attempt.providerRateLimited();
            outcomes.add(outcome);
            switch (outcome.status()) {
                case SENT -> {
                    successful++;
                    run.successful++;
                }
                case FAILED -> {
                    failed++;
                    run.failed++;
                    errorCounts.merge(outcome.errorCategory(), 1, Integer::sum);
                }
                case DEFERRED -> {
                    deferred++;
                    suspended = suspended || attempt.suspended();
                }
            }
            metrics.recordMessage(outcome.status(), outcome.errorCategory());
            run.handled++;
            notifyProgress(run, outcome);
        }

        List<MessageOutcome> skippedOutcomes = new ArrayList<>(partition.skipped().size());
        for (OutreachMessage skippedMessage : partition.skipped()) {
            skippedOutcomes.add(MessageOutcome.skipped(skippedMessage));
        }

        return new BatchOutcome(successful, failed, partition.skipped().size(), deferred, providerRateLimited,
                errorCounts, inInputOrder(chunk, outcomes, skippedOutcomes), stopDecision, suspended);
    }

    /**
     * Sends one message under a granted permit. Only a delivered message keeps its slot.
     */
    private Attempt deliver(OutreachMessage message, SendPermit permit, Run run) {
        int attempts = 0;
        int providerRateLimited = 0;
        while (true) {
            attempts++;
            DeliveryReceipt receipt;
            try {
                receipt = invoker.invoke(message);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                rateLimiter.release(permit);
                run.stop("Dispatch interrupted");
                return new Attempt(MessageOutcome.deferred(message, run.stopReason), providerRateLimited, false);
            }

            if (receipt.success()) {
                rateLimiter.recordSuccess(permit);
                healthTracker.recordSuccess(message.to());
                log.info("campaignId={}, event=email_sent, to={}, attempts={}, messageId={}",
                        message.campaignId(), message.to(), attempts, receipt.providerMessageId());
                return new Attempt(MessageOutcome.sent(message, receipt.providerMessageId(), attempts), providerRateLimited, false);
            }

            ErrorCategory category = ErrorClassifier.classify(receipt);
            String sanitized = ErrorSanitizer.sanitize(receipt.errorText());

            if (category == ErrorCategory.RATE_LIMIT) {
                providerRateLimited++;
                run.providerRateLimited = true;
                rateLimiter.recordFailure();
            }

            if (category == ErrorCategory.AUTHENTICATION) {
                rateLimiter.release(permit);
                suspensionGuard.suspend(category.safeMessage(sanitized));
                run.stop("Sending suspended: " + category.safeMessage(sanitized));
                log.error("campaignId={}, event=authentication_failed, to={}, error={}", message.campaignId(), message.to(), sanitized);
                return new Attempt(MessageOutcome.deferred(message, run.stopReason), providerRateLimited, true);
            }

            if (category.isRetryable() && attempts <= maxRetries) {
                long wait = retryDelayMs * attempts;
                metrics.recordRetry(category);
                log.warn("campaignId={}, event=send_retry, to={}, category={}, attempt={}/{}, waitMs={}, error={}",
                        message.campaignId(), message.to(), category, attempts, maxRetries + 1, wait, sanitized);
                if (!pause(wait, run)) {
                    rateLimiter.release(permit);
                    run.stop("Dispatch interrupted");
                    return new Attempt(MessageOutcome.deferred(message, run.stopReason), providerRateLimited, false);
                }
                continue;
            }

            rateLimiter.release(permit);
            // provider rate limits were already counted per attempt
            if (category != ErrorCategory.RATE_LIMIT) {
                rateLimiter.recordFailure();
            }
            healthTracker.recordFailure(message.to());
            log.warn("campaignId={}, event=email_failed, to={}, category={}, attempts={}, error={}",
                    message.campaignId(), message.to(), category, attempts, sanitized);
            return new Attempt(MessageOutcome.failed(message, category, category.safeMessage(sanitized), attempts),
                    providerRateLimited, false);
        }
    }

    /**
     * Base delay scaled by what the run has seen so far, bounded by the configured minimum and maximum.
     */
    long adaptiveDelay(long baseDelay, int successful, int failed, boolean providerRateLimited) {
        if (!adaptiveDelay) {
            return baseDelay;
        }
        double delay = baseDelay;
        if (providerRateLimited) {
            delay = Math.min(delay * 2, maxDelayMs);
        }
        int attempted = successful + failed;
        if (attempted > 0 && (double) failed / attempted > 0.5) {
            delay = Math.min(delay * 1.5, maxDelayMs);
        }
        if (failed == 0 && !providerRateLimited && delay > minDelayMs) {
            delay = Math.max(delay * 0.9, minDelayMs);
        }
        return Math.round(delay);
    }

    private boolean pause(long millis, Run run) {
        if (millis <= 0) {
            return true;
        }
        try {
            sleeper.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("campaignId={}, event=dispatch_interrupted", run.campaignId);
            return false;
        }
    }

    private void notifyProgress(Run run, MessageOutcome outcome) {
        DispatchProgress progress = new DispatchProgress(run.campaignId, run.handled + run.skipped, run.total,
                run.successful, run.failed, run.skipped, outcome);
        try {
            run.listener.onProgress(progress);
        } catch (RuntimeException e) {
            log.warn("campaignId={}, event=progress_listener_failed", run.campaignId, e);
        }
    }

    private BatchOutcome deferAll(List<OutreachMessage> chunk, String reason) {
        List<MessageOutcome> outcomes = new ArrayList<>(chunk.size());
        for (OutreachMessage message : chunk) {
            outcomes.add(MessageOutcome.deferred(message, reason));
        }
        return new BatchOutcome(0, 0, 0, chunk.size(), 0, null, outcomes, null, false);
    }

    /**
     * Interleaves dispatched and skipped outcomes back into input order. Both lists keep the input's relative order.
     */
    private static List<MessageOutcome> inInputOrder(List<OutreachMessage> chunk, List<MessageOutcome> dispatched,
                                                     List<MessageOutcome> skipped) {
        List<MessageOutcome> ordered = new ArrayList<>(chunk.size());
        int d = 0;
        int s = 0;
        for (OutreachMessage message : chunk) {
            if (d < dispatched.size() && dispatched.get(d).message() == message) {
                ordered.add(dispatched.get(d++));
            } else if (s < skipped.size() && skipped.get(s).message() == message) {
                ordered.add(skipped.get(s++));
            }
        }
        return ordered;
    }

    @Override
    public void close() {
        invoker.close();
    }

    public void shutdown() {
        close();
    }

    private record Attempt(MessageOutcome outcome, int providerRateLimited, boolean suspended) {
    }

    /**
     * Mutable state shared by all chunks of one dispatch call.
     */
    private final class Run {
        private final String campaignId;
        private final int total;
        private final long baseDelay;
        private final DispatchProgressListener listener;
        private int handled;
        private int successful;
        private int failed;
        private int skipped;
        private boolean providerRateLimited;
        private boolean stopped;
        private String stopReason;

        private Run(String campaignId, int total, long baseDelay, DispatchProgressListener listener) {
            this.campaignId = campaignId;
            this.total = total;
            this.baseDelay = baseDelay;
            this.listener = listener;
        }

        private long currentDelay() {
            return adaptiveDelay(baseDelay, successful, failed, providerRateLimited);
        }

        private void stop(String reason) {
            if (!stopped) {
                stopped = true;
                stopReason = reason;
            }
        }
    }
}
