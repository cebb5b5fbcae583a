package io.github.hotbrkm.outreach.dispatcher.send.health;

import io.github.hotbrkm.outreach.dispatcher.config.DispatcherProperties;
import io.github.hotbrkm.outreach.dispatcher.domain.EmailAddressUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Counts consecutive delivery failures per recipient address.
 * <p>
 * An address is skip-listed once its count reaches the configured threshold, until a success clears it.
 * Counts are updated only through {@link ConcurrentHashMap#merge}, so concurrent callers never lose increments.
 */
@Slf4j
public class RecipientHealthTracker {

    private final int failureThreshold;
    private final boolean skipEnabled;
    private final Map<String, Integer> consecutiveFailures = new ConcurrentHashMap<>();

    public RecipientHealthTracker(DispatcherProperties.Health health) {
        Objects.requireNonNull(health, "health must not be null");
        this.failureThreshold = Math.max(1, health.getRecipientFailureThreshold());
        this.skipEnabled = health.isSkipEnabled();
    }

    public boolean shouldSkip(String address) {
        if (!skipEnabled) {
            return false;
        }
        return failureCount(address) >= failureThreshold;
    }

    public int recordFailure(String address) {
        String key = EmailAddressUtil.normalizeKey(address);
        if (key.isEmpty()) {
            return 0;
        }
        int count = consecutiveFailures.merge(key, 1, Integer::sum);
        if (count == failureThreshold) {
            log.warn("recipient={}, event=recipient_skip_listed, consecutiveFailures={}", key, count);
        }
        return count;
    }

    public void recordSuccess(String address) {
        String key = EmailAddressUtil.normalizeKey(address);
        if (!key.isEmpty() && consecutiveFailures.remove(key) != null) {
            log.debug("recipient={}, event=recipient_recovered", key);
        }
    }

    public int failureCount(String address) {
        String key = EmailAddressUtil.normalizeKey(address);
        if (key.isEmpty()) {
            return 0;
        }
        return consecutiveFailures.getOrDefault(key, 0);
    }

    /**
     * Splits items into those still deliverable and those skip-listed, keeping the original relative order in both.
     */
    public <T> Partition<T> partition(List<T> items, Function<T, String> addressOf) {
        List<T> accepted = new ArrayList<>(items.size());
        List<T> skipped = new ArrayList<>();
        for (T item : items) {
            if (shouldSkip(addressOf.apply(item))) {
                skipped.add(item);
            } else {
                accepted.add(item);
            }
        }
        return new Partition<>(List.copyOf(accepted), List.copyOf(skipped));
    }

    public int trackedRecipients() {
        return consecutiveFailures.size();
    }

    public int threshold() {
        return failureThreshold;
    }

    public record Partition<T>(List<T> accepted, List<T> skipped) {
    }
}
