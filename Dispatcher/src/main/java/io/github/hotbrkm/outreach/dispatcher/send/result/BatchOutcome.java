package io.github.hotbrkm.outreach.dispatcher.send.result;

import io.github.hotbrkm.outreach.dispatcher.send.limit.RateLimitDecision;
import io.github.hotbrkm.outreach.dispatcher.send.transport.ErrorCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate result of one dispatch run.
 *
 * @param successful       messages delivered
 * @param failed           messages that ended in a terminal failure
 * @param skipped          skip-listed recipients, never attempted
 * @param deferred         messages left pending because the run stopped early
 * @param providerRateLimited attempts the provider rejected as rate limited
 * @param errorCounts      terminal failures per category
 * @param outcomes         per-message outcomes in input order
 * @param stopDecision     limiter denial that stopped the run, or null
 * @param suspended        whether the run stopped because sending was suspended
 */
public record BatchOutcome(int successful, int failed, int skipped, int deferred, int providerRateLimited,
                           Map<ErrorCategory, Integer> errorCounts, List<MessageOutcome> outcomes,
                           RateLimitDecision stopDecision, boolean suspended) {

    public BatchOutcome {
        errorCounts = errorCounts == null || errorCounts.isEmpty()
                ? Collections.emptyMap() : Collections.unmodifiableMap(new EnumMap<>(errorCounts));
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static BatchOutcome empty() {
        return new BatchOutcome(0, 0, 0, 0, 0, null, null, null, false);
    }

    public int attempted() {
        return successful + failed;
    }

    public boolean stoppedEarly() {
        return stopDecision != null || suspended;
    }

    /**
     * Combines this chunk's result with the next one; the later chunk's stop reason wins.
     */
    public BatchOutcome merge(BatchOutcome next) {
        Map<ErrorCategory, Integer> counts = new EnumMap<>(ErrorCategory.class);
        counts.putAll(errorCounts);
        next.errorCounts().forEach((category, count) -> counts.merge(category, count, Integer::sum));

        List<MessageOutcome> merged = new ArrayList<>(outcomes.size() + next.outcomes().size());
        merged.addAll(outcomes);
        merged.addAll(next.outcomes());

        return new BatchOutcome(successful + next.successful(), failed + next.failed(), skipped + next.skipped(),
                deferred + next.deferred(), providerRateLimited + next.providerRateLimited(), counts, merged,
                next.stopDecision() != null ? next.stopDecision() : stopDecision, suspended || next.suspended());
    }
}
