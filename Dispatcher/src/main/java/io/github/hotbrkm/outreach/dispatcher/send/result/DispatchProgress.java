package io.github.hotbrkm.outreach.dispatcher.send.result;

/**
 * Cumulative counts after one message of a dispatch run has been handled.
 */
public record DispatchProgress(String campaignId, int processed, int total, int successful, int failed, int skipped,
                               MessageOutcome latest) {
}
