package io.github.hotbrkm.outreach.dispatcher.campaign;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Record of what a campaign processed on one calendar day.
 * Entries are only appended to while their day is the campaign's latest day.
 */
@Getter
public class DailyLog {

    private final LocalDate date;
    private final List<RecipientRecord> recipients;
    private int totalSent;
    private int totalFailed;

    @JsonCreator
    public DailyLog(@JsonProperty("date") LocalDate date,
                    @JsonProperty("recipients") List<RecipientRecord> recipients,
                    @JsonProperty("totalSent") int totalSent,
                    @JsonProperty("totalFailed") int totalFailed) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.recipients = recipients == null ? new ArrayList<>() : new ArrayList<>(recipients);
        this.totalSent = totalSent;
        this.totalFailed = totalFailed;
    }

    DailyLog(LocalDate date) {
        this(date, null, 0, 0);
    }

    public List<RecipientRecord> getRecipients() {
        return Collections.unmodifiableList(recipients);
    }

    /**
     * Recipients that were actually attempted (sent or failed), which is what the per-campaign daily quota counts.
     */
    public int attemptedCount() {
        int count = 0;
        for (RecipientRecord record : recipients) {
            if (record.outcome() != RecipientOutcome.SKIPPED) {
                count++;
            }
        }
        return count;
    }

    void append(RecipientRecord record) {
        recipients.add(record);
        if (record.outcome() == RecipientOutcome.SENT) {
            totalSent++;
        } else {
            totalFailed++;
        }
    }

    DailyLog copy() {
        return new DailyLog(date, recipients, totalSent, totalFailed);
    }
}
