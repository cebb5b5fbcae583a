package io.github.hotbrkm.outreach.dispatcher.campaign;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.hotbrkm.outreach.dispatcher.domain.EmailAddressUtil;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One outreach run: recipient list, cumulative counts, daily logs and lifecycle status.
 * <p>
 * Contacts and totals are fixed at creation. Progress fields change only through
 * {@link #recordOutcomes(LocalDate, List, Instant)} and lifecycle changes only through
 * {@link #transitionTo(CampaignStatus, Instant)}, which keeps {@code sentEmails + failedEmails <= totalEmails}.
 * Instances are not thread-safe; the store hands out copies.
 */
@Getter
public class CampaignState {

    private final String id;
    private final String name;
    private final String subject;
    private final String template;
    private final String ownerEmail;
    private final List<Contact> contacts;
    private final List<String> attachments;
    private final int totalEmails;
    private final long delayMs;
    private final int dailyLimit;
    private final int batchSize;
    private final Instant createdAt;

    private CampaignStatus status;
    private int sentEmails;
    private int failedEmails;
    private final List<DailyLog> dailyLogs;
    private Instant updatedAt;
    private Instant lastProcessedAt;
    private Instant completedAt;

    @Builder
    @JsonCreator
    public CampaignState(@JsonProperty("id") String id,
                         @JsonProperty("name") String name,
                         @JsonProperty("subject") String subject,
                         @JsonProperty("template") String template,
                         @JsonProperty("ownerEmail") String ownerEmail,
                         @JsonProperty("contacts") List<Contact> contacts,
                         @JsonProperty("attachments") List<String> attachments,
                         @JsonProperty("totalEmails") Integer totalEmails,
                         @JsonProperty("delayMs") long delayMs,
                         @JsonProperty("dailyLimit") int dailyLimit,
                         @JsonProperty("batchSize") int batchSize,
                         @JsonProperty("createdAt") Instant createdAt,
                         @JsonProperty("status") CampaignStatus status,
                         @JsonProperty("sentEmails") int sentEmails,
                         @JsonProperty("failedEmails") int failedEmails,
                         @JsonProperty("dailyLogs") List<DailyLog> dailyLogs,
                         @JsonProperty("updatedAt") Instant updatedAt,
                         @JsonProperty("lastProcessedAt") Instant lastProcessedAt,
                         @JsonProperty("completedAt") Instant completedAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = name;
        this.subject = subject;
        this.template = template;
        this.ownerEmail = ownerEmail;
        this.contacts = contacts == null ? List.of() : List.copyOf(contacts);
        this.attachments = attachments == null ? List.of() : List.copyOf(attachments);
        this.totalEmails = totalEmails != null ? totalEmails : this.contacts.size();
        this.delayMs = delayMs;
        this.dailyLimit = dailyLimit;
        this.batchSize = batchSize;
        this.createdAt = createdAt;
        this.status = status != null ? status : CampaignStatus.ACTIVE;
        this.sentEmails = Math.max(0, sentEmails);
        this.failedEmails = Math.max(0, failedEmails);
        this.dailyLogs = new ArrayList<>();
        if (dailyLogs != null) {
            for (DailyLog log : dailyLogs) {
                this.dailyLogs.add(log.copy());
            }
        }
        this.updatedAt = updatedAt;
        this.lastProcessedAt = lastProcessedAt;
        this.completedAt = completedAt;
        if (this.totalEmails < 0 || this.sentEmails + this.failedEmails > this.totalEmails) {
            throw new IllegalArgumentException("Campaign " + id + " counts exceed total: sent=" + this.sentEmails
                    + ", failed=" + this.failedEmails + ", total=" + this.totalEmails);
        }
    }

    public List<DailyLog> getDailyLogs() {
        return Collections.unmodifiableList(dailyLogs);
    }

    @JsonIgnore
    public int getProcessedEmails() {
        return sentEmails + failedEmails;
    }

    @JsonIgnore
    public int getRemainingEmails() {
        return Math.max(0, totalEmails - getProcessedEmails());
    }

    @JsonIgnore
    public boolean isFullyProcessed() {
        return getProcessedEmails() >= totalEmails;
    }

    @JsonIgnore
    public boolean isActive() {
        return status == CampaignStatus.ACTIVE;
    }

    /**
     * Applies a lifecycle change. Completing also stamps {@code completedAt}, which happens at most once.
     *
     * @throws IllegalStatusTransitionException when the lifecycle does not allow the change
     */
    public void transitionTo(CampaignStatus target, Instant now) {
        status = status.transitionTo(target, id);
        updatedAt = now;
        if (target == CampaignStatus.COMPLETED && completedAt == null) {
            completedAt = now;
        }
    }

    /**
     * Moves an active campaign whose counts reached the total to {@link CampaignStatus#COMPLETED}.
     *
     * @return true only on the call that performed the transition
     */
    public boolean completeIfFullyProcessed(Instant now) {
        if (status != CampaignStatus.ACTIVE || !isFullyProcessed()) {
            return false;
        }
        transitionTo(CampaignStatus.COMPLETED, now);
        return true;
    }

    /**
     * Next contacts that do not appear in any daily log, in contact order.
     */
    public List<Contact> nextBatch(int size) {
        if (size <= 0 || isFullyProcessed()) {
            return List.of();
        }
        Set<String> processed = processedAddresses();
        List<Contact> batch = new ArrayList<>(Math.min(size, contacts.size()));
        for (Contact contact : contacts) {
            if (batch.size() >= size) {
                break;
            }
            if (!processed.contains(EmailAddressUtil.normalizeKey(contact.email()))) {
                batch.add(contact);
            }
        }
        return batch;
    }

    /**
     * Number of recipients attempted (sent or failed) on the given day.
     */
    public int attemptedOn(LocalDate day) {
        DailyLog log = findLog(day);
        return log == null ? 0 : log.attemptedCount();
    }

    public int sentOn(LocalDate day) {
        DailyLog log = findLog(day);
        return log == null ? 0 : log.getTotalSent();
    }

    /**
     * Appends the records to the log for {@code day} and updates the cumulative counts.
     * Records for recipients already logged, or beyond the total, are ignored.
     *
     * @return number of records applied
     * @throws IllegalStateException when {@code day} precedes the latest logged day
     */
    public int recordOutcomes(LocalDate day, List<RecipientRecord> records, Instant now) {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        DailyLog target = logForAppend(day);
        Set<String> processed = processedAddresses();
        int applied = 0;
        for (RecipientRecord record : records) {
            if (isFullyProcessed()) {
                break;
            }
            if (!processed.add(EmailAddressUtil.normalizeKey(record.email()))) {
                continue;
            }
            target.append(record);
            if (record.outcome() == RecipientOutcome.SENT) {
                sentEmails++;
            } else {
                failedEmails++;
            }
            applied++;
        }
        lastProcessedAt = now;
        updatedAt = now;
        return applied;
    }

    public CampaignState copy() {
        return new CampaignState(id, name, subject, template, ownerEmail, contacts, attachments, totalEmails, delayMs,
                dailyLimit, batchSize, createdAt, status, sentEmails, failedEmails, dailyLogs, updatedAt,
                lastProcessedAt, completedAt);
    }

    private DailyLog logForAppend(LocalDate day) {
        Objects.requireNonNull(day, "day must not be null");
        if (!dailyLogs.isEmpty()) {
            DailyLog latest = dailyLogs.get(dailyLogs.size() - 1);
            if (latest.getDate().equals(day)) {
                return latest;
            }
            if (day.isBefore(latest.getDate())) {
                throw new IllegalStateException("Campaign " + id + " already has a log for " + latest.getDate()
                        + ", cannot append to " + day);
            }
        }
        DailyLog created = new DailyLog(day);
        dailyLogs.add(created);
        return created;
    }

    private DailyLog findLog(LocalDate day) {
        for (int i = dailyLogs.size() - 1; i >= 0; i--) {
            DailyLog log = dailyLogs.get(i);
            if (log.getDate().equals(day)) {
                return log;
            }
            if (log.getDate().isBefore(day)) {
                return null;
            }
        }
        return null;
    }

    private Set<String> processedAddresses() {
        Set<String> processed = new HashSet<>();
        for (DailyLog log : dailyLogs) {
            for (RecipientRecord record : log.getRecipients()) {
                processed.add(EmailAddressUtil.normalizeKey(record.email()));
            }
        }
        return processed;
    }
}
