package io.github.hotbrkm.outreach.dispatcher.campaign;

import io.github.hotbrkm.outreach.dispatcher.campaign.store.CampaignStore;
import io.github.hotbrkm.outreach.dispatcher.config.DispatcherProperties;
import io.github.hotbrkm.outreach.dispatcher.domain.EmailAddressUtil;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Creation path and lifecycle commands for campaigns.
 */
@Slf4j
public class CampaignService {

    private final CampaignStore store;
    private final DispatcherProperties properties;
    private final Clock clock;
    private final CampaignCreationListener creationListener;

    public CampaignService(CampaignStore store, DispatcherProperties properties, Clock clock,
                           CampaignCreationListener creationListener) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.creationListener = creationListener != null ? creationListener : CampaignCreationListener.NOOP;
    }

    /**
     * Validates the request, stores a new active campaign and triggers its first batch.
     * Duplicate and undeliverable addresses are dropped; the first occurrence of an address wins.
     *
     * @throws IllegalArgumentException when a required field is missing or no deliverable contact remains
     */
    public CampaignState create(CampaignRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        requireText(request.name(), "Campaign name is required");
        requireText(request.subject(), "Subject is required");
        requireText(request.template(), "Template is required");
        requireText(request.ownerEmail(), "Owner email is required");
        if (request.contacts() == null || request.contacts().isEmpty()) {
            throw new IllegalArgumentException("At least one contact is required");
        }

        List<Contact> contacts = distinctDeliverable(request.contacts());
        if (contacts.isEmpty()) {
            throw new IllegalArgumentException("No deliverable contacts in request");
        }
        int dropped = request.contacts().size() - contacts.size();

        Instant now = clock.instant();
        CampaignState campaign = CampaignState.builder()
                .id(UUID.randomUUID().toString())
                .name(request.name().trim())
                .subject(request.subject())
                .template(request.template())
                .ownerEmail(request.ownerEmail().trim())
                .contacts(contacts)
                .attachments(request.attachments())
                .totalEmails(contacts.size())
                .delayMs(Math.max(0L, request.delayMs()))
                .dailyLimit(Math.max(0, request.dailyLimit()))
                .batchSize(Math.max(0, request.batchSize()))
                .createdAt(now)
                .updatedAt(now)
                .status(CampaignStatus.ACTIVE)
                .build();

        CampaignState stored = store.save(campaign);
        log.info("campaignId={}, event=campaign_created, name={}, contacts={}, dropped={}",
                stored.getId(), stored.getName(), stored.getTotalEmails(), dropped);
        creationListener.onCreated(stored.getId());
        return stored;
    }

    public CampaignState get(String campaignId) {
        return store.find(campaignId).orElseThrow(() -> new CampaignNotFoundException(campaignId));
    }

    /**
     * All campaigns except soft-deleted ones, oldest first.
     */
    public List<CampaignState> list() {
        return store.findAll().stream().filter(campaign -> campaign.getStatus() != CampaignStatus.DELETED).toList();
    }

    public CampaignState pause(String campaignId) {
        return transition(campaignId, CampaignStatus.PAUSED);
    }

    public CampaignState resume(String campaignId) {
        return transition(campaignId, CampaignStatus.ACTIVE);
    }

    /**
     * Soft delete: the record is kept with status {@link CampaignStatus#DELETED}.
     */
    public CampaignState delete(String campaignId) {
        return transition(campaignId, CampaignStatus.DELETED);
    }

    public CampaignProgress progress(String campaignId) {
        CampaignState campaign = get(campaignId);
        LocalDate today = LocalDate.now(clock);
        int total = campaign.getTotalEmails();
        double percent = total == 0 ? 100.0 : Math.round(campaign.getProcessedEmails() * 1000.0 / total) / 10.0;
        long delay = properties.getBatch().resolveDelayMs(campaign.getDelayMs());
        return new CampaignProgress(campaign.getId(), campaign.getName(), campaign.getStatus(), total,
                campaign.getSentEmails(), campaign.getFailedEmails(), campaign.getRemainingEmails(), percent,
                campaign.attemptedOn(today), properties.getLimits().resolveCampaignDailyLimit(campaign.getDailyLimit()),
                campaign.getRemainingEmails() * delay, campaign.getLastProcessedAt(), campaign.getCompletedAt());
    }

    public CampaignSummary summary() {
        int total = 0;
        int active = 0;
        int paused = 0;
        int completed = 0;
        long emails = 0;
        long sent = 0;
        long failed = 0;
        for (CampaignState campaign : list()) {
            total++;
            emails += campaign.getTotalEmails();
            sent += campaign.getSentEmails();
            failed += campaign.getFailedEmails();
            switch (campaign.getStatus()) {
                case ACTIVE -> active++;
                case PAUSED -> paused++;
                case COMPLETED -> completed++;
                default -> {
                }
            }
        }
        return new CampaignSummary(total, active, paused, completed, emails, sent, failed);
    }

    private CampaignState transition(String campaignId, CampaignStatus target) {
        CampaignState updated = store.update(campaignId, campaign -> {
            campaign.transitionTo(target, clock.instant());
            return campaign;
        });
        log.info("campaignId={}, event=campaign_status_changed, status={}", campaignId, updated.getStatus());
        return updated;
    }

    private static List<Contact> distinctDeliverable(List<Contact> requested) {
        Set<String> seen = new HashSet<>();
        List<Contact> accepted = new ArrayList<>(requested.size());
        for (Contact contact : requested) {
            if (contact == null || !EmailAddressUtil.isDeliverable(contact.email())) {
                continue;
            }
            if (seen.add(EmailAddressUtil.normalizeKey(contact.email()))) {
                accepted.add(contact);
            }
        }
        return accepted;
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
    }
}
