package io.github.hotbrkm.outreach.dispatcher.campaign.store;

import io.github.hotbrkm.outreach.dispatcher.campaign.CampaignNotFoundException;
import io.github.hotbrkm.outreach.dispatcher.campaign.CampaignState;
import io.github.hotbrkm.outreach.dispatcher.campaign.CampaignStatus;
import io.github.hotbrkm.outreach.dispatcher.campaign.Contact;
import io.github.hotbrkm.outreach.dispatcher.campaign.RecipientRecord;
import io.github.hotbrkm.outreach.dispatcher.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FileCampaignStore test")
class FileCampaignStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private FileCampaignStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW, ZoneOffset.UTC);
        store = newStore(Duration.ofMinutes(5));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private FileCampaignStore newStore(Duration ttl) {
        return new FileCampaignStore(tempDir, new CampaignCache(ttl, 50, clock));
    }

    private static CampaignState campaign(String id, Instant createdAt) {
        return CampaignState.builder()
                .id(id)
                .name("Campaign " + id)
                .subject("Hello {{company_name}}")
                .template("<p>Hi</p>")
                .ownerEmail("owner@example.com")
                .contacts(List.of(new Contact("a@one.com", "One"), new Contact("b@two.com", "Two")))
                .createdAt(createdAt)
                .status(CampaignStatus.ACTIVE)
                .build();
    }

    @Test
    @DisplayName("A saved campaign survives a restart with its logs and counts")
    void saveAndReload() {
        CampaignState campaign = campaign("c-1", NOW);
        campaign.recordOutcomes(LocalDate.of(2026, 3, 2),
                List.of(RecipientRecord.sent(campaign.getContacts().get(0), "msg-1", NOW)), NOW);
        store.save(campaign);
        store.close();

        store = newStore(Duration.ofMinutes(5));
        CampaignState loaded = store.find("c-1").orElseThrow();

        assertThat(loaded.getName()).isEqualTo("Campaign c-1");
        assertThat(loaded.getSentEmails()).isEqualTo(1);
        assertThat(loaded.getTotalEmails()).isEqualTo(2);
        assertThat(loaded.getDailyLogs()).hasSize(1);
        assertThat(loaded.getDailyLogs().get(0).getRecipients().get(0).providerMessageId()).isEqualTo("msg-1");
        assertThat(loaded.getCreatedAt()).isEqualTo(NOW);
        assertThat(Files.exists(tempDir.resolve("campaigns").resolve("c-1.json"))).isTrue();
    }

    @Test
    @DisplayName("Returned instances are copies")
    void returnsCopies() {
        store.save(campaign("c-1", NOW));

        CampaignState first = store.find("c-1").orElseThrow();
        first.transitionTo(CampaignStatus.PAUSED, NOW);

        assertThat(store.find("c-1").orElseThrow().getStatus()).isEqualTo(CampaignStatus.ACTIVE);
    }

    @Test
    @DisplayName("Update applies the modifier and persists the result")
    void updatePersists() {
        store.save(campaign("c-1", NOW));

        CampaignState updated = store.update("c-1", campaign -> {
            campaign.transitionTo(CampaignStatus.PAUSED, NOW);
            return campaign;
        });

        assertThat(updated.getStatus()).isEqualTo(CampaignStatus.PAUSED);
        store.close();
        store = newStore(Duration.ZERO);
        assertThat(store.find("c-1").orElseThrow().getStatus()).isEqualTo(CampaignStatus.PAUSED);
    }

    @Test
    @DisplayName("A failing modifier leaves the stored campaign untouched")
    void failingModifier() {
        store.save(campaign("c-1", NOW));

        assertThatThrownBy(() -> store.update("c-1", campaign -> {
            campaign.transitionTo(CampaignStatus.PAUSED, NOW);
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(store.find("c-1").orElseThrow().getStatus()).isEqualTo(CampaignStatus.ACTIVE);
    }

    @Test
    @DisplayName("Updating an unknown campaign fails")
    void updateUnknown() {
        assertThatThrownBy(() -> store.update("missing", campaign -> campaign))
                .isInstanceOf(CampaignNotFoundException.class);
        assertThat(store.find("missing")).isEmpty();
    }

    @Test
    @DisplayName("Ids that could escape the directory are rejected")
    void unsafeIdRejected() {
        assertThatThrownBy(() -> store.find("../etc/passwd")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("All campaigns are listed oldest first and can be filtered by status")
    void findAllOrdered() {
        store.save(campaign("late", NOW.plusSeconds(60)));
        store.save(campaign("early", NOW));
        store.update("late", campaign -> {
            campaign.transitionTo(CampaignStatus.PAUSED, NOW);
            return campaign;
        });

        assertThat(store.findAll()).extracting(CampaignState::getId).containsExactly("early", "late");
        assertThat(store.findByStatus(CampaignStatus.PAUSED)).extracting(CampaignState::getId).containsExactly("late");
    }

    @Test
    @DisplayName("A backup left by an interrupted write is restored on startup")
    void backupRestored() throws Exception {
        store.save(campaign("c-1", NOW));
        store.close();
        Path directory = tempDir.resolve("campaigns");
        Files.move(directory.resolve("c-1.json"), directory.resolve("c-1.json.bak"));

        store = newStore(Duration.ofMinutes(5));

        assertThat(store.find("c-1")).isPresent();
        assertThat(Files.exists(directory.resolve("c-1.json.bak"))).isFalse();
    }

    @Test
    @DisplayName("A stale backup next to a complete snapshot is discarded")
    void staleBackupDiscarded() throws Exception {
        store.save(campaign("c-1", NOW));
        store.close();
        Path directory = tempDir.resolve("campaigns");
        Files.copy(directory.resolve("c-1.json"), directory.resolve("c-1.json.bak"));

        store = newStore(Duration.ofMinutes(5));

        assertThat(Files.exists(directory.resolve("c-1.json.bak"))).isFalse();
        assertThat(store.findAll()).hasSize(1);
    }

    @Test
    @DisplayName("Expired cache entries are evicted")
    void evictExpired() {
        store.save(campaign("c-1", NOW));
        clock.advance(Duration.ofMinutes(6));

        assertThat(store.evictExpired()).isEqualTo(1);
        assertThat(store.find("c-1")).isPresent();
    }

    @Test
    @DisplayName("A read that misses the cache does not fill it")
    void readMissLeavesCacheEmpty() {
        store.save(campaign("c-1", NOW));
        store.close();
        CampaignCache cache = new CampaignCache(Duration.ofMinutes(5), 50, clock);
        store = new FileCampaignStore(tempDir, cache);

        assertThat(store.find("c-1")).isPresent();
        assertThat(store.findAll()).hasSize(1);
        assertThat(cache.size()).isZero();

        store.update("c-1", campaign -> campaign);
        assertThat(cache.get("c-1")).isNotNull();
    }

    @Test
    @DisplayName("Concurrent reads never roll back recorded outcomes")
    void concurrentReadsDuringUpdates() throws Exception {
        int total = 400;
        LocalDate day = LocalDate.of(2026, 3, 2);
        List<Contact> contacts = IntStream.range(0, total)
                .mapToObj(i -> new Contact("user" + i + "@example.com", "Company " + i))
                .toList();
        store.save(CampaignState.builder()
                .id("c-1")
                .name("Bulk")
                .subject("Hello")
                .template("<p>Hi</p>")
                .ownerEmail("owner@example.com")
                .contacts(contacts)
                .createdAt(NOW)
                .status(CampaignStatus.ACTIVE)
                .build());

        AtomicBoolean running = new AtomicBoolean(true);
        ExecutorService readers = Executors.newFixedThreadPool(3);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            futures.add(readers.submit(() -> {
                while (running.get()) {
                    store.find("c-1");
                }
            }));
        }
        try {
            for (int i = 0; i < total; i++) {
                Contact contact = contacts.get(i);
                String messageId = "msg-" + i;
                store.update("c-1", campaign -> {
                    campaign.recordOutcomes(day, List.of(RecipientRecord.sent(contact, messageId, NOW)), NOW);
                    return campaign;
                });
            }
        } finally {
            running.set(false);
            readers.shutdown();
            assertThat(readers.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
        for (Future<?> future : futures) {
            future.get();
        }

        CampaignState stored = store.find("c-1").orElseThrow();
        assertThat(stored.getSentEmails()).isEqualTo(total);
        assertThat(stored.nextBatch(10)).isEmpty();
    }
}
