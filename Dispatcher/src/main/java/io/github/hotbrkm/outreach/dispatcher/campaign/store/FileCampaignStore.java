package io.github.hotbrkm.outreach.dispatcher.campaign.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.hotbrkm.outreach.dispatcher.campaign.CampaignNotFoundException;
import io.github.hotbrkm.outreach.dispatcher.campaign.CampaignState;
import io.github.hotbrkm.outreach.dispatcher.config.DispatcherProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * One JSON snapshot file per campaign under the configured directory.
 * <p>
 * All writes run on a single writer thread. A write stages the new snapshot in a temporary file, keeps a
 * {@code .bak} copy of the current snapshot, then atomically moves the temporary file into place. If the swap
 * fails the backup is moved back. A backup found without its snapshot at load time is restored.
 * Reads go through a {@link CampaignCache}. Only the writer thread fills it; a read on any other thread that misses
 * goes to the file and leaves the cache alone.
 */
@Slf4j
public class FileCampaignStore implements CampaignStore {

    private static final String SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".json.tmp";
    private static final String BACKUP_SUFFIX = ".json.bak";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final CampaignCache cache;
    private final ExecutorService writer;

    public FileCampaignStore(DispatcherProperties.Store store, Clock clock) {
        this(Paths.get(store.getDirectory()), new CampaignCache(store.getCacheTtl(), store.getCacheMaxEntries(), clock));
    }

    FileCampaignStore(Path directory, CampaignCache cache) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null").resolve("campaigns");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.writer = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "campaign-store-writer");
            thread.setDaemon(true);
            return thread;
        });
        try {
            Files.createDirectories(this.directory);
        } catch (IOException e) {
            throw new CampaignStoreException("Cannot create campaign directory " + this.directory, e);
        }
        recoverInterruptedWrites();
    }

    @Override
    public CampaignState save(CampaignState campaign) {
        Objects.requireNonNull(campaign, "campaign must not be null");
        CampaignState snapshot = campaign.copy();
        return onWriter(() -> {
            write(snapshot);
            return snapshot.copy();
        });
    }

    @Override
    public CampaignState update(String campaignId, UnaryOperator<CampaignState> modifier) {
        Objects.requireNonNull(modifier, "modifier must not be null");
        return onWriter(() -> {
            CampaignState current = load(campaignId, true).map(CampaignState::copy).orElseThrow(() -> new CampaignNotFoundException(campaignId));
            CampaignState modified = modifier.apply(current);
            if (modified == null) {
                modified = current;
            }
            if (!campaignId.equals(modified.getId())) {
                throw new IllegalArgumentException("Update must not change campaign id " + campaignId);
            }
            write(modified);
            return modified.copy();
        });
    }

    @Override
    public Optional<CampaignState> find(String campaignId) {
        return load(campaignId, false).map(CampaignState::copy);
    }

    @Override
    public List<CampaignState> findAll() {
        List<CampaignState> campaigns = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                String id = name.substring(0, name.length() - SUFFIX.length());
                load(id, false).map(CampaignState::copy).ifPresent(campaigns::add);
            }
        } catch (IOException e) {
            throw new CampaignStoreException("Cannot list campaigns in " + directory, e);
        }
        campaigns.sort(Comparator.comparing(CampaignState::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(CampaignState::getId));
        return campaigns;
    }

    @Override
    public int evictExpired() {
        return cache.evictExpired();
    }

    @Override
    public void close() {
        writer.shutdown();
    }

    private Optional<CampaignState> load(String campaignId, boolean onWriterThread) {
        Path file = snapshotFile(campaignId);
        CampaignState cached = cache.get(campaignId);
        if (cached != null) {
            return Optional.of(cached);
        }
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            CampaignState campaign = objectMapper.readValue(file.toFile(), CampaignState.class);
            if (onWriterThread) {
                cache.put(campaign.copy());
            }
            return Optional.of(campaign);
        } catch (IOException e) {
            throw new CampaignStoreException("Cannot read campaign " + campaignId, e);
        }
    }

    private void write(CampaignState campaign) {
        Path target = snapshotFile(campaign.getId());
        Path temp = directory.resolve(campaign.getId() + TEMP_SUFFIX);
        Path backup = directory.resolve(campaign.getId() + BACKUP_SUFFIX);
        cache.invalidate(campaign.getId());

        try {
            objectMapper.writeValue(temp.toFile(), campaign);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new CampaignStoreException("Cannot stage campaign " + campaign.getId(), e);
        }

        boolean backedUp = false;
        try {
            if (Files.exists(target)) {
                Files.copy(target, backup, StandardCopyOption.REPLACE_EXISTING);
                backedUp = true;
            }
            move(temp, target);
        } catch (IOException e) {
            if (backedUp) {
                rollback(backup, target);
            }
            deleteQuietly(temp);
            throw new CampaignStoreException("Cannot replace campaign " + campaign.getId(), e);
        }

        if (backedUp) {
            deleteQuietly(backup);
        }
        cache.put(campaign.copy());
        log.debug("campaignId={}, event=campaign_saved, status={}, sent={}, failed={}",
                campaign.getId(), campaign.getStatus(), campaign.getSentEmails(), campaign.getFailedEmails());
    }

    private void recoverInterruptedWrites() {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + BACKUP_SUFFIX)) {
            for (Path backup : stream) {
                String name = backup.getFileName().toString();
                Path target = directory.resolve(name.substring(0, name.length() - BACKUP_SUFFIX.length()) + SUFFIX);
                if (Files.exists(target)) {
                    Files.delete(backup);
                } else {
                    move(backup, target);
                    log.warn("event=campaign_snapshot_restored, file={}", target.getFileName());
                }
            }
        } catch (IOException e) {
            throw new CampaignStoreException("Cannot recover campaign snapshots in " + directory, e);
        }
    }

    private void rollback(Path backup, Path target) {
        try {
            move(backup, target);
            log.warn("event=campaign_write_rolled_back, file={}", target.getFileName());
        } catch (IOException e) {
            log.error("event=campaign_rollback_failed, file={}, backup={}", target.getFileName(), backup.getFileName(), e);
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("event=temp_cleanup_failed, file={}", path, e);
        }
    }

    private Path snapshotFile(String campaignId) {
        if (campaignId == null || !SAFE_ID.matcher(campaignId).matches()) {
            throw new IllegalArgumentException("Invalid campaign id: " + campaignId);
        }
        return directory.resolve(campaignId + SUFFIX);
    }

    private <T> T onWriter(Callable<T> task) {
        Future<T> future = writer.submit(task);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CampaignStoreException("Interrupted while waiting for campaign write", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new CampaignStoreException("Campaign write failed", cause);
        }
    }
}
