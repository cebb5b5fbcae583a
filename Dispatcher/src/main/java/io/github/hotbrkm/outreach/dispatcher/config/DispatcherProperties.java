package io.github.hotbrkm.outreach.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;

@Data
@ConfigurationProperties(prefix = "outreach")
@Component
public class DispatcherProperties {

    private Limits limits = new Limits();
    private Rate rate = new Rate();
    private Batch batch = new Batch();
    private Health health = new Health();
    private Schedule schedule = new Schedule();
    private Store store = new Store();
    private Mail mail = new Mail();

    @Data
    public static class Limits {
        public static final int DEFAULT_GLOBAL_DAILY_LIMIT = 300;
        public static final int DEFAULT_CAMPAIGN_DAILY_LIMIT = 50;

        private int globalDailyLimit = DEFAULT_GLOBAL_DAILY_LIMIT;
        private int campaignDailyLimit = DEFAULT_CAMPAIGN_DAILY_LIMIT;

        public int resolveGlobalDailyLimit() {
            return globalDailyLimit > 0 ? globalDailyLimit : DEFAULT_GLOBAL_DAILY_LIMIT;
        }

        /**
         * Returns the campaign's own daily ceiling when set, otherwise the configured default.
         */
        public int resolveCampaignDailyLimit(int campaignOverride) {
            if (campaignOverride > 0) {
                return campaignOverride;
            }
            return campaignDailyLimit > 0 ? campaignDailyLimit : DEFAULT_CAMPAIGN_DAILY_LIMIT;
        }
    }

    @Data
    public static class Rate {
        public static final int DEFAULT_FAILURE_THRESHOLD = 5;
        public static final long DEFAULT_BACKOFF_BASE_MS = 30_000L;
        public static final long DEFAULT_BACKOFF_MAX_MS = 300_000L;

        private int perSecond = 5;
        private int perMinute = 50;
        private int perHour = 500;
        private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;
        private long backoffBaseMs = DEFAULT_BACKOFF_BASE_MS;
        private long backoffMaxMs = DEFAULT_BACKOFF_MAX_MS;
        private long domainCooldownMs = 2_000L;
        private boolean adaptiveThrottlingEnabled = true;

        public int resolveFailureThreshold() {
            return failureThreshold > 0 ? failureThreshold : DEFAULT_FAILURE_THRESHOLD;
        }

        public long resolveBackoffBaseMs() {
            return backoffBaseMs > 0 ? backoffBaseMs : DEFAULT_BACKOFF_BASE_MS;
        }

        public long resolveBackoffMaxMs() {
            return Math.max(resolveBackoffBaseMs(), backoffMaxMs > 0 ? backoffMaxMs : DEFAULT_BACKOFF_MAX_MS);
        }
    }

    @Data
    public static class Batch {
        public static final int DEFAULT_BATCH_SIZE = 25;
        public static final long DEFAULT_DELAY_MS = 10_000L;
        public static final int DEFAULT_MAX_MESSAGE_RETRIES = 3;

        private int batchSizeMin = 10;
        private int batchSizeDefault = DEFAULT_BATCH_SIZE;
        private int batchSizeMax = 50;
        private long delayMsMin = 5_000L;
        private long delayMsDefault = DEFAULT_DELAY_MS;
        private long delayMsMax = 30_000L;
        private int maxMessageRetries = DEFAULT_MAX_MESSAGE_RETRIES;
        private long retryDelayMs = 2_000L;
        private long messageTimeoutMs = 60_000L;
        private int maxMessagesInMemory = 10_000;
        private int chunkSize = 5_000;

        /**
         * Clamps a requested batch size into [min, max]; non-positive requests use the default.
         */
        public int resolveBatchSize(int requested) {
            int size = requested > 0 ? requested : (batchSizeDefault > 0 ? batchSizeDefault : DEFAULT_BATCH_SIZE);
            int min = Math.max(1, batchSizeMin);
            int max = Math.max(min, batchSizeMax);
            return Math.max(min, Math.min(max, size));
        }

        /**
         * Clamps a requested inter-message delay into [min, max]; non-positive requests use the default.
         */
        public long resolveDelayMs(long requested) {
            long delay = requested > 0 ? requested : (delayMsDefault > 0 ? delayMsDefault : DEFAULT_DELAY_MS);
            long min = Math.max(0L, delayMsMin);
            long max = Math.max(min, delayMsMax);
            return Math.max(min, Math.min(max, delay));
        }

        public int resolveMaxMessageRetries() {
            return maxMessageRetries >= 0 ? maxMessageRetries : DEFAULT_MAX_MESSAGE_RETRIES;
        }
    }

    @Data
    public static class Health {
        private int recipientFailureThreshold = 3;
        private boolean skipEnabled = true;
    }

    @Data
    public static class Schedule {
        private int activeWindowStartHour = 9;
        private int activeWindowEndHour = 21;
        private String zone;
        private Duration campaignTickInterval = Duration.ofHours(1);
        private Duration statusCheckInterval = Duration.ofMinutes(10);
        private Duration housekeepingInterval = Duration.ofHours(1);
        private Duration reportCheckInterval = Duration.ofMinutes(5);
        private Duration progressRetention = Duration.ofHours(24);
        private Duration activityRetention = Duration.ofDays(30);
        private int activityLogDepth = 500;
        private int schedulerPoolSize = 4;

        public ZoneId resolveZone() {
            if (zone == null || zone.isBlank()) {
                return ZoneId.systemDefault();
            }
            return ZoneId.of(zone.trim());
        }
    }

    @Data
    public static class Store {
        private String directory = "./data";
        private Duration cacheTtl = Duration.ofMinutes(5);
        private int cacheMaxEntries = 50;
    }

    @Data
    public static class Mail {
        private String host;
        private int port = 587;
        private String username;
        private String password;
        private String from;
        private boolean startTls = true;
        private int connectionTimeoutMs = 10_000;
    }
}
