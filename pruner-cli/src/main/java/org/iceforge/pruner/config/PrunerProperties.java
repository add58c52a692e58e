package org.iceforge.pruner.config;

import org.iceforge.pruner.strategy.PolicyParams;
import org.iceforge.pruner.strategy.RetentionStrategies;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration for a prune run. Command-line flags override the policy and scope settings.
 * <p>
 * Policy durations without a unit are read as days.
 */
@ConfigurationProperties(prefix = "pruner")
public class PrunerProperties {

    public enum Store { S3, LOCAL }

    public enum TimestampSource { LAST_MODIFIED, KEY_PATTERN, KEY_PATTERN_OR_LAST_MODIFIED }

    /** Backing store: s3 (default) or local for dev/test. */
    private Store store = Store.S3;

    /** Root directory of the local store ({localBaseDir}/{bucket}/{key}). */
    private String localBaseDir = "./pruner-local";

    private String bucket;

    /** Prefix inside the bucket; empty means the whole bucket. */
    private String prefix = "";

    private String strategy = RetentionStrategies.DEFAULT;

    /** Calendar zone used to assign backups to months. */
    private String zone = "UTC";

    @DurationUnit(ChronoUnit.DAYS)
    private Duration keepAllWithin;

    @DurationUnit(ChronoUnit.DAYS)
    private Duration onePerMonthWithin;

    @DurationUnit(ChronoUnit.DAYS)
    private Duration onePerMonthTolerance = PolicyParams.DEFAULT_TOLERANCE;

    private int keepLast;

    /** Keys per listing page (S3 caps this at 1000). */
    private int pageSize = 1000;

    /** How many deletes run in parallel. */
    private int deleteConcurrency = 8;

    private final Retry retry = new Retry();

    private final Timestamp timestamp = new Timestamp();

    public static class Retry {
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(200);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(10);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }

        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
    }

    public static class Timestamp {
        private TimestampSource source = TimestampSource.LAST_MODIFIED;

        /** Regex with a named group {@code ts}, e.g. {@code .*-(?<ts>\d{8})\.tar\.gz}. */
        private String keyPattern;

        /** DateTimeFormatter pattern applied to the {@code ts} group, e.g. {@code yyyyMMdd}. */
        private String keyFormat;

        public TimestampSource getSource() { return source; }
        public void setSource(TimestampSource source) { this.source = source; }

        public String getKeyPattern() { return keyPattern; }
        public void setKeyPattern(String keyPattern) { this.keyPattern = keyPattern; }

        public String getKeyFormat() { return keyFormat; }
        public void setKeyFormat(String keyFormat) { this.keyFormat = keyFormat; }
    }

    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }

    public String getLocalBaseDir() { return localBaseDir; }
    public void setLocalBaseDir(String localBaseDir) { this.localBaseDir = localBaseDir; }

    public String getBucket() { return bucket; }
    public void setBucket(String bucket) { this.bucket = bucket; }

    public String getPrefix() { return prefix; }
    public void setPrefix(String prefix) { this.prefix = prefix; }

    public String getStrategy() { return strategy; }
    public void setStrategy(String strategy) { this.strategy = strategy; }

    public String getZone() { return zone; }
    public void setZone(String zone) { this.zone = zone; }

    public Duration getKeepAllWithin() { return keepAllWithin; }
    public void setKeepAllWithin(Duration keepAllWithin) { this.keepAllWithin = keepAllWithin; }

    public Duration getOnePerMonthWithin() { return onePerMonthWithin; }
    public void setOnePerMonthWithin(Duration onePerMonthWithin) { this.onePerMonthWithin = onePerMonthWithin; }

    public Duration getOnePerMonthTolerance() { return onePerMonthTolerance; }
    public void setOnePerMonthTolerance(Duration onePerMonthTolerance) { this.onePerMonthTolerance = onePerMonthTolerance; }

    public int getKeepLast() { return keepLast; }
    public void setKeepLast(int keepLast) { this.keepLast = keepLast; }

    public int getPageSize() { return pageSize; }
    public void setPageSize(int pageSize) { this.pageSize = pageSize; }

    public int getDeleteConcurrency() { return deleteConcurrency; }
    public void setDeleteConcurrency(int deleteConcurrency) { this.deleteConcurrency = deleteConcurrency; }

    public Retry getRetry() { return retry; }

    public Timestamp getTimestamp() { return timestamp; }
}
