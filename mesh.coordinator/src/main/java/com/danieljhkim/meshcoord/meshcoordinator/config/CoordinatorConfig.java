package com.danieljhkim.meshcoord.meshcoordinator.config;

import com.danieljhkim.meshcoord.meshcommon.config.AppConfig;
import lombok.Getter;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the coordination engine.
 *
 * <p>
 * Built either programmatically through {@link #builder()} or from the YAML tree via {@link #fromAppConfig(AppConfig)}.
 * All values are validated once at construction time.
 */
@Getter
public class CoordinatorConfig {

    private final Duration heartbeatInterval;
    private final Duration failureTimeout;
    private final Duration partitionCheckInterval;
    private final Duration byzantineCheckInterval;
    private final Duration loadBalanceInterval;
    private final Duration marketMatchInterval;
    private final double byzantineThreshold;
    private final double loadImbalanceThreshold;
    private final double trustPenalty;
    private final boolean autoMigration;
    private final boolean loadBalancing;
    private final boolean preferLiveMigration;
    private final long defaultMigrationDataBytes;
    private final double maxDemandFactor;
    private final double usageDiscount;
    private final boolean journalEnabled;
    private final Path journalPath;

    private CoordinatorConfig(Builder builder) {
        this.heartbeatInterval = Objects.requireNonNull(builder.heartbeatInterval, "heartbeatInterval cannot be null");
        this.failureTimeout = Objects.requireNonNull(builder.failureTimeout, "failureTimeout cannot be null");
        this.partitionCheckInterval =
                Objects.requireNonNull(builder.partitionCheckInterval, "partitionCheckInterval cannot be null");
        this.byzantineCheckInterval =
                Objects.requireNonNull(builder.byzantineCheckInterval, "byzantineCheckInterval cannot be null");
        this.loadBalanceInterval =
                Objects.requireNonNull(builder.loadBalanceInterval, "loadBalanceInterval cannot be null");
        this.marketMatchInterval =
                Objects.requireNonNull(builder.marketMatchInterval, "marketMatchInterval cannot be null");
        this.byzantineThreshold = builder.byzantineThreshold;
        this.loadImbalanceThreshold = builder.loadImbalanceThreshold;
        this.trustPenalty = builder.trustPenalty;
        this.autoMigration = builder.autoMigration;
        this.loadBalancing = builder.loadBalancing;
        this.preferLiveMigration = builder.preferLiveMigration;
        this.defaultMigrationDataBytes = builder.defaultMigrationDataBytes;
        this.maxDemandFactor = builder.maxDemandFactor;
        this.usageDiscount = builder.usageDiscount;
        this.journalEnabled = builder.journalEnabled;
        this.journalPath = Objects.requireNonNull(builder.journalPath, "journalPath cannot be null");

        // Validation
        requirePositive(heartbeatInterval, "heartbeatInterval");
        requirePositive(failureTimeout, "failureTimeout");
        requirePositive(partitionCheckInterval, "partitionCheckInterval");
        requirePositive(byzantineCheckInterval, "byzantineCheckInterval");
        requirePositive(loadBalanceInterval, "loadBalanceInterval");
        requirePositive(marketMatchInterval, "marketMatchInterval");
        if (byzantineThreshold < 0.0 || byzantineThreshold > 1.0) {
            throw new IllegalArgumentException("byzantineThreshold must be within [0, 1]");
        }
        if (loadImbalanceThreshold < 0.0 || loadImbalanceThreshold > 1.0) {
            throw new IllegalArgumentException("loadImbalanceThreshold must be within [0, 1]");
        }
        if (trustPenalty < 0.0 || trustPenalty > 1.0) {
            throw new IllegalArgumentException("trustPenalty must be within [0, 1]");
        }
        if (defaultMigrationDataBytes < 0) {
            throw new IllegalArgumentException("defaultMigrationDataBytes cannot be negative");
        }
        if (maxDemandFactor < 1.0) {
            throw new IllegalArgumentException("maxDemandFactor must be >= 1");
        }
        if (usageDiscount <= 0.0 || usageDiscount > 1.0) {
            throw new IllegalArgumentException("usageDiscount must be within (0, 1]");
        }
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CoordinatorConfig defaults() {
        return builder().build();
    }

    /**
     * Converts the YAML-bound tree into a validated config.
     */
    public static CoordinatorConfig fromAppConfig(AppConfig appConfig) {
        AppConfig.CoordinatorSettings coordinator = appConfig.getCoordinator();
        AppConfig.MigrationSettings migration = appConfig.getMigration();
        AppConfig.MarketSettings market = appConfig.getMarket();
        AppConfig.JournalSettings journal = appConfig.getJournal();

        return builder()
                .heartbeatInterval(Duration.ofMillis(coordinator.getHeartbeatIntervalMs()))
                .failureTimeout(Duration.ofMillis(coordinator.getFailureTimeoutMs()))
                .partitionCheckInterval(Duration.ofMillis(coordinator.getPartitionCheckIntervalMs()))
                .byzantineCheckInterval(Duration.ofMillis(coordinator.getByzantineCheckIntervalMs()))
                .loadBalanceInterval(Duration.ofMillis(coordinator.getLoadBalanceIntervalMs()))
                .byzantineThreshold(coordinator.getByzantineThreshold())
                .loadImbalanceThreshold(coordinator.getLoadImbalanceThreshold())
                .trustPenalty(coordinator.getTrustPenalty())
                .autoMigration(coordinator.isAutoMigration())
                .loadBalancing(coordinator.isLoadBalancing())
                .preferLiveMigration(migration.isPreferLiveMigration())
                .defaultMigrationDataBytes(migration.getDefaultDataSizeBytes())
                .marketMatchInterval(Duration.ofMillis(market.getMatchIntervalMs()))
                .maxDemandFactor(market.getMaxDemandFactor())
                .usageDiscount(market.getUsageDiscount())
                .journalEnabled(journal.isEnabled())
                .journalPath(Path.of(journal.getPath()))
                .build();
    }

    public static class Builder {

        private Duration heartbeatInterval = Duration.ofSeconds(10);
        private Duration failureTimeout = Duration.ofSeconds(30);
        private Duration partitionCheckInterval = Duration.ofSeconds(30);
        private Duration byzantineCheckInterval = Duration.ofSeconds(60);
        private Duration loadBalanceInterval = Duration.ofSeconds(120);
        private Duration marketMatchInterval = Duration.ofSeconds(5);
        private double byzantineThreshold = 0.33;
        private double loadImbalanceThreshold = 0.2;
        private double trustPenalty = 0.1;
        private boolean autoMigration = true;
        private boolean loadBalancing = true;
        private boolean preferLiveMigration = true;
        private long defaultMigrationDataBytes = 1024L * 1024 * 1024;
        private double maxDemandFactor = 3.0;
        private double usageDiscount = 0.8;
        private boolean journalEnabled = false;
        private Path journalPath = Path.of("./data/mesh-events.jsonl");

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder failureTimeout(Duration failureTimeout) {
            this.failureTimeout = failureTimeout;
            return this;
        }

        public Builder partitionCheckInterval(Duration partitionCheckInterval) {
            this.partitionCheckInterval = partitionCheckInterval;
            return this;
        }

        public Builder byzantineCheckInterval(Duration byzantineCheckInterval) {
            this.byzantineCheckInterval = byzantineCheckInterval;
            return this;
        }

        public Builder loadBalanceInterval(Duration loadBalanceInterval) {
            this.loadBalanceInterval = loadBalanceInterval;
            return this;
        }

        public Builder marketMatchInterval(Duration marketMatchInterval) {
            this.marketMatchInterval = marketMatchInterval;
            return this;
        }

        public Builder byzantineThreshold(double byzantineThreshold) {
            this.byzantineThreshold = byzantineThreshold;
            return this;
        }

        public Builder loadImbalanceThreshold(double loadImbalanceThreshold) {
            this.loadImbalanceThreshold = loadImbalanceThreshold;
            return this;
        }

        public Builder trustPenalty(double trustPenalty) {
            this.trustPenalty = trustPenalty;
            return this;
        }

        public Builder autoMigration(boolean autoMigration) {
            this.autoMigration = autoMigration;
            return this;
        }

        public Builder loadBalancing(boolean loadBalancing) {
            this.loadBalancing = loadBalancing;
            return this;
        }

        public Builder preferLiveMigration(boolean preferLiveMigration) {
            this.preferLiveMigration = preferLiveMigration;
            return this;
        }

        public Builder defaultMigrationDataBytes(long defaultMigrationDataBytes) {
            this.defaultMigrationDataBytes = defaultMigrationDataBytes;
            return this;
        }

        public Builder maxDemandFactor(double maxDemandFactor) {
            this.maxDemandFactor = maxDemandFactor;
            return this;
        }

        public Builder usageDiscount(double usageDiscount) {
            this.usageDiscount = usageDiscount;
            return this;
        }

        public Builder journalEnabled(boolean journalEnabled) {
            this.journalEnabled = journalEnabled;
            return this;
        }

        public Builder journalPath(Path journalPath) {
            this.journalPath = journalPath;
            return this;
        }

        public CoordinatorConfig build() {
            return new CoordinatorConfig(this);
        }
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" + "heartbeatInterval=" + heartbeatInterval + ", failureTimeout=" + failureTimeout
                + ", partitionCheckInterval=" + partitionCheckInterval + ", byzantineCheckInterval="
                + byzantineCheckInterval + ", loadBalanceInterval=" + loadBalanceInterval
                + ", marketMatchInterval=" + marketMatchInterval + ", byzantineThreshold=" + byzantineThreshold
                + ", autoMigration=" + autoMigration + ", loadBalancing=" + loadBalancing
                + ", preferLiveMigration=" + preferLiveMigration + ", journalEnabled=" + journalEnabled + '}';
    }
}
