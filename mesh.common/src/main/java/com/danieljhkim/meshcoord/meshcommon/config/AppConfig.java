package com.danieljhkim.meshcoord.meshcommon.config;

import java.util.List;
import lombok.Getter;
import lombok.Setter;

/**
 * YAML-bound configuration tree ({@code mesh-config.yml}). Every section has usable defaults so a partial file is
 * enough.
 */
@Getter
@Setter
public class AppConfig {

    private LocalNodeConfig localNode = new LocalNodeConfig();
    private CoordinatorSettings coordinator = new CoordinatorSettings();
    private MigrationSettings migration = new MigrationSettings();
    private MarketSettings market = new MarketSettings();
    private JournalSettings journal = new JournalSettings();

    @Setter
    @Getter
    public static class LocalNodeConfig {
        private String name = "mesh-node-1";
        private String host = "localhost";
        private int port = 9400;
        private int cpuCores = 8;
        private long memoryBytes = 16L * 1024 * 1024 * 1024;
        private int gpuDevices = 0;
        private long storageBytes = 1024L * 1024 * 1024 * 1024;
        private long bandwidthMbps = 1000;
        private List<String> supportedResources = List.of("CPU", "MEMORY", "STORAGE");
        private List<String> softwareCapabilities = List.of();
        private String datacenter = "local";
        private String region = "local";
        private String zone = "default";

        @Override
        public String toString() {
            return "LocalNodeConfig{" + "name='"
                    + name + '\'' + ", host='"
                    + host + '\'' + ", port="
                    + port + ", cpuCores="
                    + cpuCores + ", memoryBytes="
                    + memoryBytes + ", supportedResources="
                    + supportedResources + ", region='"
                    + region + '\'' + '}';
        }
    }

    @Setter
    @Getter
    public static class CoordinatorSettings {
        private long heartbeatIntervalMs = 10_000;
        private long failureTimeoutMs = 30_000;
        private long partitionCheckIntervalMs = 30_000;
        private long byzantineCheckIntervalMs = 60_000;
        private long loadBalanceIntervalMs = 120_000;
        private double byzantineThreshold = 0.33;
        private double loadImbalanceThreshold = 0.2;
        private double trustPenalty = 0.1;
        private boolean autoMigration = true;
        private boolean loadBalancing = true;

        @Override
        public String toString() {
            return "CoordinatorSettings{" + "heartbeatIntervalMs="
                    + heartbeatIntervalMs + ", failureTimeoutMs="
                    + failureTimeoutMs + ", partitionCheckIntervalMs="
                    + partitionCheckIntervalMs + ", byzantineCheckIntervalMs="
                    + byzantineCheckIntervalMs + ", loadBalanceIntervalMs="
                    + loadBalanceIntervalMs + ", byzantineThreshold="
                    + byzantineThreshold + ", autoMigration="
                    + autoMigration + ", loadBalancing="
                    + loadBalancing + '}';
        }
    }

    @Setter
    @Getter
    public static class MigrationSettings {
        private boolean preferLiveMigration = true;
        private long defaultDataSizeBytes = 1024L * 1024 * 1024;

        @Override
        public String toString() {
            return "MigrationSettings{" + "preferLiveMigration="
                    + preferLiveMigration + ", defaultDataSizeBytes="
                    + defaultDataSizeBytes + '}';
        }
    }

    @Setter
    @Getter
    public static class MarketSettings {
        private long matchIntervalMs = 5_000;
        private double maxDemandFactor = 3.0;
        private double usageDiscount = 0.8;

        @Override
        public String toString() {
            return "MarketSettings{" + "matchIntervalMs="
                    + matchIntervalMs + ", maxDemandFactor="
                    + maxDemandFactor + ", usageDiscount="
                    + usageDiscount + '}';
        }
    }

    @Setter
    @Getter
    public static class JournalSettings {
        private boolean enabled = false;
        private String path = "./data/mesh-events.jsonl";

        @Override
        public String toString() {
            return "JournalSettings{" + "enabled=" + enabled + ", path='" + path + '\'' + '}';
        }
    }
}
