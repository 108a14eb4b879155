package com.xpt.config;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Configuration loaded from environment variables for trajectories, storage and workers.
 * <p>
 * Storage: XPT_STORAGE_SERVICE (registered backend name, e.g. {@code json-file} or {@code memory}),
 * XPT_STORAGE_LOCATION. Format: XPT_FORMAT_VERSION, XPT_MAX_OVERVIEW_ROWS.
 * Workers: XPT_WORKERS, XPT_QUEUE_CAPACITY. Lookup: XPT_AUTO_LOAD, XPT_WITH_LINKS.
 */
public final class XptConfig {

    private static final String ENV_STORAGE_SERVICE = "XPT_STORAGE_SERVICE";
    private static final String ENV_STORAGE_LOCATION = "XPT_STORAGE_LOCATION";
    private static final String ENV_FORMAT_VERSION = "XPT_FORMAT_VERSION";
    private static final String ENV_MAX_OVERVIEW_ROWS = "XPT_MAX_OVERVIEW_ROWS";
    private static final String ENV_WORKERS = "XPT_WORKERS";
    private static final String ENV_QUEUE_CAPACITY = "XPT_QUEUE_CAPACITY";
    private static final String ENV_AUTO_LOAD = "XPT_AUTO_LOAD";
    private static final String ENV_WITH_LINKS = "XPT_WITH_LINKS";

    public static final String DEFAULT_STORAGE_SERVICE = "json-file";
    public static final String DEFAULT_STORAGE_LOCATION = "trajectories";
    /** Format version written into every stored trajectory and expected when loading. */
    public static final String DEFAULT_FORMAT_VERSION = "1.0";
    public static final int DEFAULT_MAX_OVERVIEW_ROWS = 1000;
    public static final int DEFAULT_QUEUE_CAPACITY = 1000;

    private final String storageService;
    private final String storageLocation;
    private final String formatVersion;
    private final int maxOverviewRows;
    private final int workerCount;
    private final int queueCapacity;
    private final boolean autoLoad;
    private final boolean withLinks;

    private XptConfig(Builder b) {
        this.storageService = b.storageService;
        this.storageLocation = b.storageLocation;
        this.formatVersion = b.formatVersion;
        this.maxOverviewRows = requirePositive(b.maxOverviewRows, "maxOverviewRows");
        this.workerCount = requirePositive(b.workerCount, "workerCount");
        this.queueCapacity = requirePositive(b.queueCapacity, "queueCapacity");
        this.autoLoad = b.autoLoad;
        this.withLinks = b.withLinks;
    }

    /** Reads configuration from {@link System#getenv(String)}; unset variables fall back to defaults. */
    public static XptConfig fromEnvironment() {
        return from(System::getenv);
    }

    /** Same as {@link #fromEnvironment()} but reads from the given map (tests, embedded use). */
    public static XptConfig fromMap(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        return from(values::get);
    }

    private static XptConfig from(Function<String, String> env) {
        Builder b = builder();
        String service = env.apply(ENV_STORAGE_SERVICE);
        if (service != null && !service.isBlank()) b.storageService(service.trim());
        String location = env.apply(ENV_STORAGE_LOCATION);
        if (location != null && !location.isBlank()) b.storageLocation(location.trim());
        String version = env.apply(ENV_FORMAT_VERSION);
        if (version != null && !version.isBlank()) b.formatVersion(version.trim());
        b.maxOverviewRows(parseInt(env.apply(ENV_MAX_OVERVIEW_ROWS), DEFAULT_MAX_OVERVIEW_ROWS));
        b.workerCount(parseInt(env.apply(ENV_WORKERS), defaultWorkerCount()));
        b.queueCapacity(parseInt(env.apply(ENV_QUEUE_CAPACITY), DEFAULT_QUEUE_CAPACITY));
        b.autoLoad(parseBoolean(env.apply(ENV_AUTO_LOAD), false));
        b.withLinks(parseBoolean(env.apply(ENV_WITH_LINKS), true));
        return b.build();
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int defaultWorkerCount() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }

    /** Name of the storage backend service registered in the storage service registry. */
    public String getStorageService() {
        return storageService;
    }

    /** Backend location (directory for the JSON file backend, store key for the in-memory one). */
    public String getStorageLocation() {
        return storageLocation;
    }

    public String getFormatVersion() {
        return formatVersion;
    }

    /** Maximum number of rows per overview table; entries past the cap are stored but not indexed. */
    public int getMaxOverviewRows() {
        return maxOverviewRows;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    /** Capacity of the write queue; submitters block when it is full. */
    public int getQueueCapacity() {
        return queueCapacity;
    }

    public boolean isAutoLoad() {
        return autoLoad;
    }

    public boolean isWithLinks() {
        return withLinks;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String storageService = DEFAULT_STORAGE_SERVICE;
        private String storageLocation = DEFAULT_STORAGE_LOCATION;
        private String formatVersion = DEFAULT_FORMAT_VERSION;
        private int maxOverviewRows = DEFAULT_MAX_OVERVIEW_ROWS;
        private int workerCount = defaultWorkerCount();
        private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
        private boolean autoLoad;
        private boolean withLinks = true;

        public Builder storageService(String storageService) {
            this.storageService = Objects.requireNonNull(storageService, "storageService");
            return this;
        }

        public Builder storageLocation(String storageLocation) {
            this.storageLocation = Objects.requireNonNull(storageLocation, "storageLocation");
            return this;
        }

        public Builder formatVersion(String formatVersion) {
            this.formatVersion = Objects.requireNonNull(formatVersion, "formatVersion");
            return this;
        }

        public Builder maxOverviewRows(int maxOverviewRows) {
            this.maxOverviewRows = maxOverviewRows;
            return this;
        }

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder autoLoad(boolean autoLoad) {
            this.autoLoad = autoLoad;
            return this;
        }

        public Builder withLinks(boolean withLinks) {
            this.withLinks = withLinks;
            return this;
        }

        public XptConfig build() {
            return new XptConfig(this);
        }
    }
}
