package com.offlinemap.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tunables of the offline map engine.
 *
 * Defaults match the production client:
 * - Tiles from OpenStreetMap, zoom 10..18, at most ~1000 tiles per region
 * - 10 tiles in flight per batch, a region fails when more than 20% of its tiles fail
 * - 2000MB cache quota, 10 minute hard timeout per region download
 * - Auto-update checked hourly, regions stale after 30 days, ±30 minutes around the configured time
 *
 * {@link #load()} overlays {@code offlinemap.*} keys from {@code offline-map.properties} on the classpath.
 */
public final class OfflineMapConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(OfflineMapConfig.class);
    private static final String RESOURCE = "offline-map.properties";

    private final String tileUrlTemplate;
    private final Path tileBasePath;
    private final Path storagePath;
    private final int minZoom;
    private final int maxZoom;
    private final int tileBudget;
    private final int batchSize;
    private final double failureThreshold;
    private final double maxCacheSizeMB;
    private final Duration downloadTimeout;
    private final Duration autoUpdateTick;
    private final Duration staleAfter;
    private final int timeWindowMinutes;
    private final String userAgent;
    private final Duration connectTimeout;
    private final Duration readTimeout;

    private OfflineMapConfig(Builder b) {
        if (b.minZoom < 0 || b.maxZoom < b.minZoom) {
            throw new IllegalArgumentException("Invalid zoom range " + b.minZoom + ".." + b.maxZoom);
        }
        if (b.batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive");
        }
        this.tileUrlTemplate = b.tileUrlTemplate;
        this.tileBasePath = b.tileBasePath;
        this.storagePath = b.storagePath;
        this.minZoom = b.minZoom;
        this.maxZoom = b.maxZoom;
        this.tileBudget = b.tileBudget;
        this.batchSize = b.batchSize;
        this.failureThreshold = b.failureThreshold;
        this.maxCacheSizeMB = b.maxCacheSizeMB;
        this.downloadTimeout = b.downloadTimeout;
        this.autoUpdateTick = b.autoUpdateTick;
        this.staleAfter = b.staleAfter;
        this.timeWindowMinutes = b.timeWindowMinutes;
        this.userAgent = b.userAgent;
        this.connectTimeout = b.connectTimeout;
        this.readTimeout = b.readTimeout;
    }

    public static OfflineMapConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Defaults overlaid with the classpath resource, if present. */
    public static OfflineMapConfig load() {
        Properties props = new Properties();
        try (InputStream in = OfflineMapConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                LOGGER.debug("No {} on classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            LOGGER.warn("Could not read {}: {}", RESOURCE, e.getMessage());
        }
        return fromProperties(props);
    }

    public static OfflineMapConfig fromProperties(Properties props) {
        Builder b = builder();
        String v;
        if ((v = props.getProperty("offlinemap.tile.url")) != null) b.tileUrlTemplate(v.trim());
        if ((v = props.getProperty("offlinemap.tile.basePath")) != null) b.tileBasePath(Paths.get(v.trim()));
        if ((v = props.getProperty("offlinemap.storage.path")) != null) b.storagePath(Paths.get(v.trim()));
        if ((v = props.getProperty("offlinemap.zoom.min")) != null) b.minZoom(Integer.parseInt(v.trim()));
        if ((v = props.getProperty("offlinemap.zoom.max")) != null) b.maxZoom(Integer.parseInt(v.trim()));
        if ((v = props.getProperty("offlinemap.tile.budget")) != null) b.tileBudget(Integer.parseInt(v.trim()));
        if ((v = props.getProperty("offlinemap.download.batchSize")) != null) b.batchSize(Integer.parseInt(v.trim()));
        if ((v = props.getProperty("offlinemap.download.failureThreshold")) != null) b.failureThreshold(Double.parseDouble(v.trim()));
        if ((v = props.getProperty("offlinemap.download.timeoutMinutes")) != null) b.downloadTimeout(Duration.ofMinutes(Long.parseLong(v.trim())));
        if ((v = props.getProperty("offlinemap.cache.maxSizeMB")) != null) b.maxCacheSizeMB(Double.parseDouble(v.trim()));
        if ((v = props.getProperty("offlinemap.autoupdate.tickMinutes")) != null) b.autoUpdateTick(Duration.ofMinutes(Long.parseLong(v.trim())));
        if ((v = props.getProperty("offlinemap.autoupdate.staleDays")) != null) b.staleAfter(Duration.ofDays(Long.parseLong(v.trim())));
        if ((v = props.getProperty("offlinemap.autoupdate.windowMinutes")) != null) b.timeWindowMinutes(Integer.parseInt(v.trim()));
        if ((v = props.getProperty("offlinemap.http.userAgent")) != null) b.userAgent(v.trim());
        if ((v = props.getProperty("offlinemap.http.connectTimeoutMs")) != null) b.connectTimeout(Duration.ofMillis(Long.parseLong(v.trim())));
        if ((v = props.getProperty("offlinemap.http.readTimeoutMs")) != null) b.readTimeout(Duration.ofMillis(Long.parseLong(v.trim())));
        return b.build();
    }

    public String getTileUrlTemplate() { return tileUrlTemplate; }
    public Path getTileBasePath() { return tileBasePath; }
    public Path getStoragePath() { return storagePath; }
    public int getMinZoom() { return minZoom; }
    public int getMaxZoom() { return maxZoom; }
    public int getTileBudget() { return tileBudget; }
    public int getBatchSize() { return batchSize; }
    public double getFailureThreshold() { return failureThreshold; }
    public double getMaxCacheSizeMB() { return maxCacheSizeMB; }
    public Duration getDownloadTimeout() { return downloadTimeout; }
    public Duration getAutoUpdateTick() { return autoUpdateTick; }
    public Duration getStaleAfter() { return staleAfter; }
    public int getTimeWindowMinutes() { return timeWindowMinutes; }
    public String getUserAgent() { return userAgent; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public Duration getReadTimeout() { return readTimeout; }

    public static final class Builder {
        private String tileUrlTemplate = "https://tile.openstreetmap.org/{z}/{x}/{y}.png";
        private Path tileBasePath = Paths.get("map_tiles");
        private Path storagePath = Paths.get("offline_map_store");
        private int minZoom = 10;
        private int maxZoom = 18;
        private int tileBudget = 1000;
        private int batchSize = 10;
        private double failureThreshold = 0.20;
        private double maxCacheSizeMB = 2000;
        private Duration downloadTimeout = Duration.ofMinutes(10);
        private Duration autoUpdateTick = Duration.ofHours(1);
        private Duration staleAfter = Duration.ofDays(30);
        private int timeWindowMinutes = 30;
        private String userAgent = "NavigationApp/1.0";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(5);

        private Builder() {}

        public Builder tileUrlTemplate(String v) { this.tileUrlTemplate = v; return this; }
        public Builder tileBasePath(Path v) { this.tileBasePath = v; return this; }
        public Builder storagePath(Path v) { this.storagePath = v; return this; }
        public Builder minZoom(int v) { this.minZoom = v; return this; }
        public Builder maxZoom(int v) { this.maxZoom = v; return this; }
        public Builder tileBudget(int v) { this.tileBudget = v; return this; }
        public Builder batchSize(int v) { this.batchSize = v; return this; }
        public Builder failureThreshold(double v) { this.failureThreshold = v; return this; }
        public Builder maxCacheSizeMB(double v) { this.maxCacheSizeMB = v; return this; }
        public Builder downloadTimeout(Duration v) { this.downloadTimeout = v; return this; }
        public Builder autoUpdateTick(Duration v) { this.autoUpdateTick = v; return this; }
        public Builder staleAfter(Duration v) { this.staleAfter = v; return this; }
        public Builder timeWindowMinutes(int v) { this.timeWindowMinutes = v; return this; }
        public Builder userAgent(String v) { this.userAgent = v; return this; }
        public Builder connectTimeout(Duration v) { this.connectTimeout = v; return this; }
        public Builder readTimeout(Duration v) { this.readTimeout = v; return this; }

        public OfflineMapConfig build() {
            return new OfflineMapConfig(this);
        }
    }
}
