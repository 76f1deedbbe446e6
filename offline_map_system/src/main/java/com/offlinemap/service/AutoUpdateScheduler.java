package com.offlinemap.service;

import com.offlinemap.config.OfflineMapConfig;
import com.offlinemap.exception.ErrorCode;
import com.offlinemap.model.AutoUpdateSettings;
import com.offlinemap.model.NetworkState;
import com.offlinemap.model.OfflineRegion;
import com.offlinemap.network.NetworkMonitor;
import com.offlinemap.storage.JsonStore;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Auto-Update Scheduler - refreshes stale regions in the background.
 *
 * Each tick (hourly while started, plus once on start and on every settings change):
 * 1. disabled                                  → skip
 * 2. wifiOnly and not on connected wifi        → skip
 * 3. interval NEVER, or interval not yet elapsed since lastAutoCheck → skip
 * 4. more than ±window minutes from timeOfDay (wrapping at midnight) → skip
 * 5. lastAutoCheck = now, persisted before any work so overlapping ticks cannot run twice
 * 6. stale AVAILABLE regions → OUTDATED; each is deleted and requested again
 *
 * One region failing to refresh is logged and the rest continue.
 */
public class AutoUpdateScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(AutoUpdateScheduler.class);

    public static final String SETTINGS_KEY = "offline_map_autoupdate";
    private static final int MINUTES_PER_DAY = 24 * 60;

    private final RegionRegistry registry;
    private final JsonStore jsonStore;
    private final NetworkMonitor networkMonitor;
    private final ScheduledExecutorService ticker;
    private final Clock clock;
    private final Duration tick;
    private final Duration staleAfter;
    private final int windowMinutes;
    private final Consumer<NetworkState> networkListener = this::onNetworkChange;

    private volatile AutoUpdateSettings settings;
    private ScheduledFuture<?> scheduledCheck;
    private boolean running;

    public AutoUpdateScheduler(RegionRegistry registry, JsonStore jsonStore, NetworkMonitor networkMonitor,
                               ScheduledExecutorService ticker, OfflineMapConfig config, Clock clock) {
        this.registry = registry;
        this.jsonStore = jsonStore;
        this.networkMonitor = networkMonitor;
        this.ticker = ticker;
        this.clock = clock;
        this.tick = config.getAutoUpdateTick();
        this.staleAfter = config.getStaleAfter();
        this.windowMinutes = config.getTimeWindowMinutes();
        this.settings = loadSettings();
    }

    /** Reads the stored settings. An unreadable timeOfDay falls back to the default, other fields are kept. */
    private AutoUpdateSettings loadSettings() {
        AutoUpdateSettings loaded = jsonStore.<AutoUpdateSettings>read(SETTINGS_KEY, AutoUpdateSettings.class)
                .orElseGet(AutoUpdateSettings::new);
        try {
            loaded.targetMinuteOfDay();
        } catch (IllegalArgumentException e) {
            LOGGER.error("Stored auto-update settings [{}]: {}, using {}",
                    ErrorCode.PARSE_ERROR, e.getMessage(), AutoUpdateSettings.DEFAULT_TIME_OF_DAY);
            loaded.setTimeOfDay(AutoUpdateSettings.DEFAULT_TIME_OF_DAY);
            saveSettings(loaded);
        }
        return loaded;
    }

    private void saveSettings(AutoUpdateSettings toSave) {
        jsonStore.write(SETTINGS_KEY, toSave);
    }

    // ==================== Lifecycle ====================

    public void start() {
        synchronized (this) {
            running = true;
        }
        networkMonitor.addListener(networkListener);
        setupChecker();
    }

    public synchronized void stop() {
        running = false;
        networkMonitor.removeListener(networkListener);
        if (scheduledCheck != null) {
            scheduledCheck.cancel(false);
            scheduledCheck = null;
        }
    }

    /** Re-arms the periodic check. A disabled or stopped updater has no timer at all. */
    private synchronized void setupChecker() {
        if (scheduledCheck != null) {
            scheduledCheck.cancel(false);
            scheduledCheck = null;
        }
        if (!running || !settings.isEnabled()) {
            return;
        }
        scheduledCheck = ticker.scheduleAtFixedRate(this::safeCheck, 0, tick.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isScheduled() {
        synchronized (this) {
            return scheduledCheck != null && !scheduledCheck.isCancelled();
        }
    }

    // ==================== Settings ====================

    public AutoUpdateSettings getSettings() {
        return settings.copy();
    }

    /** Applies a partial change, persists it and restarts the checker. */
    public void updateSettings(Consumer<AutoUpdateSettings> changes) {
        synchronized (this) {
            AutoUpdateSettings updated = settings.copy();
            changes.accept(updated);
            settings = updated;
            saveSettings(updated);
        }
        setupChecker();
    }

    // ==================== Condition check ====================

    private void safeCheck() {
        try {
            checkAutoUpdateCondition();
        } catch (RuntimeException e) {
            LOGGER.error("Auto-update check failed: {}", e.getMessage(), e);
        }
    }

    private void onNetworkChange(NetworkState state) {
        if (state.isConnectedWifi() && settings.isEnabled()) {
            try {
                ticker.execute(this::safeCheck);
            } catch (RuntimeException e) {
                LOGGER.debug("Ticker stopped, network change ignored");
            }
        }
    }

    /**
     * Runs the gates and, if all pass, the refresh. Returns true when a refresh ran.
     */
    public boolean checkAutoUpdateCondition() {
        AutoUpdateSettings current;
        synchronized (this) {
            current = settings;
            if (!current.isEnabled()) {
                return false;
            }

            if (current.isWifiOnly()) {
                NetworkState network = networkMonitor.currentState();
                if (network == null || !network.isConnectedWifi()) {
                    LOGGER.info("Not on wifi, auto-update skipped");
                    return false;
                }
            }

            Optional<Duration> interval = current.getUpdateInterval() == null
                    ? Optional.empty() : current.getUpdateInterval().getPeriod();
            if (interval.isEmpty()) {
                return false;
            }
            long now = clock.millis();
            if (now - current.getLastAutoCheck() < interval.get().toMillis()) {
                return false;
            }

            if (!withinTimeWindow(LocalTime.now(clock), current.targetMinuteOfDay(), windowMinutes)) {
                return false;
            }

            AutoUpdateSettings updated = current.copy();
            updated.setLastAutoCheck(now);
            settings = updated;
            saveSettings(updated);
        }

        runAutoUpdate();
        return true;
    }

    /** Distance between now and the target minute of day, wrapping across midnight. */
    static boolean withinTimeWindow(LocalTime now, int targetMinuteOfDay, int windowMinutes) {
        int currentMinute = now.getHour() * 60 + now.getMinute();
        int diff = Math.abs(currentMinute - targetMinuteOfDay);
        int distance = Math.min(diff, MINUTES_PER_DAY - diff);
        return distance <= windowMinutes;
    }

    // ==================== Refresh ====================

    /** Staleness scan alone: marks old regions OUTDATED and returns their ids. */
    public List<String> checkForUpdates() {
        List<String> outdated = registry.markStaleRegions(staleAfter);
        if (!outdated.isEmpty()) {
            LOGGER.info("{} region(s) outdated: {}", outdated.size(), outdated);
        }
        return outdated;
    }

    /**
     * Deletes and re-downloads every outdated region, one after another.
     * Returns the ids refreshed successfully.
     */
    public List<String> runAutoUpdate() {
        LOGGER.info("Auto-update running");
        List<String> outdated = checkForUpdates();
        List<String> refreshed = new ArrayList<>();
        if (outdated.isEmpty()) {
            LOGGER.info("No regions need updating");
            return refreshed;
        }

        for (String regionId : outdated) {
            Optional<OfflineRegion> found = registry.getRegion(regionId);
            if (found.isEmpty()) {
                continue;
            }
            OfflineRegion region = found.get();
            LOGGER.info("Auto-updating region '{}'", region.getName());
            try {
                registry.deleteRegion(regionId);
                registry.requestDownload(region.toRequest()).get();
                refreshed.add(regionId);
            } catch (ExecutionException | CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                LOGGER.error("Auto-update of region '{}' failed: {}", region.getName(), cause.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.warn("Auto-update interrupted at region '{}'", region.getName());
                break;
            } catch (RuntimeException e) {
                LOGGER.error("Auto-update of region '{}' failed: {}", region.getName(), e.getMessage(), e);
            }
        }
        LOGGER.info("Auto-update finished: {}/{} regions refreshed", refreshed.size(), outdated.size());
        return refreshed;
    }
}
