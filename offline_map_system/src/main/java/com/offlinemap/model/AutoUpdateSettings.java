package com.offlinemap.model;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Persisted auto-update preferences. One instance per engine.
 *
 * timeOfDay is "H:MM" or "HH:MM" local time; lastAutoCheck is epoch millis of the last run that passed every gate.
 */
public class AutoUpdateSettings {
    public static final String DEFAULT_TIME_OF_DAY = "02:00";
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("H:mm");

    private boolean enabled;
    private boolean wifiOnly;
    private UpdateInterval updateInterval;
    private String timeOfDay;
    private long lastAutoCheck;

    public AutoUpdateSettings() {
        this.enabled = false;
        this.wifiOnly = true;
        this.updateInterval = UpdateInterval.WEEKLY;
        this.timeOfDay = DEFAULT_TIME_OF_DAY;
        this.lastAutoCheck = 0;
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public boolean isWifiOnly() { return wifiOnly; }
    public void setWifiOnly(boolean wifiOnly) { this.wifiOnly = wifiOnly; }
    public UpdateInterval getUpdateInterval() { return updateInterval; }
    public void setUpdateInterval(UpdateInterval updateInterval) { this.updateInterval = updateInterval; }
    public String getTimeOfDay() { return timeOfDay; }
    public long getLastAutoCheck() { return lastAutoCheck; }
    public void setLastAutoCheck(long lastAutoCheck) { this.lastAutoCheck = lastAutoCheck; }

    public void setTimeOfDay(String timeOfDay) {
        parseTime(timeOfDay);
        this.timeOfDay = timeOfDay;
    }

    /** Target minute of the day (0..1439). */
    public int targetMinuteOfDay() {
        LocalTime time = parseTime(timeOfDay);
        return time.getHour() * 60 + time.getMinute();
    }

    public AutoUpdateSettings copy() {
        AutoUpdateSettings copy = new AutoUpdateSettings();
        copy.enabled = enabled;
        copy.wifiOnly = wifiOnly;
        copy.updateInterval = updateInterval;
        copy.timeOfDay = timeOfDay;
        copy.lastAutoCheck = lastAutoCheck;
        return copy;
    }

    private static LocalTime parseTime(String value) {
        try {
            return LocalTime.parse(value, TIME_FORMAT);
        } catch (DateTimeParseException | NullPointerException e) {
            throw new IllegalArgumentException("timeOfDay must be H:MM, got: " + value);
        }
    }

    @Override
    public String toString() {
        return String.format("AutoUpdate[enabled=%s, wifiOnly=%s, interval=%s, at=%s, lastCheck=%d]",
                enabled, wifiOnly, updateInterval, timeOfDay, lastAutoCheck);
    }
}
