package com.offlinemap.model;

import com.google.gson.annotations.SerializedName;
import java.time.Duration;
import java.util.Optional;

/**
 * How often the auto-updater may refresh regions. NEVER disables the checker outright.
 */
public enum UpdateInterval {
    @SerializedName("daily") DAILY(Duration.ofDays(1)),
    @SerializedName("weekly") WEEKLY(Duration.ofDays(7)),
    @SerializedName("monthly") MONTHLY(Duration.ofDays(30)),
    @SerializedName("never") NEVER(null);

    private final Duration period;

    UpdateInterval(Duration period) {
        this.period = period;
    }

    public Optional<Duration> getPeriod() {
        return Optional.ofNullable(period);
    }
}
