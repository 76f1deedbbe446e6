package com.offlinemap.model;

import com.google.gson.annotations.SerializedName;

/**
 * Lifecycle of an offline region.
 *
 *   NONE ──request──▶ DOWNLOADING ──▶ AVAILABLE ──stale──▶ OUTDATED ──refresh──▶ DOWNLOADING
 *                          │
 *                          └──▶ ERROR (too many failed tiles, or timeout)
 */
public enum RegionStatus {
    @SerializedName("none") NONE,
    @SerializedName("downloading") DOWNLOADING,
    @SerializedName("available") AVAILABLE,
    @SerializedName("outdated") OUTDATED,
    @SerializedName("error") ERROR;

    /** Regions in these states occupy cache space. */
    public boolean occupiesCache() {
        return this == AVAILABLE || this == OUTDATED;
    }
}
