package com.offlinemap.model;

/**
 * A caller-defined rectangular area whose tiles are cached for offline use.
 *
 * Size is the caller's estimate in MB and is what quota checks are made against.
 * Progress is only meaningful while DOWNLOADING; lastUpdated is set on entry to AVAILABLE.
 */
public class OfflineRegion {
    private final String id;
    private final String name;
    private final RegionBounds bounds;
    private final double sizeInMB;
    private RegionStatus status;
    private Integer downloadProgress;
    private Long lastUpdated;

    public OfflineRegion(String id, String name, RegionBounds bounds, double sizeInMB) {
        this.id = id;
        this.name = name;
        this.bounds = bounds;
        this.sizeInMB = sizeInMB;
        this.status = RegionStatus.NONE;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public RegionBounds getBounds() { return bounds; }
    public double getSizeInMB() { return sizeInMB; }
    public RegionStatus getStatus() { return status; }
    public void setStatus(RegionStatus status) { this.status = status; }
    public Integer getDownloadProgress() { return downloadProgress; }
    public void setDownloadProgress(Integer downloadProgress) { this.downloadProgress = downloadProgress; }
    public Long getLastUpdated() { return lastUpdated; }
    public void setLastUpdated(Long lastUpdated) { this.lastUpdated = lastUpdated; }

    /** Detached copy handed out to callers so the registry's record is only mutated through it. */
    public OfflineRegion copy() {
        OfflineRegion copy = new OfflineRegion(id, name, bounds, sizeInMB);
        copy.status = status;
        copy.downloadProgress = downloadProgress;
        copy.lastUpdated = lastUpdated;
        return copy;
    }

    /** Fresh request for the same area, as used by a refresh. */
    public OfflineRegion toRequest() {
        return new OfflineRegion(id, name, bounds, sizeInMB);
    }

    @Override
    public String toString() {
        return String.format("Region[%s '%s', %.1fMB, %s%s]", id, name, sizeInMB, status,
                downloadProgress != null && status == RegionStatus.DOWNLOADING ? " " + downloadProgress + "%" : "");
    }
}
