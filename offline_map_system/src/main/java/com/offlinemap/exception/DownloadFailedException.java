package com.offlinemap.exception;

/**
 * A region download finished with too many failed tiles (or no tiles at all).
 */
public class DownloadFailedException extends OfflineMapException {
    private final String regionId;
    private final int failedTiles;
    private final int totalTiles;

    public DownloadFailedException(String regionId, int failedTiles, int totalTiles) {
        super(ErrorCode.DOWNLOAD_FAILED, String.format("Download failed: %d/%d tiles", failedTiles, totalTiles));
        this.regionId = regionId;
        this.failedTiles = failedTiles;
        this.totalTiles = totalTiles;
    }

    public String getRegionId() { return regionId; }
    public int getFailedTiles() { return failedTiles; }
    public int getTotalTiles() { return totalTiles; }
}
