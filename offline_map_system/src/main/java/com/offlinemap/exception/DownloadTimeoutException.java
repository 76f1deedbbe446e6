package com.offlinemap.exception;

import java.time.Duration;

public class DownloadTimeoutException extends OfflineMapException {
    private final String regionId;

    public DownloadTimeoutException(String regionId, Duration timeout) {
        super(ErrorCode.TIMEOUT, String.format("Timeout: region %s did not finish within %d minutes",
                regionId, timeout.toMinutes()));
        this.regionId = regionId;
    }

    public String getRegionId() { return regionId; }
}
