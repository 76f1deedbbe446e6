package com.offlinemap.exception;

public class AlreadyDownloadingException extends OfflineMapException {
    private final String regionId;

    public AlreadyDownloadingException(String regionId) {
        super(ErrorCode.ALREADY_DOWNLOADING, "Region is already downloading: " + regionId);
        this.regionId = regionId;
    }

    public String getRegionId() { return regionId; }
}
