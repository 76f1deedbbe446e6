package com.offlinemap.exception;

public class StorageException extends OfflineMapException {

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, message, cause);
    }
}
