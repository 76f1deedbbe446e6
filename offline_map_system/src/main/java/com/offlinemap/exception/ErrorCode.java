package com.offlinemap.exception;

/**
 * Failure categories surfaced by the offline map engine.
 */
public enum ErrorCode {
    ALREADY_DOWNLOADING,
    QUOTA_EXCEEDED,
    TIMEOUT,
    DOWNLOAD_FAILED,
    STORAGE_ERROR,
    PARSE_ERROR
}
