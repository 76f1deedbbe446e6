package com.offlinemap.exception;

/**
 * Base class for every error the engine reports to its callers.
 * The message is meant to be shown to a user as-is.
 */
public class OfflineMapException extends RuntimeException {
    private final ErrorCode code;

    public OfflineMapException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public OfflineMapException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() { return code; }

    /** Message plus code and cause, for logs. */
    public String getDetailedMessage() {
        String details = String.format("%s [%s]", getMessage(), code);
        if (getCause() != null) {
            details += " Caused by: " + getCause().getMessage();
        }
        return details;
    }
}
