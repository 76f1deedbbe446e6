package com.offlinemap.exception;

/**
 * Raised before any registry mutation when a download would push the cache past its limit.
 */
public class QuotaExceededException extends OfflineMapException {
    private final double limit;
    private final double current;
    private final double requested;

    public QuotaExceededException(double limit, double current, double requested) {
        super(ErrorCode.QUOTA_EXCEEDED,
                String.format("Quota exceeded: limit %.1fMB, requested %.1fMB (%.1fMB in use)", limit, requested, current));
        this.limit = limit;
        this.current = current;
        this.requested = requested;
    }

    public double getLimit() { return limit; }
    public double getCurrent() { return current; }
    public double getRequested() { return requested; }
}
