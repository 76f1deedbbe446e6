package com.offlinemap.listener;

/**
 * Receives region download progress as a whole percentage (0..100).
 * Values for one region never decrease.
 */
@FunctionalInterface
public interface DownloadProgressListener {

    void onProgress(String regionId, int progress);
}
