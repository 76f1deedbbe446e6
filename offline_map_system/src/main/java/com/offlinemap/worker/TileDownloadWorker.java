package com.offlinemap.worker;

import com.offlinemap.model.MapTile;
import com.offlinemap.storage.TileStorage;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads a single tile: fetch its URL, write it to tile storage, record the path.
 *
 * A failure is reported as {@code false} and never thrown; the caller only counts outcomes.
 */
public class TileDownloadWorker {
    private static final Logger LOGGER = LoggerFactory.getLogger(TileDownloadWorker.class);

    private final TileFetcher fetcher;
    private final TileStorage tileStorage;
    private final AtomicLong tilesWritten = new AtomicLong();
    private final AtomicLong tilesFailed = new AtomicLong();

    public TileDownloadWorker(TileFetcher fetcher, TileStorage tileStorage) {
        this.fetcher = fetcher;
        this.tileStorage = tileStorage;
    }

    public boolean download(MapTile tile) {
        try {
            byte[] data = fetcher.fetch(tile.getUrl());
            String path = tileStorage.write(tile, data);
            tile.setPath(path);
            tilesWritten.incrementAndGet();
            return true;
        } catch (IOException | RuntimeException e) {
            tilesFailed.incrementAndGet();
            LOGGER.debug("Tile z={} x={} y={} failed: {}", tile.getZ(), tile.getX(), tile.getY(), e.getMessage());
            return false;
        }
    }

    public String getStats() {
        return String.format("TileDownloadWorker: written=%d, failed=%d", tilesWritten.get(), tilesFailed.get());
    }
}
