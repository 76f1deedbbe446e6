package com.offlinemap.worker;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.offlinemap.model.MapTile;
import com.offlinemap.storage.LocalTileStorage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TileDownloadWorkerTest {

    @TempDir
    Path dir;

    @Test
    void writesTileAndRecordsPath() throws Exception {
        SimulatedTileServer server = new SimulatedTileServer();
        TileDownloadWorker worker = new TileDownloadWorker(server, new LocalTileStorage(dir.resolve("map_tiles")));
        MapTile tile = new MapTile(12, 3494, 1588, "sim://12/3494/1588");

        assertTrue(worker.download(tile));

        assertEquals(dir.resolve("map_tiles").resolve("12_3494_1588.png").toString(), tile.getPath());
        assertArrayEquals(server.fetch(tile.getUrl()), Files.readAllBytes(Paths.get(tile.getPath())));
    }

    @Test
    void fetchFailureIsReportedAsFalse() {
        SimulatedTileServer server = new SimulatedTileServer(url -> true, 0);
        TileDownloadWorker worker = new TileDownloadWorker(server, new LocalTileStorage(dir));
        MapTile tile = new MapTile(12, 1, 1, "sim://12/1/1");

        assertFalse(worker.download(tile));

        assertNull(tile.getPath());
        assertEquals(100.0, server.getFailureRate());
        assertTrue(worker.getStats().contains("failed=1"));
    }
}
