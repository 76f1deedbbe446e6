package com.offlinemap.storage;

import com.offlinemap.model.MapTile;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Tile images on the local file system, flat under one directory.
 */
public class LocalTileStorage implements TileStorage {
    private final Path basePath;

    public LocalTileStorage(Path basePath) {
        this.basePath = basePath;
    }

    @Override
    public void ensureDirectory() throws IOException {
        if (!Files.isDirectory(basePath)) {
            Files.createDirectories(basePath);
        }
    }

    @Override
    public String write(MapTile tile, byte[] data) throws IOException {
        ensureDirectory();
        Path target = basePath.resolve(tile.fileName());
        Files.write(target, data);
        return target.toString();
    }

    @Override
    public void delete(String path) throws IOException {
        Files.deleteIfExists(Paths.get(path));
    }

    public Path getBasePath() { return basePath; }
}
