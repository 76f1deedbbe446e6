package com.offlinemap.storage;

import com.offlinemap.model.MapTile;
import java.io.IOException;

/**
 * Where downloaded tile images live. Paths are {@code <basePath>/<z>_<x>_<y>.png}.
 */
public interface TileStorage {

    /** Creates the base directory if it does not exist. */
    void ensureDirectory() throws IOException;

    /** Writes the tile image and returns its path, which is the same for every write of that tile. */
    String write(MapTile tile, byte[] data) throws IOException;

    /** Deletes the file; a missing file is not an error. */
    void delete(String path) throws IOException;
}
