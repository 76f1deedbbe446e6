package com.offlinemap.storage;

import com.offlinemap.exception.StorageException;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Key-value store with one file per key under a directory.
 *
 * Keys are URL-encoded into file names, so "@navigation_app/map_data" is a flat file.
 * Writes go to a temp file first and are moved into place.
 */
public class FileKeyValueStore implements KeyValueStore {
    private final Path directory;

    public FileKeyValueStore(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directory " + directory, e);
        }
    }

    @Override
    public synchronized Optional<String> get(String key) {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StorageException("Read failed for key " + key, e);
        }
    }

    @Override
    public synchronized void put(String key, String value) {
        Path file = fileFor(key);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, value, StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Write failed for key " + key, e);
        }
    }

    @Override
    public synchronized void remove(String key) {
        try {
            Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new StorageException("Remove failed for key " + key, e);
        }
    }

    public Path getDirectory() { return directory; }

    private Path fileFor(String key) {
        return directory.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + ".json");
    }
}
