package com.offlinemap.storage;

import java.util.Optional;

/**
 * Durable string key-value store (the device's async-storage equivalent).
 *
 * Implementations throw {@link com.offlinemap.exception.StorageException} on I/O failure.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void put(String key, String value);

    void remove(String key);
}
