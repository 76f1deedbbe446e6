package com.offlinemap.storage;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simulates durable key-value storage in memory. Contents are lost with the process.
 */
public class InMemoryKeyValueStore implements KeyValueStore {
    private final Map<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(String key, String value) {
        entries.put(key, value);
    }

    @Override
    public void remove(String key) {
        entries.remove(key);
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public int size() { return entries.size(); }
}
