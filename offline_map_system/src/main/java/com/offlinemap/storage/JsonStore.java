package com.offlinemap.storage;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.offlinemap.exception.ErrorCode;
import com.offlinemap.exception.StorageException;
import java.lang.reflect.Type;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed JSON view over a {@link KeyValueStore}.
 *
 * Storage and parse failures stop here: they are logged, reads come back empty and
 * writes return false. Corrupt JSON counts as absent data.
 */
public class JsonStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonStore.class);

    private final KeyValueStore store;
    private final Gson gson;

    public JsonStore(KeyValueStore store) {
        this.store = store;
        this.gson = new GsonBuilder().create();
    }

    public <T> Optional<T> read(String key, Type type) {
        try {
            Optional<String> raw = store.get(key);
            if (raw.isEmpty()) {
                return Optional.empty();
            }
            T value = gson.fromJson(raw.get(), type);
            return Optional.ofNullable(value);
        } catch (JsonParseException e) {
            LOGGER.error("Corrupt data under '{}' [{}]: {}", key, ErrorCode.PARSE_ERROR, e.getMessage());
            return Optional.empty();
        } catch (StorageException e) {
            LOGGER.error("Could not read '{}': {}", key, e.getDetailedMessage());
            return Optional.empty();
        }
    }

    public boolean write(String key, Object value) {
        return writeRaw(key, toJson(value));
    }

    /** Stores an already serialized document. */
    public boolean writeRaw(String key, String json) {
        try {
            store.put(key, json);
            return true;
        } catch (StorageException e) {
            LOGGER.error("Could not write '{}': {}", key, e.getDetailedMessage());
            return false;
        }
    }

    public boolean remove(String key) {
        try {
            store.remove(key);
            return true;
        } catch (StorageException e) {
            LOGGER.error("Could not remove '{}': {}", key, e.getDetailedMessage());
            return false;
        }
    }

    public String toJson(Object value) {
        return gson.toJson(value);
    }
}
