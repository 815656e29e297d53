package com.researchintel.deepresearch.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Keyed blob store. A miss is not an error; callers compute and {@link #put} the result.
 * {@code put} publishes atomically: a concurrent {@code get} sees either the old blob or the new one.
 */
public interface CacheStore {

    void put(String key, JsonNode blob);

    Optional<JsonNode> get(String key);

    /**
     * The stored envelope including its {@code cachedAt} timestamp.
     */
    Optional<CacheEntry> getEntry(String key);

    boolean has(String key);

    void delete(String key);

    List<String> listKeys();

    void clear();
}
