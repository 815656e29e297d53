package com.researchintel.deepresearch.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * On-disk envelope. {@code key} is repeated inside the file so a read can detect a blob that
 * does not belong to the requested key.
 */
public record CacheEntry(String key, Instant cachedAt, JsonNode blob) {
}
