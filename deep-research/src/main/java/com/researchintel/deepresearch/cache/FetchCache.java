package com.researchintel.deepresearch.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.researchintel.deepresearch.model.FetchedDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fetched documents of a run, cached under the run id.
 * Blob shape: {@code {"runId": ..., "results": [FetchedDocument...]}}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FetchCache {

    private final CacheStore cacheStore;
    private final ObjectMapper objectMapper;

    public Optional<List<FetchedDocument>> load(String runId) {
        Optional<JsonNode> blob = cacheStore.get(runId);
        if (blob.isEmpty()) {
            return Optional.empty();
        }

        JsonNode node = blob.get();
        if (!runId.equals(node.path("runId").asText(null)) || !node.path("results").isArray()) {
            log.warn("Cached fetch results for {} are malformed, ignoring", runId);
            return Optional.empty();
        }

        try {
            List<FetchedDocument> documents = new ArrayList<>();
            for (JsonNode item : node.get("results")) {
                documents.add(objectMapper.treeToValue(item, FetchedDocument.class));
            }
            return Optional.of(documents);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Cached fetch results for {} could not be decoded, ignoring: {}", runId, e.getMessage());
            return Optional.empty();
        }
    }

    public void save(String runId, List<FetchedDocument> documents) {
        ObjectNode blob = objectMapper.createObjectNode();
        blob.put("runId", runId);
        blob.set("results", objectMapper.valueToTree(documents));
        cacheStore.put(runId, blob);
        log.info("Cached {} fetched documents for run {}", documents.size(), runId);
    }

    public boolean has(String runId) {
        return cacheStore.has(runId);
    }
}
