package com.researchintel.deepresearch.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link CacheStore} keeping one JSON file per key.
 *
 * File layout: {@code {cacheDir}/{url-encoded key}.json} holding a {@link CacheEntry}.
 * Writes go to a temp file in the same directory and are renamed into place.
 * An unreadable entry, or one whose embedded key differs, is a miss for every read operation.
 */
@Slf4j
public class FileCacheStore implements CacheStore {

    private static final String SUFFIX = ".json";

    private final Path cacheDir;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FileCacheStore(Path cacheDir, ObjectMapper objectMapper, Clock clock) {
        this.cacheDir = cacheDir;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void put(String key, JsonNode blob) {
        ensureDirectory();
        Path target = pathFor(key);
        Path temp = null;
        try {
            temp = Files.createTempFile(cacheDir, ".put-", ".tmp");
            objectMapper.writeValue(temp.toFile(), new CacheEntry(key, clock.instant(), blob));
            publish(temp, target);
            log.debug("Cached {} -> {}", key, target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new UncheckedIOException("Cache write failed for key " + key, e);
        }
    }

    @Override
    public Optional<JsonNode> get(String key) {
        return getEntry(key).map(CacheEntry::blob);
    }

    @Override
    public Optional<CacheEntry> getEntry(String key) {
        Path path = pathFor(key);
        if (!Files.exists(path)) {
            return Optional.empty();
        }

        CacheEntry entry;
        try {
            entry = objectMapper.readValue(path.toFile(), CacheEntry.class);
        } catch (IOException e) {
            log.warn("Unreadable cache entry {} treated as a miss: {}", path, e.getMessage());
            return Optional.empty();
        }

        if (entry == null || !key.equals(entry.key())) {
            log.warn("Cache entry {} belongs to key {}, expected {}; treated as a miss",
                    path, entry == null ? null : entry.key(), key);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public boolean has(String key) {
        return getEntry(key).isPresent();
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(pathFor(key));
        } catch (IOException e) {
            throw new UncheckedIOException("Cache delete failed for key " + key, e);
        }
    }

    @Override
    public List<String> listKeys() {
        List<String> keys = new ArrayList<>();
        if (!Files.isDirectory(cacheDir)) return keys;

        try (DirectoryStream<Path> files = Files.newDirectoryStream(cacheDir, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                keys.add(URLDecoder.decode(name.substring(0, name.length() - SUFFIX.length()), StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list cache directory " + cacheDir, e);
        }
        keys.sort(null);
        return keys;
    }

    @Override
    public void clear() {
        for (String key : listKeys()) {
            delete(key);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Path pathFor(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Cache key must not be empty");
        }
        return cacheDir.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + SUFFIX);
    }

    private void publish(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void ensureDirectory() {
        try {
            Files.createDirectories(cacheDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create cache directory: " + cacheDir, e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp cache file {}: {}", temp, e.getMessage());
        }
    }
}
