/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geopanel.geocode.model.ResolutionOutcome;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Resolution cache backed by a single JSON file keyed by canonical query.
 *
 * <p>The file is read fully when the cache is opened and rewritten atomically
 * (temp file, then move) every {@code flushEvery} writes and on close. A
 * failed intermediate flush is logged and retried at the next flush; the
 * in-memory entries are unaffected.
 */
@Slf4j
public class JsonFileResolutionCache implements ResolutionCache {

    private static final TypeReference<Map<String, ResolutionOutcome>> ENTRIES_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private final int flushEvery;
    private final Map<String, ResolutionOutcome> entries;
    private final ReentrantLock flushLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean();

    private int pendingWrites;

    private JsonFileResolutionCache(Path file, ObjectMapper objectMapper, int flushEvery,
                                    Map<String, ResolutionOutcome> entries) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.flushEvery = flushEvery;
        this.entries = new ConcurrentHashMap<>(entries);
    }

    /**
     * Opens the cache at the given path, creating parent directories as needed.
     * A missing file yields an empty cache.
     *
     * @throws GeocodeCacheException if the file exists but cannot be read or parsed,
     *                               or the directory cannot be created
     */
    public static JsonFileResolutionCache open(Path file, ObjectMapper objectMapper, int flushEvery) {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        if (flushEvery < 0) {
            throw new IllegalArgumentException("flushEvery must not be negative: " + flushEvery);
        }

        Map<String, ResolutionOutcome> loaded;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            loaded = Files.exists(file) && Files.size(file) > 0
                    ? objectMapper.readValue(file.toFile(), ENTRIES_TYPE)
                    : new HashMap<>();
        } catch (IOException | RuntimeException e) {
            throw new GeocodeCacheException("Unable to open geocode cache at " + file, e);
        }
        if (loaded == null) {
            throw new GeocodeCacheException("Geocode cache at " + file + " does not hold a JSON object");
        }
        if (loaded.containsKey(null) || loaded.containsValue(null)) {
            throw new GeocodeCacheException("Geocode cache at " + file + " has an entry without an outcome");
        }

        log.info("Opened geocode cache {} with {} entries", file, loaded.size());
        return new JsonFileResolutionCache(file, objectMapper, flushEvery, loaded);
    }

    @Override
    public Optional<ResolutionOutcome> get(String query) {
        return Optional.ofNullable(entries.get(query));
    }

    @Override
    public void put(String query, ResolutionOutcome outcome) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (closed.get()) {
            throw new IllegalStateException("Geocode cache " + file + " is closed");
        }
        entries.put(query, outcome);

        flushLock.lock();
        try {
            pendingWrites++;
            if (flushEvery > 0 && pendingWrites >= flushEvery) {
                try {
                    writeFile();
                } catch (IOException e) {
                    log.warn("Intermediate flush of geocode cache {} failed, keeping {} pending writes: {}",
                            file, pendingWrites, e.getMessage());
                }
            }
        } finally {
            flushLock.unlock();
        }
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        flushLock.lock();
        try {
            writeFile();
            log.info("Closed geocode cache {} with {} entries", file, entries.size());
        } catch (IOException e) {
            throw new GeocodeCacheException("Unable to flush geocode cache to " + file, e);
        } finally {
            flushLock.unlock();
        }
    }

    // caller holds flushLock
    private void writeFile() throws IOException {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), new TreeMap<>(entries));
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Flushed {} geocode cache entries to {}", entries.size(), file);
        pendingWrites = 0;
    }
}
