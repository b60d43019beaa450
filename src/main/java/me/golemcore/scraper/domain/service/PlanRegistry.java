package me.golemcore.scraper.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.scraper.crawl.UrlNormalizer;
import me.golemcore.scraper.domain.exception.RegistryIOException;
import me.golemcore.scraper.domain.model.Plan;
import me.golemcore.scraper.domain.model.PlanRegistryEntry;
import me.golemcore.scraper.infrastructure.config.ScraperProperties;
import me.golemcore.scraper.port.outbound.StoragePort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Disk-backed index of saved plans, stored as {@code registry.json} in the
 * plans directory and keyed by URL fingerprint.
 *
 * <p>
 * Reads work on an immutable snapshot and never block. Mutations are
 * serialized by a lock, build a new snapshot, rewrite the whole index
 * atomically and only then publish the snapshot. A missing or corrupt index is
 * logged and treated as empty.
 */
@Service
@Slf4j
public class PlanRegistry {

    static final String INDEX_FILE = "registry.json";

    private static final TypeReference<LinkedHashMap<String, PlanRegistryEntry>> INDEX_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final String directory;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicReference<Map<String, PlanRegistryEntry>> snapshot = new AtomicReference<>();

    public PlanRegistry(StoragePort storagePort, PlanCodec planCodec, Clock clock, ScraperProperties properties) {
        this.storagePort = storagePort;
        this.mapper = planCodec.mapper();
        this.clock = clock;
        this.directory = properties.getPlans().getDirectory();
    }

    /**
     * Finds the plan best matching the URL: exact fingerprint, then the entry
     * on the same host whose path is the longest prefix of the URL's path,
     * then any entry of the same domain.
     */
    public Optional<PlanRegistryEntry> lookup(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        Map<String, PlanRegistryEntry> entries = entries();
        PlanRegistryEntry exact = entries.get(Plan.fingerprintOf(url));
        if (exact != null) {
            return Optional.of(exact);
        }

        String authority = UrlNormalizer.authority(url);
        String path = UrlNormalizer.path(url);
        PlanRegistryEntry best = null;
        int bestLength = -1;
        for (PlanRegistryEntry entry : entries.values()) {
            if (entry.getUrl() == null || !authority.equals(UrlNormalizer.authority(entry.getUrl()))) {
                continue;
            }
            String entryPath = UrlNormalizer.path(entry.getUrl());
            if (isPathPrefix(entryPath, path) && entryPath.length() > bestLength) {
                best = entry;
                bestLength = entryPath.length();
            }
        }
        if (best != null) {
            return Optional.of(best);
        }

        return entries.values().stream()
                .filter(entry -> authority.equals(entry.getDomain()))
                .findFirst();
    }

    public Optional<PlanRegistryEntry> getByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return entries().values().stream()
                .filter(entry -> name.equals(entry.getName()))
                .findFirst();
    }

    public List<PlanRegistryEntry> listAll() {
        return List.copyOf(entries().values());
    }

    public boolean contains(String fingerprint) {
        return entries().containsKey(fingerprint);
    }

    public PlanRegistryEntry register(Plan plan, String relativePath) {
        PlanRegistryEntry entry = PlanRegistryEntry.of(plan, relativePath);
        mutate(entries -> {
            entries.put(plan.getFingerprint(), entry);
            return true;
        });
        log.info("[PlanRegistry] Registered plan '{}' (fingerprint={})", plan.getName(), plan.getFingerprint());
        return entry;
    }

    /**
     * Records a use of the plan. Unknown fingerprints are ignored with a
     * warning.
     */
    public void touch(String fingerprint) {
        mutate(entries -> {
            PlanRegistryEntry entry = entries.get(fingerprint);
            if (entry == null) {
                log.warn("[PlanRegistry] Cannot touch unknown fingerprint {}", fingerprint);
                return false;
            }
            entries.put(fingerprint, entry.toBuilder()
                    .useCount(entry.getUseCount() + 1)
                    .lastUsedAt(clock.instant())
                    .build());
            return true;
        });
    }

    /**
     * Removes the entry with the given plan name.
     *
     * @return the removed entry, empty if no plan has that name
     */
    public Optional<PlanRegistryEntry> remove(String name) {
        PlanRegistryEntry[] removed = new PlanRegistryEntry[1];
        mutate(entries -> {
            for (Map.Entry<String, PlanRegistryEntry> candidate : entries.entrySet()) {
                if (candidate.getValue().getName().equals(name)) {
                    removed[0] = entries.remove(candidate.getKey());
                    return true;
                }
            }
            return false;
        });
        if (removed[0] != null) {
            log.info("[PlanRegistry] Removed plan '{}'", name);
        }
        return Optional.ofNullable(removed[0]);
    }

    /**
     * Drops the in-memory snapshot so the next read reloads the index.
     */
    public void reload() {
        lock.lock();
        try {
            snapshot.set(null);
        } finally {
            lock.unlock();
        }
    }

    private void mutate(Mutation mutation) {
        lock.lock();
        try {
            Map<String, PlanRegistryEntry> updated = new LinkedHashMap<>(loadedEntries());
            if (!mutation.apply(updated)) {
                return;
            }
            persist(updated);
            snapshot.set(Collections.unmodifiableMap(updated));
        } finally {
            lock.unlock();
        }
    }

    private Map<String, PlanRegistryEntry> entries() {
        Map<String, PlanRegistryEntry> current = snapshot.get();
        if (current != null) {
            return current;
        }
        lock.lock();
        try {
            return loadedEntries();
        } finally {
            lock.unlock();
        }
    }

    private Map<String, PlanRegistryEntry> loadedEntries() {
        Map<String, PlanRegistryEntry> current = snapshot.get();
        if (current == null) {
            current = Collections.unmodifiableMap(readIndex());
            snapshot.set(current);
        }
        return current;
    }

    private Map<String, PlanRegistryEntry> readIndex() {
        try {
            String json = storagePort.getText(directory, INDEX_FILE).join();
            if (json == null || json.isBlank()) {
                return new LinkedHashMap<>();
            }
            Map<String, PlanRegistryEntry> entries = mapper.readValue(json, INDEX_TYPE);
            log.info("[PlanRegistry] Loaded {} plan(s) from index", entries.size());
            return entries != null ? entries : new LinkedHashMap<>();
        } catch (IOException | RuntimeException e) { // NOSONAR - fallback to empty registry
            log.warn("[PlanRegistry] Failed to load plan index, starting empty: {}", e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private void persist(Map<String, PlanRegistryEntry> entries) {
        try {
            String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(entries);
            storagePort.putTextAtomic(directory, INDEX_FILE, json, true).join();
        } catch (IOException | RuntimeException e) {
            throw new RegistryIOException("Failed to persist plan index", e);
        }
    }

    private static boolean isPathPrefix(String prefix, String path) {
        if (prefix.isEmpty()) {
            return true;
        }
        return path.equals(prefix) || path.startsWith(prefix + "/");
    }

    @FunctionalInterface
    private interface Mutation {
        boolean apply(Map<String, PlanRegistryEntry> entries);
    }
}
