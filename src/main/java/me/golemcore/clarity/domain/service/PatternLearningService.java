package me.golemcore.clarity.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.clarity.domain.exception.StorageException;
import me.golemcore.clarity.domain.model.PatternKind;
import me.golemcore.clarity.domain.model.PatternObservation;
import me.golemcore.clarity.domain.model.PatternStat;
import me.golemcore.clarity.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Decay-scored store of behavioral signals, one row per (kind, key).
 *
 * <p>
 * Decay is lazy: a row stores its score as of {@code lastSeenAt}, and
 * {@link #decayedScore(PatternStat, Instant)} computes the current value as
 * {@code score * 2^(-days / halfLife)}. Stored scores change only inside
 * {@link #observe}, so no scheduler is needed.
 *
 * <p>
 * Updates to one (kind, key) are serialized through
 * {@link ConcurrentHashMap#compute}; the row is persisted inside the compute
 * so a failed write leaves the previous row in place. Distinct keys update
 * independently. Observations share a read lock that {@link #reset()} takes
 * exclusively, so no row written during a reset survives it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatternLearningService {

    static final String LEARNING_DIR = "learning";
    static final String PATTERNS_PREFIX = "patterns";
    static final int MAX_KEY_LENGTH = 96;

    private static final double MILLIS_PER_DAY = 24d * 60 * 60 * 1000;
    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final PatternHalfLifePolicy halfLifePolicy;
    private final ObjectMapper objectMapper;

    private final Map<String, PatternStat> rows = new ConcurrentHashMap<>();
    private final ReadWriteLock resetLock = new ReentrantReadWriteLock();
    private volatile boolean loaded;

    /**
     * Decay the existing row to {@code now}, then add {@code weight}. A
     * non-positive weight never creates a row.
     *
     * @return the updated row, or empty when the observation was ignored
     */
    public Optional<PatternStat> observe(PatternKind kind, String key, double weight, Instant now) {
        if (kind == null || key == null || key.isBlank() || now == null || Double.isNaN(weight)) {
            return Optional.empty();
        }
        String normalizedKey = normalizeKey(key);
        ensureLoaded();

        resetLock.readLock().lock();
        try {
            return upsert(kind, normalizedKey, weight, now);
        } finally {
            resetLock.readLock().unlock();
        }
    }

    private Optional<PatternStat> upsert(PatternKind kind, String normalizedKey, double weight, Instant now) {
        PatternStat result = rows.compute(rowId(kind, normalizedKey), (id, existing) -> {
            double halfLife = halfLifePolicy.halfLifeDays(kind, normalizedKey);
            PatternStat updated;
            if (existing == null) {
                if (weight <= 0) {
                    return null;
                }
                updated = PatternStat.builder()
                        .kind(kind)
                        .key(normalizedKey)
                        .score(weight)
                        .count(1)
                        .firstSeenAt(now)
                        .lastSeenAt(now)
                        .halfLifeDays(halfLife)
                        .build();
            } else {
                double decayed = decay(existing.getScore(), existing.getLastSeenAt(), existing.getHalfLifeDays(),
                        now);
                updated = existing.toBuilder()
                        .score(Math.max(0d, decayed + weight))
                        .count(existing.getCount() + 1)
                        .lastSeenAt(now)
                        .halfLifeDays(halfLife)
                        .build();
            }
            persist(updated);
            return updated;
        });

        if (result == null) {
            log.debug("[Learning] Ignored non-positive observation for new {}:{}", kind.getWire(), normalizedKey);
            return Optional.empty();
        }
        return Optional.of(result.toBuilder().build());
    }

    public Optional<PatternStat> observe(PatternKind kind, String key, Instant now) {
        return observe(kind, key, 1.0, now);
    }

    public void observeAll(List<PatternObservation> observations, Instant now) {
        for (PatternObservation observation : observations) {
            observe(observation.kind(), observation.key(), observation.strength(), now);
        }
        log.debug("[Learning] Applied {} observation(s)", observations.size());
    }

    /**
     * Score of {@code stat} as of {@code now}. Pure; the row is not changed.
     */
    public double decayedScore(PatternStat stat, Instant now) {
        return decay(stat.getScore(), stat.getLastSeenAt(), stat.getHalfLifeDays(), now);
    }

    /**
     * Highest decayed scores first, ties broken by most recent
     * {@code lastSeenAt}, then key.
     *
     * @param kind
     *            filter, or {@code null} for all kinds
     * @return copies whose {@code score} is the decayed score at {@code now}
     */
    public List<PatternStat> topPatterns(PatternKind kind, int limit, Instant now) {
        if (limit <= 0) {
            return List.of();
        }
        ensureLoaded();
        return rows.values().stream()
                .filter(stat -> kind == null || stat.getKind() == kind)
                .map(stat -> stat.toBuilder().score(decayedScore(stat, now)).build())
                .sorted(Comparator.comparingDouble(PatternStat::getScore).reversed()
                        .thenComparing(PatternStat::getLastSeenAt, Comparator.nullsLast(Comparator.reverseOrder()))
                        .thenComparing(PatternStat::getKey))
                .limit(limit)
                .toList();
    }

    /**
     * All rows as stored (scores as of each row's {@code lastSeenAt}).
     */
    public List<PatternStat> all() {
        ensureLoaded();
        return rows.values().stream()
                .map(stat -> stat.toBuilder().build())
                .toList();
    }

    /**
     * Delete every row from memory and storage.
     */
    public void reset() {
        ensureLoaded();
        resetLock.writeLock().lock();
        try {
            List<String> files = storagePort.listObjects(LEARNING_DIR, PATTERNS_PREFIX).join();
            for (String file : files) {
                storagePort.deleteObject(LEARNING_DIR, file).join();
            }
            int cleared = rows.size();
            rows.clear();
            log.info("[Learning] Pattern store reset ({} row(s) cleared)", cleared);
        } catch (RuntimeException e) {
            throw new StorageException("Failed to reset pattern store", e);
        } finally {
            resetLock.writeLock().unlock();
        }
    }

    static double decay(double score, Instant lastSeenAt, double halfLifeDays, Instant now) {
        if (lastSeenAt == null || now == null) {
            return score;
        }
        double deltaDays = Math.max(0d, Duration.between(lastSeenAt, now).toMillis() / MILLIS_PER_DAY);
        double halfLife = Math.max(1d, halfLifeDays);
        return score * Math.pow(0.5, deltaDays / halfLife);
    }

    static String normalizeKey(String key) {
        String trimmed = key.trim();
        return trimmed.length() > MAX_KEY_LENGTH ? trimmed.substring(0, MAX_KEY_LENGTH) : trimmed;
    }

    private static String rowId(PatternKind kind, String key) {
        return kind.getWire() + "|" + key;
    }

    private static String rowPath(PatternKind kind, String key) {
        return PATTERNS_PREFIX + "/" + kind.getWire() + "/" + ContentFingerprint.fnv1a64(key) + JSON_EXTENSION;
    }

    private void persist(PatternStat stat) {
        try {
            String json = objectMapper.writeValueAsString(stat);
            storagePort.putTextAtomic(LEARNING_DIR, rowPath(stat.getKind(), stat.getKey()), json, false).join();
        } catch (JsonProcessingException | RuntimeException e) {
            throw new StorageException("Failed to persist pattern " + stat.getKind().getWire(), e);
        }
    }

    private void ensureLoaded() {
        if (!loaded) {
            synchronized (this) {
                if (!loaded) {
                    loadAll();
                    loaded = true;
                }
            }
        }
    }

    private void loadAll() {
        List<String> files;
        try {
            files = storagePort.listObjects(LEARNING_DIR, PATTERNS_PREFIX).join();
        } catch (RuntimeException e) {
            throw new StorageException("Failed to list pattern rows", e);
        }
        if (files == null) {
            return;
        }
        for (String file : files) {
            if (!file.endsWith(JSON_EXTENSION)) {
                continue;
            }
            try {
                String json = storagePort.getText(LEARNING_DIR, file).join();
                if (json == null || json.isBlank()) {
                    continue;
                }
                PatternStat stat = objectMapper.readValue(json, PatternStat.class);
                if (stat.getKind() != null && stat.getKey() != null) {
                    rows.put(rowId(stat.getKind(), stat.getKey()), stat);
                }
            } catch (IOException | RuntimeException e) { // NOSONAR - skip unreadable rows
                log.warn("[Learning] Skipping unreadable pattern row {}: {}", file, e.getMessage());
            }
        }
        log.debug("[Learning] Loaded {} pattern row(s)", rows.size());
    }
}
