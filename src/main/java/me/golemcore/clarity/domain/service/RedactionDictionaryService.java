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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.clarity.domain.exception.StorageException;
import me.golemcore.clarity.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The user's redaction token list, stored in redaction/dictionary.json.
 *
 * <p>
 * Tokens are trimmed, deduplicated case-insensitively and kept sorted.
 * Changes are persisted before they become visible; a failed write leaves the
 * previous list in place.
 */
@Service
@Slf4j
public class RedactionDictionaryService {

    static final String DICTIONARY_DIR = "redaction";
    static final String DICTIONARY_FILE = "dictionary.json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private volatile List<String> tokens;

    public RedactionDictionaryService(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    record DictionaryFile(List<String> tokens) {
    }

    /**
     * Current tokens, sorted case-insensitively.
     */
    public List<String> tokens() {
        if (tokens == null) {
            synchronized (this) {
                if (tokens == null) {
                    tokens = load();
                }
            }
        }
        return tokens;
    }

    /**
     * Fingerprint of the normalized token list. Equal fingerprints mean an
     * unchanged dictionary.
     */
    public String fingerprint() {
        return ContentFingerprint.fnv1a64(String.join("\n", tokens()).toLowerCase(Locale.ROOT));
    }

    /**
     * @return {@code false} when the token is blank or already present
     */
    public synchronized boolean add(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        String trimmed = token.trim();
        List<String> current = tokens();
        if (current.stream().anyMatch(existing -> existing.equalsIgnoreCase(trimmed))) {
            return false;
        }
        List<String> updated = new ArrayList<>(current);
        updated.add(trimmed);
        save(updated);
        log.info("[Redaction] Dictionary token added ({} total)", updated.size());
        return true;
    }

    public synchronized boolean remove(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        String trimmed = token.trim();
        List<String> current = tokens();
        List<String> updated = current.stream()
                .filter(existing -> !existing.equalsIgnoreCase(trimmed))
                .toList();
        if (updated.size() == current.size()) {
            return false;
        }
        save(updated);
        log.info("[Redaction] Dictionary token removed ({} total)", updated.size());
        return true;
    }

    public synchronized void wipe() {
        save(List.of());
        log.info("[Redaction] Dictionary wiped");
    }

    private void save(List<String> updated) {
        List<String> normalized = normalize(updated);
        try {
            String json = objectMapper.writeValueAsString(new DictionaryFile(normalized));
            storagePort.putTextAtomic(DICTIONARY_DIR, DICTIONARY_FILE, json, false).join();
        } catch (IOException | RuntimeException e) { // NOSONAR - every persistence failure maps to StorageException
            throw new StorageException("Failed to persist redaction dictionary", e);
        }
        this.tokens = normalized;
    }

    private List<String> load() {
        try {
            String json = storagePort.getText(DICTIONARY_DIR, DICTIONARY_FILE).join();
            if (json != null && !json.isBlank()) {
                DictionaryFile file = objectMapper.readValue(json, DictionaryFile.class);
                List<String> loaded = normalize(file.tokens() != null ? file.tokens() : List.of());
                log.debug("[Redaction] Loaded {} dictionary token(s)", loaded.size());
                return loaded;
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - unreadable dictionary starts empty
            log.warn("[Redaction] Failed to load dictionary, starting empty: {}", e.getMessage());
        }
        return List.of();
    }

    static List<String> normalize(List<String> raw) {
        List<String> normalized = new ArrayList<>();
        for (String token : raw) {
            if (token == null || token.isBlank()) {
                continue;
            }
            String trimmed = token.trim();
            if (normalized.stream().noneMatch(existing -> existing.equalsIgnoreCase(trimmed))) {
                normalized.add(trimmed);
            }
        }
        normalized.sort(String.CASE_INSENSITIVE_ORDER);
        return List.copyOf(normalized);
    }
}
