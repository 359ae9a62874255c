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
import me.golemcore.clarity.domain.model.Capsule;
import me.golemcore.clarity.domain.model.CapsulePreferences;
import me.golemcore.clarity.domain.model.CapsuleTendency;
import me.golemcore.clarity.domain.model.PreferenceEdits;
import me.golemcore.clarity.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Owns the single Capsule: explicit preferences, learned tendencies and the
 * learning-enabled gate. Stored in capsule/capsule.json.
 *
 * <p>
 * The Capsule is created lazily on first access with learning enabled.
 * Every edit bumps {@code version} and {@code updatedAt}, is persisted, and
 * only then becomes visible; a failed write leaves the previous Capsule in
 * place and raises {@link StorageException}.
 *
 * <p>
 * Disabling learning only gates export. Pattern statistics and tendencies are
 * kept, so re-enabling restores prior learning at once.
 */
@Service
@Slf4j
public class CapsuleService {

    static final String CAPSULE_DIR = "capsule";
    static final String CAPSULE_FILE = "capsule.json";

    static final int EXTRAS_MAX_STORED = 34;
    static final int EXTRAS_KEY_MAX = 64;
    static final int EXTRAS_VALUE_MAX = 128;
    static final String KEY_OUTPUT_STYLE = "output_style";
    static final String KEY_OPTIONS_BEFORE_QUESTIONS = "options_before_questions";
    static final String KEY_NO_THERAPY_FRAMING = "no_therapy_framing";
    static final String KEY_NO_PERSONA = "no_persona";
    static final String KEY_PSEUDONYM = "pseudonym";

    private static final Pattern EXTRA_KEY = Pattern.compile("^[a-z0-9]+(?:[:_][a-z0-9]+)*$");
    private static final Pattern KEY_SEPARATORS = Pattern.compile("[\\s-]+");
    private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_{2,}");

    private final StoragePort storagePort;
    private final PatternLearningService patternLearningService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private volatile Capsule capsule;

    public CapsuleService(StoragePort storagePort, PatternLearningService patternLearningService,
            ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.patternLearningService = patternLearningService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * A copy of the current Capsule.
     */
    public Capsule getCapsule() {
        return current().copy();
    }

    public Capsule setLearningEnabled(boolean enabled) {
        Capsule updated = mutate(capsuleCopy -> capsuleCopy.setLearningEnabled(enabled));
        log.info("[Capsule] Learning {}", enabled ? "enabled" : "disabled");
        return updated;
    }

    /**
     * Merge explicit preference edits. {@code null} fields are untouched,
     * blank strings clear, blank extras values remove the key.
     */
    public Capsule update(PreferenceEdits edits) {
        if (edits == null) {
            return getCapsule();
        }
        return mutate(capsuleCopy -> {
            CapsulePreferences prefs = capsuleCopy.getPreferences();
            if (edits.getOutputStyle() != null) {
                prefs.setOutputStyle(blankToNull(edits.getOutputStyle()));
            }
            if (edits.getOptionsBeforeQuestions() != null) {
                prefs.setOptionsBeforeQuestions(edits.getOptionsBeforeQuestions());
            }
            if (edits.getNoTherapyFraming() != null) {
                prefs.setNoTherapyFraming(edits.getNoTherapyFraming());
            }
            if (edits.getNoPersona() != null) {
                prefs.setNoPersona(edits.getNoPersona());
            }
            if (edits.getPseudonym() != null) {
                prefs.setPseudonym(blankToNull(edits.getPseudonym()));
            }
            if (edits.getExtras() != null) {
                edits.getExtras().forEach((key, value) -> applyPreference(prefs, key, value));
            }
        });
    }

    /**
     * Set one preference by key. Keys are normalized to snake case; typed keys
     * update the typed fields, anything else is a free-form extra.
     *
     * @return {@code false} when the key or value was rejected (invalid key,
     *         unparseable boolean, or extras at capacity)
     */
    public synchronized boolean setPreference(String key, String value) {
        CapsulePreferences edited = editablePreferences();
        if (!applyPreference(edited, key, value)) {
            log.debug("[Capsule] Preference rejected");
            return false;
        }
        mutate(capsuleCopy -> capsuleCopy.setPreferences(edited));
        return true;
    }

    public boolean removePreference(String key) {
        String normalized = normalizeKey(key);
        if (normalized.isEmpty()) {
            return false;
        }
        mutate(capsuleCopy -> {
            CapsulePreferences prefs = capsuleCopy.getPreferences();
            switch (normalized) {
                case KEY_OUTPUT_STYLE -> prefs.setOutputStyle(null);
                case KEY_OPTIONS_BEFORE_QUESTIONS -> prefs.setOptionsBeforeQuestions(null);
                case KEY_NO_THERAPY_FRAMING -> prefs.setNoTherapyFraming(null);
                case KEY_NO_PERSONA -> prefs.setNoPersona(null);
                case KEY_PSEUDONYM -> prefs.setPseudonym(null);
                default -> {
                    if (prefs.getExtras() != null) {
                        prefs.getExtras().remove(normalized);
                    }
                }
            }
        });
        return true;
    }

    /**
     * Replace the curated learned tendencies. Called by the learning
     * projection.
     */
    public Capsule setLearnedTendencies(List<CapsuleTendency> tendencies) {
        List<CapsuleTendency> copy = new ArrayList<>();
        if (tendencies != null) {
            tendencies.forEach(tendency -> copy.add(tendency.toBuilder().build()));
        }
        return mutate(capsuleCopy -> capsuleCopy.setLearnedTendencies(copy));
    }

    /**
     * Forget learned behavior: reset the pattern store, clear tendencies and
     * stamp {@code learningResetAt}. Explicit preferences are untouched.
     */
    public synchronized Capsule resetLearnedProfile() {
        patternLearningService.reset();
        Capsule updated = mutate(capsuleCopy -> {
            capsuleCopy.setLearnedTendencies(new ArrayList<>());
            capsuleCopy.setLearningResetAt(clock.instant());
        });
        log.info("[Capsule] Learned profile reset");
        return updated;
    }

    /**
     * Back to defaults: version 1, learning enabled, no preferences.
     */
    public synchronized Capsule wipe() {
        Capsule fresh = Capsule.empty(clock.instant());
        save(fresh);
        this.capsule = fresh;
        log.info("[Capsule] Wiped to defaults");
        return fresh.copy();
    }

    // ==================== Internals ====================

    private synchronized Capsule mutate(Consumer<Capsule> mutation) {
        Capsule updated = current().copy();
        if (updated.getPreferences() == null) {
            updated.setPreferences(new CapsulePreferences());
        }
        if (updated.getPreferences().getExtras() == null) {
            updated.getPreferences().setExtras(new TreeMap<>());
        }
        mutation.accept(updated);
        updated.setVersion(updated.getVersion() + 1);
        updated.setUpdatedAt(clock.instant());
        save(updated);
        this.capsule = updated;
        log.debug("[Capsule] Saved version {}", updated.getVersion());
        return updated.copy();
    }

    private CapsulePreferences editablePreferences() {
        CapsulePreferences prefs = current().getPreferences();
        CapsulePreferences edited = prefs != null ? prefs.copy() : new CapsulePreferences();
        if (edited.getExtras() == null) {
            edited.setExtras(new TreeMap<>());
        }
        return edited;
    }

    private boolean applyPreference(CapsulePreferences prefs, String rawKey, String rawValue) {
        String key = normalizeKey(rawKey);
        if (key.isEmpty()) {
            return false;
        }
        String value = rawValue != null ? rawValue.trim() : "";

        switch (key) {
            case KEY_OUTPUT_STYLE:
                prefs.setOutputStyle(value.isEmpty() ? null : value);
                return true;
            case KEY_PSEUDONYM:
                prefs.setPseudonym(value.isEmpty() ? null : value);
                return true;
            case KEY_OPTIONS_BEFORE_QUESTIONS:
            case KEY_NO_THERAPY_FRAMING:
            case KEY_NO_PERSONA:
                return applyBoolean(prefs, key, value);
            default:
                return applyExtra(prefs, key, value);
        }
    }

    private boolean applyBoolean(CapsulePreferences prefs, String key, String value) {
        Boolean parsed = value.isEmpty() ? null : parseBool(value);
        if (!value.isEmpty() && parsed == null) {
            return false;
        }
        if (KEY_OPTIONS_BEFORE_QUESTIONS.equals(key)) {
            prefs.setOptionsBeforeQuestions(parsed);
        } else if (KEY_NO_THERAPY_FRAMING.equals(key)) {
            prefs.setNoTherapyFraming(parsed);
        } else {
            prefs.setNoPersona(parsed);
        }
        return true;
    }

    private boolean applyExtra(CapsulePreferences prefs, String key, String value) {
        if (key.length() > EXTRAS_KEY_MAX || !EXTRA_KEY.matcher(key).matches()) {
            return false;
        }
        Map<String, String> extras = prefs.getExtras();
        if (value.isEmpty()) {
            extras.remove(key);
            return true;
        }
        if (!extras.containsKey(key) && extras.size() >= EXTRAS_MAX_STORED) {
            return false;
        }
        extras.put(key, value.length() > EXTRAS_VALUE_MAX ? value.substring(0, EXTRAS_VALUE_MAX) : value);
        return true;
    }

    /**
     * Lower-case, whitespace and hyphens to underscores, repeated underscores
     * collapsed, leading and trailing underscores trimmed.
     */
    static String normalizeKey(String key) {
        if (key == null) {
            return "";
        }
        String normalized = KEY_SEPARATORS.matcher(key.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
        normalized = REPEATED_UNDERSCORES.matcher(normalized).replaceAll("_");
        int start = 0;
        int end = normalized.length();
        while (start < end && normalized.charAt(start) == '_') {
            start++;
        }
        while (end > start && normalized.charAt(end - 1) == '_') {
            end--;
        }
        return normalized.substring(start, end);
    }

    static Boolean parseBool(String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "y", "on":
                return Boolean.TRUE;
            case "false", "0", "no", "n", "off":
                return Boolean.FALSE;
            default:
                return null;
        }
    }

    private static String blankToNull(String value) {
        return value.isBlank() ? null : value.trim();
    }

    private Capsule current() {
        if (capsule == null) {
            synchronized (this) {
                if (capsule == null) {
                    capsule = loadOrCreate();
                }
            }
        }
        return capsule;
    }

    private void save(Capsule updated) {
        try {
            String json = objectMapper.writeValueAsString(updated);
            storagePort.putTextAtomic(CAPSULE_DIR, CAPSULE_FILE, json, true).join();
        } catch (IOException | RuntimeException e) { // NOSONAR - every persistence failure maps to StorageException
            throw new StorageException("Failed to persist capsule", e);
        }
    }

    private Capsule loadOrCreate() {
        try {
            String json = storagePort.getText(CAPSULE_DIR, CAPSULE_FILE).join();
            if (json != null && !json.isBlank()) {
                Capsule loaded = objectMapper.readValue(json, Capsule.class);
                log.debug("[Capsule] Loaded version {}", loaded.getVersion());
                return loaded;
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - intentionally catch all for fallback
            log.warn("[Capsule] No saved capsule or failed to parse, creating default: {}", e.getMessage());
        }

        Capsule created = Capsule.empty(clock.instant());
        try {
            save(created);
            log.info("[Capsule] Created default capsule");
        } catch (StorageException e) {
            log.error("[Capsule] Failed to save default capsule", e);
        }
        return created;
    }
}
