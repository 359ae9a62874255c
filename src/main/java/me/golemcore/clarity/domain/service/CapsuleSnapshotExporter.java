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
import me.golemcore.clarity.domain.model.Capsule;
import me.golemcore.clarity.domain.model.CapsuleMode;
import me.golemcore.clarity.domain.model.CapsulePreferences;
import me.golemcore.clarity.domain.model.CapsuleSnapshot;
import me.golemcore.clarity.domain.model.CapsuleTendency;
import me.golemcore.clarity.domain.model.LearnedCue;
import me.golemcore.clarity.infrastructure.config.ClarityProperties;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the bounded, privacy-safe {@link CapsuleSnapshot} attached to
 * outbound requests.
 *
 * <p>
 * Never throws: a failure in one part is logged and that part is omitted.
 * Only statements, counts, timestamps and preference values leave the device
 * through this projection.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CapsuleSnapshotExporter {

    static final String OUTPUT_STYLE = "output_style";
    static final String OPTIONS_BEFORE_QUESTIONS = "options_before_questions";
    static final String NO_THERAPY_FRAMING = "no_therapy_framing";
    static final String NO_PERSONA = "no_persona";

    private final ClarityProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Project {@code capsule} for {@code mode}.
     *
     * @return the snapshot, or {@code null} when there is no Capsule
     */
    public CapsuleSnapshot project(Capsule capsule, CapsuleMode mode) {
        if (capsule == null) {
            return null;
        }
        CapsuleSnapshot snapshot = CapsuleSnapshot.builder()
                .version(capsule.getVersion())
                .updatedAt(iso(capsule.getUpdatedAt()))
                .build();

        try {
            Map<String, String> preferences = preferences(capsule.getPreferences());
            snapshot.setPreferences(preferences.isEmpty() ? null : preferences);
        } catch (RuntimeException e) { // NOSONAR - omit preferences, keep the rest
            log.warn("[Capsule] Preference export failed: {}", e.getMessage());
        }

        if (capsule.isLearningEnabled()) {
            try {
                List<LearnedCue> cues = cues(capsule, mode != null ? mode : CapsuleMode.REFLECT);
                snapshot.setLearnedCues(cues.isEmpty() ? null : cues);
            } catch (RuntimeException e) { // NOSONAR - omit cues, keep the rest
                log.warn("[Capsule] Cue export failed: {}", e.getMessage());
            }
        }
        return snapshot;
    }

    /**
     * Fingerprint of the serialized snapshot, or {@code null} when there is
     * nothing to hash.
     */
    public String hash(CapsuleSnapshot snapshot) {
        if (snapshot == null) {
            return null;
        }
        try {
            return ContentFingerprint.fnv1a64(objectMapper.writeValueAsString(snapshot));
        } catch (JsonProcessingException e) {
            log.warn("[Capsule] Could not serialize snapshot for hashing: {}", e.getMessage());
            return null;
        }
    }

    private Map<String, String> preferences(CapsulePreferences prefs) {
        Map<String, String> out = new LinkedHashMap<>();
        if (prefs == null) {
            return out;
        }
        ClarityProperties.ExportProperties limits = properties.getExport();

        String style = truncate(trimToNull(prefs.getOutputStyle()), limits.getPreferenceValueMax());
        if (style != null) {
            out.put(OUTPUT_STYLE, style);
        }
        putBoolean(out, OPTIONS_BEFORE_QUESTIONS, prefs.getOptionsBeforeQuestions());
        putBoolean(out, NO_THERAPY_FRAMING, prefs.getNoTherapyFraming());
        putBoolean(out, NO_PERSONA, prefs.getNoPersona());

        if (prefs.getExtras() == null) {
            return out;
        }
        // The extras cap counts extras only; the four typed entries above come on top.
        int taken = 0;
        for (Map.Entry<String, String> entry : new TreeMap<>(prefs.getExtras()).entrySet()) {
            if (taken >= limits.getExtrasMaxItems()) {
                break;
            }
            taken++;
            String key = truncate(trimToNull(entry.getKey()), limits.getExtrasKeyMax());
            String value = truncate(trimToNull(entry.getValue()), limits.getPreferenceValueMax());
            if (key == null || value == null || value.isBlank() || out.containsKey(key)) {
                continue;
            }
            out.put(key, value);
        }
        return out;
    }

    private List<LearnedCue> cues(Capsule capsule, CapsuleMode mode) {
        ClarityProperties.ExportProperties limits = properties.getExport();
        int cap = mode == CapsuleMode.TALK ? limits.getCueMaxTalk() : limits.getCueMaxReflect();
        List<LearnedCue> cues = new ArrayList<>();
        if (capsule.getLearnedTendencies() == null) {
            return cues;
        }
        for (CapsuleTendency tendency : capsule.getLearnedTendencies()) {
            if (cues.size() >= cap) {
                break;
            }
            if (tendency.isOverridden()) {
                continue;
            }
            LearnedCue cue = cue(tendency, limits);
            if (cue != null) {
                cues.add(cue);
            }
        }
        return cues;
    }

    private static LearnedCue cue(CapsuleTendency tendency, ClarityProperties.ExportProperties limits) {
        String text = truncate(trimToNull(tendency.getStatement()), limits.getCueStatementMax());
        if (text == null) {
            return null;
        }
        return LearnedCue.builder()
                .statement(text)
                .evidenceCount(Math.max(1, Math.min(limits.getCueEvidenceMax(), tendency.getEvidenceCount())))
                .lastSeenAtISO(iso(tendency.getLastSeenAt()))
                .kindRaw(tendency.getKind() != null ? tendency.getKind().getWire() : null)
                .key(tendency.getKey())
                .build();
    }

    private static void putBoolean(Map<String, String> out, String key, Boolean value) {
        if (value != null) {
            out.put(key, value ? "true" : "false");
        }
    }

    private static String iso(Instant instant) {
        return instant != null ? DateTimeFormatter.ISO_INSTANT.format(instant) : null;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max).trim();
    }
}
