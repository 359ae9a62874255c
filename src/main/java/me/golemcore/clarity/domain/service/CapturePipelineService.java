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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.clarity.domain.exception.TurnNotFoundException;
import me.golemcore.clarity.domain.exception.TurnValidationException;
import me.golemcore.clarity.domain.model.CaptureContext;
import me.golemcore.clarity.domain.model.RedactionRecord;
import me.golemcore.clarity.domain.model.RedactionResult;
import me.golemcore.clarity.domain.model.TranscriptionProvider;
import me.golemcore.clarity.domain.model.Turn;
import me.golemcore.clarity.infrastructure.config.ClarityProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Locale;

/**
 * Drives a capture through the Turn lifecycle: recording, transcript arrival,
 * redaction, auto-title and completion, or failure.
 *
 * <p>
 * Recorders and transcription engines are external; they call in here with
 * raw text or an error message. Raw transcripts reach {@code markReady} only
 * when {@code clarity.privacy.store-raw-transcript} is enabled.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CapturePipelineService {

    static final int AUTO_TITLE_MAX_WORDS = 7;
    static final int AUTO_TITLE_MAX_CHARS = 56;

    static final String TRANSCRIPTION_ERROR_DOMAIN = "clarity.transcription";
    static final String KEY_SPEECH_DENIED = "speech_denied";
    static final String KEY_SPEECH_UNAVAILABLE = "speech_unavailable";
    static final String KEY_NO_TRANSCRIPT = "no_transcript";
    static final String KEY_UNKNOWN = "unknown";

    private final TurnService turnService;
    private final RedactionDictionaryService dictionaryService;
    private final RedactionEngine redactionEngine;
    private final ClarityProperties properties;
    private final Clock clock;

    public String startCapture(String audioPath, CaptureContext context) {
        String id = turnService.createCapture(audioPath, clock.instant(), context);
        turnService.markRecording(id);
        return id;
    }

    public Turn finishRecording(String id, Instant endedAt, long audioBytes) {
        return turnService.markCaptured(id, endedAt, audioBytes);
    }

    /**
     * Complete a Turn from a transcription result.
     *
     * <p>
     * A blank transcript is ignored and the Turn is returned unchanged. Any
     * failure after that marks the Turn failed and is rethrown.
     */
    public Turn handleTranscriptArrived(String id, String rawTranscript, Instant endedAt,
            TranscriptionProvider provider, String locale) {
        if (rawTranscript == null || rawTranscript.isBlank()) {
            log.debug("[Turn] Ignoring blank transcript for {}", id);
            return turnService.require(id);
        }

        try {
            turnService.markTranscribing(id, provider, locale);
            turnService.markTranscribedRaw(id);
            turnService.markRedacting(id);
            RedactionRecord record = turnService.applyRedaction(id, rawTranscript, dictionaryService.tokens(),
                    dictionaryService.fingerprint(), properties.getRedaction().getVersion());

            boolean storeRaw = properties.getPrivacy().isStoreRawTranscript();
            String titleSource = record.redactedText();
            if ((titleSource == null || titleSource.isBlank()) && storeRaw) {
                titleSource = rawTranscript;
            }

            return turnService.markReady(id,
                    endedAt != null ? endedAt : clock.instant(),
                    storeRaw ? rawTranscript : null,
                    record.redactedText(),
                    record.version(),
                    record.timestamp(),
                    autoTitle(titleSource));
        } catch (TurnNotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            failQuietly(id, e);
            throw e;
        }
    }

    public Turn handleTranscriptArrived(String id, String rawTranscript, Instant endedAt) {
        return handleTranscriptArrived(id, rawTranscript, endedAt, null, null);
    }

    /**
     * Fail a Turn from a transcription engine error, mapping the engine message
     * to a user-facing key.
     */
    public Turn handleTranscriptionError(String id, String message) {
        String key = userFacingKey(message);
        return turnService.markFailed(id, TRANSCRIPTION_ERROR_DOMAIN, codeFor(key), key,
                message != null ? message : "");
    }

    /**
     * Redact pasted or shared text and store it as a ready Turn.
     *
     * @throws TurnValidationException
     *             if the text is blank
     */
    public String importText(String text, CaptureContext context) {
        String trimmed = text != null ? text.trim() : "";
        if (trimmed.isEmpty()) {
            throw new TurnValidationException("Imported text must not be blank");
        }
        RedactionResult result = redactionEngine.redact(trimmed, dictionaryService.tokens());
        return turnService.createTextImport(result.redactedText(), clock.instant(), context,
                autoTitle(result.redactedText()));
    }

    /**
     * First seven words, capped at 56 characters.
     */
    static String autoTitle(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String[] words = text.trim().split("\\s+");
        String title = String.join(" ", Arrays.copyOf(words, Math.min(AUTO_TITLE_MAX_WORDS, words.length)));
        if (title.length() > AUTO_TITLE_MAX_CHARS) {
            title = title.substring(0, AUTO_TITLE_MAX_CHARS).trim();
        }
        return title;
    }

    static String userFacingKey(String message) {
        if (message == null || message.isBlank()) {
            return KEY_UNKNOWN;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("speech not authorised") || lower.contains("speech not authorized")) {
            return KEY_SPEECH_DENIED;
        }
        if (lower.contains("speech recogniser unavailable") || lower.contains("speech recognizer unavailable")) {
            return KEY_SPEECH_UNAVAILABLE;
        }
        if (lower.contains("no transcript captured")) {
            return KEY_NO_TRANSCRIPT;
        }
        return KEY_UNKNOWN;
    }

    private static int codeFor(String key) {
        return switch (key) {
            case KEY_SPEECH_DENIED -> 403;
            case KEY_SPEECH_UNAVAILABLE -> 503;
            case KEY_NO_TRANSCRIPT -> 422;
            default -> 500;
        };
    }

    private void failQuietly(String id, RuntimeException cause) {
        try {
            turnService.markFailed(id, cause.getMessage());
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.warn("[Turn] Could not record failure for {}: {}", id, e.getMessage());
        }
    }
}
