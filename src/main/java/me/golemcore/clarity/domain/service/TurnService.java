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
import me.golemcore.clarity.domain.exception.TurnNotFoundException;
import me.golemcore.clarity.domain.exception.TurnValidationException;
import me.golemcore.clarity.domain.model.CaptureContext;
import me.golemcore.clarity.domain.model.RedactionRecord;
import me.golemcore.clarity.domain.model.RedactionResult;
import me.golemcore.clarity.domain.model.ReflectProvider;
import me.golemcore.clarity.domain.model.ReflectTool;
import me.golemcore.clarity.domain.model.ToolOutput;
import me.golemcore.clarity.domain.model.TranscriptionProvider;
import me.golemcore.clarity.domain.model.Turn;
import me.golemcore.clarity.domain.model.TurnCompletedEvent;
import me.golemcore.clarity.domain.model.TurnError;
import me.golemcore.clarity.domain.model.TurnSource;
import me.golemcore.clarity.domain.model.TurnState;
import me.golemcore.clarity.infrastructure.event.SpringEventBus;
import me.golemcore.clarity.port.outbound.AudioFilePort;
import me.golemcore.clarity.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Owns every Turn end to end: creation, state transitions, transcript and
 * redaction bookkeeping, error capture and deletion.
 *
 * <p>
 * All mutations of one Turn are serialized through a per-id lock. A mutation
 * works on a copy of the cached record, persists the copy with an atomic
 * write, and only then swaps it into the cache, so a storage failure leaves
 * both disk and memory at the previous version.
 *
 * <p>
 * Transitions are deliberately permissive: the service does not reject a
 * transition that skips pipeline states (e.g. {@code markReady} on a Turn that
 * never reached {@code transcribing}), so retried or duplicated transcription
 * callbacks are tolerated. A completion event is published only when a Turn
 * enters {@code ready}, never for a repeated {@code markReady}. Any
 * transition other than {@code failed} clears the stored error. Callers own
 * pipeline ordering and resumption of in-flight Turns; there is no background
 * scheduler here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TurnService {

    static final String TURNS_DIR = "turns";
    static final String REDACTIONS_DIR = "redactions";
    private static final String JSON_EXTENSION = ".json";
    private static final String JSONL_EXTENSION = ".jsonl";

    private final StoragePort storagePort;
    private final AudioFilePort audioFilePort;
    private final RedactionEngine redactionEngine;
    private final WorkingSnapshotBuilder snapshotBuilder;
    private final SpringEventBus eventBus;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, Turn> turns = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private volatile boolean loaded;

    // ==================== Creation ====================

    /**
     * Allocate a new captured Turn in {@link TurnState#QUEUED}.
     */
    public String createCapture(String audioPath, Instant recordedAt, CaptureContext context) {
        return createCapture(audioPath, 0L, recordedAt, context);
    }

    public String createCapture(String audioPath, long audioBytes, Instant recordedAt, CaptureContext context) {
        if (audioBytes > 0 && (audioPath == null || audioPath.isBlank())) {
            throw new TurnValidationException("Audio bytes recorded without an audio path");
        }
        ensureLoaded();

        Turn turn = Turn.builder()
                .id(UUID.randomUUID().toString())
                .source(TurnSource.CAPTURED)
                .recordedAt(recordedAt != null ? recordedAt : clock.instant())
                .captureContext(context != null ? context : CaptureContext.UNKNOWN)
                .audioPath(audioPath)
                .audioBytes(Math.max(0L, audioBytes))
                .state(TurnState.QUEUED)
                .build();

        persist(turn);
        turns.put(turn.getId(), turn);
        log.info("[Turn] Created capture turn: {} (context: {})", turn.getId(), turn.getCaptureContext().getWire());
        return turn.getId();
    }

    /**
     * Create a Turn directly in {@link TurnState#READY} from text that is
     * already redacted. No raw transcript is stored.
     *
     * @throws TurnValidationException
     *             if the text is blank or whitespace-only; nothing is persisted
     */
    public String createTextImport(String redactedText, Instant recordedAt, CaptureContext context) {
        return createTextImport(redactedText, recordedAt, context, null);
    }

    public String createTextImport(String redactedText, Instant recordedAt, CaptureContext context,
            String autoTitle) {
        if (redactedText == null || redactedText.isBlank()) {
            throw new TurnValidationException("Imported text must not be blank");
        }
        ensureLoaded();

        Instant now = clock.instant();
        Instant recorded = recordedAt != null ? recordedAt : now;
        Turn turn = Turn.builder()
                .id(UUID.randomUUID().toString())
                .source(TurnSource.IMPORTED_TEXT)
                .recordedAt(recorded)
                .endedAt(recorded)
                .durationSeconds(0)
                .captureContext(context != null ? context : CaptureContext.UNKNOWN)
                .title(autoTitle != null && !autoTitle.isBlank() ? autoTitle.trim() : Turn.PLACEHOLDER_TITLE)
                .transcriptRaw(null)
                .transcriptRedactedActive(redactedText)
                .redactionTimestamp(recorded)
                .redactionInputHash(ContentFingerprint.fnv1a64(redactedText))
                .workingSnapshot(snapshotBuilder.build(redactedText, now))
                .state(TurnState.READY)
                .learningSnapshotJson(Turn.EMPTY_LEARNING_SNAPSHOT)
                .processingStartedAt(now)
                .processingFinishedAt(now)
                .build();

        persist(turn);
        turns.put(turn.getId(), turn);
        log.info("[Turn] Created text import turn: {}", turn.getId());
        eventBus.publish(new TurnCompletedEvent(turn.getId(), turn.getSource(), now));
        return turn.getId();
    }

    // ==================== Pipeline transitions ====================

    public Turn markRecording(String id) {
        return mutate(id, "recording", turn -> turn.setState(TurnState.RECORDING));
    }

    public Turn markCaptured(String id, Instant endedAt, long audioBytes) {
        return mutate(id, "captured", turn -> {
            if (audioBytes > 0 && (turn.getAudioPath() == null || turn.getAudioPath().isBlank())) {
                throw new TurnValidationException("Audio bytes recorded without an audio path");
            }
            if (endedAt != null) {
                turn.setEndedAt(endedAt);
                turn.setDurationSeconds(durationSeconds(turn.getRecordedAt(), endedAt));
            }
            long bytes = audioBytes > 0 ? audioBytes : measureAudio(turn.getAudioPath());
            if (bytes > 0) {
                turn.setAudioBytes(bytes);
            }
            turn.setState(TurnState.CAPTURED);
        });
    }

    public Turn markTranscribing(String id, TranscriptionProvider provider, String locale) {
        return mutate(id, "transcribing", turn -> {
            if (provider != null) {
                turn.setTranscriptionProvider(provider);
            }
            if (locale != null && !locale.isBlank()) {
                turn.setTranscriptionLocale(locale);
            }
            if (turn.getProcessingStartedAt() == null) {
                turn.setProcessingStartedAt(clock.instant());
            }
            turn.setState(TurnState.TRANSCRIBING);
        });
    }

    /**
     * Raw transcript text has arrived and is about to be redacted.
     */
    public Turn markTranscribedRaw(String id) {
        return mutate(id, "transcribedRaw", turn -> turn.setState(TurnState.TRANSCRIBED_RAW));
    }

    public Turn markRedacting(String id) {
        return mutate(id, "redacting", turn -> turn.setState(TurnState.REDACTING));
    }

    /**
     * Redact {@code rawText} for the Turn and append a provenance record.
     *
     * <p>
     * When the Turn's stored input hash equals the new one, the dictionary
     * fingerprint matches the latest record and {@code version} does not
     * exceed the stored version, nothing is written and the latest record is
     * returned.
     */
    public RedactionRecord applyRedaction(String id, String rawText, List<String> dictionary,
            String dictionaryFingerprint, int version) {
        ensureLoaded();
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            Turn current = requireCached(id);
            RedactionResult result = redactionEngine.redact(rawText, dictionary);

            Optional<RedactionRecord> latest = latestRecord(redactionHistoryUnlocked(id));
            if (latest.isPresent()
                    && result.inputHash().equals(current.getRedactionInputHash())
                    && current.getTranscriptRedactedActive() != null
                    && latest.get().dictionaryFingerprint() != null
                    && latest.get().dictionaryFingerprint().equals(dictionaryFingerprint)
                    && version <= current.getRedactionVersion()) {
                log.debug("[Turn] Redaction unchanged for {}, skipping", id);
                return latest.get();
            }

            Instant now = clock.instant();
            int effectiveVersion = Math.max(current.getRedactionVersion(), version);
            RedactionRecord record = new RedactionRecord(id, effectiveVersion, now, result.inputHash(),
                    dictionaryFingerprint, result.redactedText());
            appendRecord(record);

            Turn updated = current.copy();
            updated.setTranscriptRedactedActive(result.redactedText());
            updated.setRedactionVersion(effectiveVersion);
            updated.setRedactionTimestamp(now);
            updated.setRedactionInputHash(result.inputHash());
            updated.setWorkingSnapshot(snapshotBuilder.build(result.redactedText(), now));
            commit(updated);
            log.debug("[Turn] Applied redaction v{} to {} (input {})", effectiveVersion, id, result.inputHash());
            return record;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Complete a Turn.
     *
     * @param rawTranscript
     *            stored only when non-null; callers omit it when raw
     *            persistence is disabled
     * @param redactionVersion
     *            merged with the stored version by {@code max}
     * @param autoTitle
     *            applied only while the title is blank or the placeholder
     */
    public Turn markReady(String id, Instant endedAt, String rawTranscript, String redactedTranscript,
            int redactionVersion, Instant redactionTimestamp, String autoTitle) {
        Instant now = clock.instant();
        AtomicBoolean entered = new AtomicBoolean();
        Turn updated = mutate(id, "ready", turn -> {
            entered.set(turn.getState() != TurnState.READY);
            if (endedAt != null) {
                turn.setEndedAt(endedAt);
                turn.setDurationSeconds(durationSeconds(turn.getRecordedAt(), endedAt));
            }
            if (rawTranscript != null) {
                turn.setTranscriptRaw(rawTranscript);
                turn.setRedactionInputHash(ContentFingerprint.fnv1a64(rawTranscript));
            }
            if (redactedTranscript != null) {
                turn.setTranscriptRedactedActive(redactedTranscript);
            } else if (turn.getTranscriptRedactedActive() == null) {
                turn.setTranscriptRedactedActive("");
            }
            turn.setRedactionVersion(Math.max(turn.getRedactionVersion(), redactionVersion));
            turn.setRedactionTimestamp(redactionTimestamp != null ? redactionTimestamp : now);
            if (autoTitle != null && !autoTitle.isBlank() && turn.isTitleAutoFillable()) {
                turn.setTitle(autoTitle.trim());
            }
            if (turn.getProcessingStartedAt() == null) {
                turn.setProcessingStartedAt(now);
            }
            turn.setWorkingSnapshot(snapshotBuilder.build(turn.getTranscriptRedactedActive(), now));
            turn.setProcessingFinishedAt(now);
            turn.setState(TurnState.READY);
        });
        if (entered.get()) {
            eventBus.publish(new TurnCompletedEvent(id, updated.getSource(), now));
        } else {
            log.debug("[Turn] {} was already ready, no completion published", id);
        }
        return updated;
    }

    public Turn markReadyPartial(String id, String reason) {
        Turn updated = mutate(id, "readyPartial", turn -> {
            if (turn.getTranscriptRedactedActive() == null) {
                turn.setTranscriptRedactedActive("");
            }
            turn.setProcessingFinishedAt(clock.instant());
            turn.setState(TurnState.READY_PARTIAL);
        });
        log.info("[Turn] {} finished partially: {}", id, reason);
        return updated;
    }

    /**
     * Stop a Turn the pipeline will not finish. Whatever transcript exists is
     * kept; a missing one becomes empty.
     */
    public Turn markInterrupted(String id) {
        return mutate(id, "interrupted", turn -> {
            if (turn.getTranscriptRedactedActive() == null) {
                turn.setTranscriptRedactedActive("");
            }
            turn.setProcessingFinishedAt(clock.instant());
            turn.setState(TurnState.INTERRUPTED);
        });
    }

    /**
     * Fail a Turn with the default error domain, code and user-facing key.
     * Transcripts already captured are kept.
     */
    public Turn markFailed(String id, String debugMessage) {
        return markFailed(id, TurnError.DEFAULT_DOMAIN, TurnError.DEFAULT_CODE, TurnError.DEFAULT_USER_FACING_KEY,
                debugMessage);
    }

    public Turn markFailed(String id, String domain, int code, String userFacingKey, String debugMessage) {
        TurnError error = TurnError.builder()
                .domain(domain != null && !domain.isBlank() ? domain : TurnError.DEFAULT_DOMAIN)
                .code(code)
                .userFacingKey(userFacingKey != null && !userFacingKey.isBlank()
                        ? userFacingKey
                        : TurnError.DEFAULT_USER_FACING_KEY)
                .debugMessage(debugMessage != null ? debugMessage : "")
                .build();
        Turn updated = mutate(id, "failed", turn -> {
            turn.setError(error);
            turn.setProcessingFinishedAt(clock.instant());
            turn.setState(TurnState.FAILED);
        });
        log.warn("[Turn] {} failed ({}/{}, key: {})", id, error.getDomain(), error.getCode(),
                error.getUserFacingKey());
        return updated;
    }

    // ==================== Metadata ====================

    /**
     * Set a user title. Blank resets to the placeholder, which reopens title
     * auto-fill.
     */
    public Turn rename(String id, String title) {
        return mutate(id, "rename", turn -> turn.setTitle(
                title == null || title.isBlank() ? Turn.PLACEHOLDER_TITLE : title.trim()));
    }

    public Turn recordReflection(String id, ReflectTool tool, String text, String promptVersion,
            ReflectProvider provider, String capsuleSnapshotHash) {
        return mutate(id, "reflection:" + tool.getWire(), turn -> {
            if (turn.getToolOutputs() == null) {
                turn.setToolOutputs(new LinkedHashMap<>());
            }
            turn.getToolOutputs().put(tool.getWire(), ToolOutput.builder()
                    .text(text)
                    .promptVersion(promptVersion)
                    .provider(provider)
                    .updatedAt(clock.instant())
                    .build());
            turn.setReflectProvider(provider);
            if (promptVersion != null) {
                turn.setPromptVersion(promptVersion);
            }
            if (capsuleSnapshotHash != null) {
                turn.setCapsuleSnapshotHash(capsuleSnapshotHash);
            }
        });
    }

    /**
     * Store the opaque continuation token returned by the last talk response.
     */
    public Turn recordTalkContinuation(String id, String responseId, String promptVersion) {
        return mutate(id, "talk", turn -> {
            turn.setTalkLastResponseId(responseId);
            if (promptVersion != null) {
                turn.setPromptVersion(promptVersion);
            }
        });
    }

    public Turn updateLearningSnapshot(String id, String snapshotJson) {
        return mutate(id, "learningSnapshot", turn -> turn.setLearningSnapshotJson(
                snapshotJson == null || snapshotJson.isBlank() ? Turn.EMPTY_LEARNING_SNAPSHOT : snapshotJson));
    }

    /**
     * Claim the Turn for pattern learning. Only the first claim succeeds, so a
     * repeated completion cannot feed the same Turn twice.
     *
     * @return {@code true} if this call made the claim
     */
    public boolean claimLearning(String id) {
        AtomicBoolean claimed = new AtomicBoolean();
        Instant now = clock.instant();
        mutate(id, "learningClaim", turn -> {
            if (turn.getLearnedAt() == null) {
                turn.setLearnedAt(now);
                claimed.set(true);
            }
        });
        return claimed.get();
    }

    // ==================== Queries ====================

    public Optional<Turn> get(String id) {
        ensureLoaded();
        Turn turn = turns.get(id);
        return turn != null ? Optional.of(turn.copy()) : Optional.empty();
    }

    public Turn require(String id) {
        return get(id).orElseThrow(() -> new TurnNotFoundException(id));
    }

    public List<Turn> listNewestFirst() {
        ensureLoaded();
        return turns.values().stream()
                .sorted(Comparator.comparing(Turn::getRecordedAt, Comparator.nullsLast(Comparator.reverseOrder()))
                        .thenComparing(Turn::getId))
                .map(Turn::copy)
                .toList();
    }

    /**
     * Turns still sitting in a non-terminal state, oldest first, for the
     * caller to resume.
     */
    public List<Turn> findInFlight() {
        ensureLoaded();
        return turns.values().stream()
                .filter(turn -> !turn.getState().isTerminal())
                .sorted(Comparator.comparing(Turn::getRecordedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(Turn::getId))
                .map(Turn::copy)
                .toList();
    }

    public List<RedactionRecord> redactionHistory(String id) {
        require(id);
        return redactionHistoryUnlocked(id);
    }

    // ==================== Deletion ====================

    /**
     * Delete a Turn. Audio removal is best-effort and never blocks deletion of
     * the record.
     *
     * @return {@code false} if the id is unknown
     */
    public boolean delete(String id) {
        ensureLoaded();
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            Turn current = turns.get(id);
            if (current == null) {
                return false;
            }

            if (current.getAudioPath() != null && !current.getAudioPath().isBlank()) {
                try {
                    audioFilePort.delete(current.getAudioPath());
                } catch (RuntimeException e) {
                    log.warn("[Turn] Failed to delete audio for {}: {}", id, e.getMessage());
                }
            }

            try {
                storagePort.deleteObject(TURNS_DIR, id + JSON_EXTENSION).join();
                storagePort.deleteObject(REDACTIONS_DIR, id + JSONL_EXTENSION).join();
            } catch (RuntimeException e) {
                throw new StorageException("Failed to delete turn " + id, e);
            }
            turns.remove(id);
            log.info("[Turn] Deleted turn: {}", id);
            return true;
        } finally {
            lock.unlock();
            locks.remove(id, lock);
        }
    }

    // ==================== Internals ====================

    private Turn mutate(String id, String action, Consumer<Turn> mutation) {
        ensureLoaded();
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            Turn updated = requireCached(id).copy();
            mutation.accept(updated);
            if (updated.getState() != TurnState.FAILED) {
                updated.setError(null);
            }
            commit(updated);
            log.debug("[Turn] {} -> {} ({})", id, updated.getState().getWire(), action);
            return updated.copy();
        } finally {
            lock.unlock();
        }
    }

    private Turn requireCached(String id) {
        Turn turn = turns.get(id);
        if (turn == null) {
            throw new TurnNotFoundException(id);
        }
        return turn;
    }

    private void commit(Turn updated) {
        persist(updated);
        turns.put(updated.getId(), updated);
    }

    private ReentrantLock lockFor(String id) {
        if (id == null || id.isBlank()) {
            throw new TurnNotFoundException(String.valueOf(id));
        }
        return locks.computeIfAbsent(id, key -> new ReentrantLock());
    }

    private void persist(Turn turn) {
        try {
            String json = objectMapper.writeValueAsString(turn);
            storagePort.putTextAtomic(TURNS_DIR, turn.getId() + JSON_EXTENSION, json, false).join();
        } catch (JsonProcessingException | RuntimeException e) {
            throw new StorageException("Failed to persist turn " + turn.getId(), e);
        }
    }

    private void appendRecord(RedactionRecord record) {
        try {
            String line = objectMapper.writeValueAsString(record) + "\n";
            storagePort.appendText(REDACTIONS_DIR, record.turnId() + JSONL_EXTENSION, line).join();
        } catch (JsonProcessingException | RuntimeException e) {
            throw new StorageException("Failed to append redaction record for " + record.turnId(), e);
        }
    }

    private List<RedactionRecord> redactionHistoryUnlocked(String id) {
        String content;
        try {
            content = storagePort.getText(REDACTIONS_DIR, id + JSONL_EXTENSION).join();
        } catch (RuntimeException e) {
            throw new StorageException("Failed to read redaction log for " + id, e);
        }
        List<RedactionRecord> records = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return records;
        }
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(objectMapper.readValue(line, RedactionRecord.class));
            } catch (IOException e) {
                log.warn("[Turn] Skipping unreadable redaction record for {}: {}", id, e.getMessage());
            }
        }
        return records;
    }

    private Optional<RedactionRecord> latestRecord(List<RedactionRecord> records) {
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(records.size() - 1));
    }

    private long measureAudio(String audioPath) {
        if (audioPath == null || audioPath.isBlank()) {
            return 0L;
        }
        try {
            return audioFilePort.size(audioPath);
        } catch (RuntimeException e) {
            log.warn("[Turn] Could not read audio size: {}", e.getMessage());
            return 0L;
        }
    }

    private static double durationSeconds(Instant recordedAt, Instant endedAt) {
        if (recordedAt == null || endedAt == null) {
            return 0;
        }
        return Math.max(0, Duration.between(recordedAt, endedAt).toMillis() / 1000.0);
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
            files = storagePort.listObjects(TURNS_DIR, "").join();
        } catch (RuntimeException e) {
            throw new StorageException("Failed to list turns", e);
        }
        if (files == null) {
            return;
        }
        for (String file : files) {
            if (!file.endsWith(JSON_EXTENSION)) {
                continue;
            }
            try {
                String json = storagePort.getText(TURNS_DIR, file).join();
                if (json == null || json.isBlank()) {
                    continue;
                }
                Turn turn = objectMapper.readValue(json, Turn.class);
                if (turn.getId() != null) {
                    turns.put(turn.getId(), turn);
                }
            } catch (IOException | RuntimeException e) { // NOSONAR - one unreadable record must not block the rest
                log.warn("[Turn] Skipping unreadable turn record {}: {}", file, e.getMessage());
            }
        }
        log.info("[Turn] Loaded {} turn(s)", turns.size());
    }
}
