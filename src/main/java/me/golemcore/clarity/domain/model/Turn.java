package me.golemcore.clarity.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One capture unit tracked from raw audio or imported text to a redacted,
 * versioned transcript.
 *
 * <p>
 * Turns are mutated only by {@code TurnService}, which serializes all writes
 * for one id. The raw transcript never leaves the device: outbound requests
 * are built from {@link #transcriptRedactedActive} only.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Turn {

    public static final String PLACEHOLDER_TITLE = "Untitled";
    public static final String EMPTY_LEARNING_SNAPSHOT = "{}";

    private String id;

    @Builder.Default
    private TurnSource source = TurnSource.CAPTURED;

    private Instant recordedAt;
    private Instant endedAt;
    private double durationSeconds;

    @Builder.Default
    private CaptureContext captureContext = CaptureContext.UNKNOWN;

    @Builder.Default
    private String title = PLACEHOLDER_TITLE;

    private String audioPath;
    private long audioBytes;

    // Local only. Never transmitted.
    private String transcriptRaw;
    private String transcriptRedactedActive;

    @Builder.Default
    private int redactionVersion = 1;
    private Instant redactionTimestamp;
    private String redactionInputHash;

    @Builder.Default
    private TurnState state = TurnState.QUEUED;

    @Builder.Default
    private TranscriptionProvider transcriptionProvider = TranscriptionProvider.UNKNOWN;
    private String transcriptionLocale;

    @Builder.Default
    private ReflectProvider reflectProvider = ReflectProvider.NONE;
    private String promptVersion;
    private String toolchainVersion;
    private String capsuleSnapshotHash;

    private Instant processingStartedAt;
    private Instant processingFinishedAt;

    private TurnError error;

    @Builder.Default
    private String learningSnapshotJson = EMPTY_LEARNING_SNAPSHOT;

    // Immutable; shared between copies.
    private WorkingSnapshot workingSnapshot;

    // Set once, when the Turn's observations were fed to the pattern store.
    private Instant learnedAt;

    @Builder.Default
    private Map<String, ToolOutput> toolOutputs = new LinkedHashMap<>();

    private String talkLastResponseId;

    /**
     * Title auto-fill is allowed only while the title is blank or the
     * placeholder. Once a user supplies anything else the gate stays closed.
     */
    @JsonIgnore
    public boolean isTitleAutoFillable() {
        return title == null || title.isBlank() || PLACEHOLDER_TITLE.equalsIgnoreCase(title.trim());
    }

    /**
     * Deep enough copy for copy-on-write mutation: nested mutable parts are
     * duplicated, immutable values are shared.
     */
    public Turn copy() {
        Turn copy = this.toBuilder().build();
        if (error != null) {
            copy.setError(error.toBuilder().build());
        }
        Map<String, ToolOutput> outputs = new LinkedHashMap<>();
        if (toolOutputs != null) {
            toolOutputs.forEach((tool, output) -> outputs.put(tool, ToolOutput.builder()
                    .text(output.getText())
                    .promptVersion(output.getPromptVersion())
                    .provider(output.getProvider())
                    .updatedAt(output.getUpdatedAt())
                    .build()));
        }
        copy.setToolOutputs(outputs);
        return copy;
    }
}
