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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a {@link Turn}.
 *
 * <p>
 * Each state has a stable wire value used in persisted records. Stored values
 * this build does not recognize decode to {@link #INTERRUPTED}, so a record
 * written by a newer schema is surfaced as stopped rather than silently
 * resumed.
 */
public enum TurnState {

    QUEUED("queued"),
    RECORDING("recording"),
    CAPTURED("captured"),
    TRANSCRIBING("transcribing"),
    TRANSCRIBED_RAW("transcribedRaw"),
    REDACTING("redacting"),
    READY("ready"),
    READY_PARTIAL("readyPartial"),
    INTERRUPTED("interrupted"),
    FAILED("failed");

    public static final TurnState UNRECOGNIZED_FALLBACK = INTERRUPTED;

    private final String wire;

    TurnState(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String getWire() {
        return wire;
    }

    public boolean isTerminal() {
        return this == READY || this == READY_PARTIAL || this == INTERRUPTED || this == FAILED;
    }

    public boolean isFailure() {
        return this == FAILED;
    }

    @JsonCreator
    public static TurnState fromWire(String value) {
        if (value == null || value.isBlank()) {
            return UNRECOGNIZED_FALLBACK;
        }
        String trimmed = value.trim();
        for (TurnState state : values()) {
            if (state.wire.equals(trimmed) || state.name().equalsIgnoreCase(trimmed)) {
                return state;
            }
        }
        return UNRECOGNIZED_FALLBACK;
    }
}
