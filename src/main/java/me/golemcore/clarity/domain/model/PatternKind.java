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
 * Closed set of behavioral signal kinds tracked by the pattern store.
 */
public enum PatternKind {

    STYLE_PREFERENCE("style_preference"),
    WORKFLOW_PREFERENCE("workflow_preference"),
    TOPIC_RECURRENCE("topic_recurrence"),
    RESOLUTION_PATTERN("resolution_pattern"),
    CONSTRAINTS_SENSITIVITY("constraints_sensitivity"),
    NARRATIVE_PATTERN("narrative_pattern"),
    LENS_PREFERENCE("lens_preference"),
    CONSTRAINT_TRIGGER("constraint_trigger"),
    CONTRACTION_PATTERN("contraction_pattern"),
    RELEASE_PATTERN("release_pattern");

    private final String wire;

    PatternKind(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String getWire() {
        return wire;
    }

    @JsonCreator
    public static PatternKind fromWire(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (PatternKind kind : values()) {
                if (kind.wire.equals(trimmed) || kind.name().equalsIgnoreCase(trimmed)) {
                    return kind;
                }
            }
        }
        return STYLE_PREFERENCE;
    }
}
