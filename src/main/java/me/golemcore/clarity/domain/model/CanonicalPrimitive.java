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

import java.util.Locale;

/**
 * Mental movements the working snapshot can name in a Turn. Stored by their
 * lower snake-case wire value; unknown values decode to {@code null} and are
 * dropped.
 */
public enum CanonicalPrimitive {

    ATTACHMENT_TO_OUTCOME,
    AVERSION_RESISTANCE,
    IDENTITY_TIGHTENING,
    CONTROL_SEEKING,
    NARRATIVE_LOOPING,
    INTOLERANCE_OF_UNCERTAINTY,
    SELF_JUDGEMENT,
    REASSURANCE_SEEKING;

    @JsonValue
    public String getWire() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Wire value with underscores replaced by spaces, for user-facing text.
     */
    public String getLabel() {
        return getWire().replace('_', ' ');
    }

    @JsonCreator
    public static CanonicalPrimitive fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (CanonicalPrimitive primitive : values()) {
            if (primitive.name().equals(normalized)) {
                return primitive;
            }
        }
        return null;
    }
}
