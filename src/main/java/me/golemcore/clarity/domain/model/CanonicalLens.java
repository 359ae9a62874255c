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
 * Gentle perspective a reflection can lean on, chosen from the Turn's
 * dominant primitives.
 */
public enum CanonicalLens {

    NON_IDENTIFICATION,
    IMPERMANENCE,
    LETTING_BE,
    SOFTENING,
    WIDENING,
    COMPASSIONATE_WITNESSING;

    @JsonValue
    public String getWire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CanonicalLens fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (CanonicalLens lens : values()) {
            if (lens.name().equals(normalized)) {
                return lens;
            }
        }
        return null;
    }
}
