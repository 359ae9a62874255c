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
 * Which engine produced a Turn's reflection output. {@link #NONE} marks local
 * fallback content.
 */
public enum ReflectProvider {

    NONE("none"),
    ON_DEVICE("onDevice"),
    CLOUD_TAP("cloudTap");

    private final String wire;

    ReflectProvider(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String getWire() {
        return wire;
    }

    @JsonCreator
    public static ReflectProvider fromWire(String value) {
        for (ReflectProvider provider : values()) {
            if (provider.wire.equals(value)) {
                return provider;
            }
        }
        return NONE;
    }
}
