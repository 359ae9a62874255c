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
 * Physical context a capture was started from.
 */
public enum CaptureContext {

    UNKNOWN, HANDHELD, HANDSFREE, CARPLAY, INTENT;

    @JsonValue
    public String getWire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CaptureContext fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("CAR".equals(normalized)) {
            return CARPLAY;
        }
        for (CaptureContext context : values()) {
            if (context.name().equals(normalized)) {
                return context;
            }
        }
        return UNKNOWN;
    }
}
