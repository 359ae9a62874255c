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
 * Single-shot reflection tools offered by the remote reasoning service. Each
 * maps to one gateway endpoint.
 */
public enum ReflectTool {

    REFLECT("reflect", "cloudtap-reflect"),
    OPTIONS("options", "cloudtap-options"),
    QUESTIONS("questions", "cloudtap-questions"),
    PERSPECTIVE("perspective", "cloudtap-clarity-perspective");

    private final String wire;
    private final String endpoint;

    ReflectTool(String wire, String endpoint) {
        this.wire = wire;
        this.endpoint = endpoint;
    }

    @JsonValue
    public String getWire() {
        return wire;
    }

    public String getEndpoint() {
        return endpoint;
    }

    @JsonCreator
    public static ReflectTool fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Reflect tool is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ReflectTool tool : values()) {
            if (tool.wire.equals(normalized)) {
                return tool;
            }
        }
        throw new IllegalArgumentException("Unknown reflect tool: " + value);
    }
}
