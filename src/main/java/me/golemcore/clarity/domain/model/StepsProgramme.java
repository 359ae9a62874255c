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

/**
 * Content lists served by the gateway's metadata endpoints.
 */
public enum StepsProgramme {

    REFLECT("reflect-steps", "starter_5day"),
    FOCUS("focus-steps", "core"),
    PRACTICE("practice-steps", "core");

    private final String endpoint;
    private final String defaultProgramme;

    StepsProgramme(String endpoint, String defaultProgramme) {
        this.endpoint = endpoint;
        this.defaultProgramme = defaultProgramme;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getDefaultProgramme() {
        return defaultProgramme;
    }
}
