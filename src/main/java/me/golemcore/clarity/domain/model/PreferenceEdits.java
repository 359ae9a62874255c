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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Partial update of {@link CapsulePreferences}. A {@code null} field is left
 * untouched; a blank string clears it. In {@link #extras} a blank value
 * removes the key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreferenceEdits {

    private String outputStyle;
    private Boolean optionsBeforeQuestions;
    private Boolean noTherapyFraming;
    private Boolean noPersona;
    private String pseudonym;
    private Map<String, String> extras;
}
