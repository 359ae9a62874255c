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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Singleton preference and learning aggregate. Created once with learning
 * enabled, reset to defaults rather than deleted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Capsule {

    @Builder.Default
    private int version = 1;

    @Builder.Default
    private boolean learningEnabled = true;

    private Instant updatedAt;

    @Builder.Default
    private CapsulePreferences preferences = new CapsulePreferences();

    @Builder.Default
    private List<CapsuleTendency> learnedTendencies = new ArrayList<>();

    private Instant learningResetAt;

    public static Capsule empty(Instant now) {
        return Capsule.builder().updatedAt(now).build();
    }

    public Capsule copy() {
        Capsule copy = toBuilder().build();
        copy.setPreferences(preferences != null ? preferences.copy() : new CapsulePreferences());
        List<CapsuleTendency> tendencies = new ArrayList<>();
        if (learnedTendencies != null) {
            learnedTendencies.forEach(tendency -> tendencies.add(tendency.toBuilder().build()));
        }
        copy.setLearnedTendencies(tendencies);
        return copy;
    }
}
