package me.golemcore.clarity.domain.service;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.clarity.domain.model.PatternKind;
import me.golemcore.clarity.infrastructure.config.ClarityProperties;
import org.springframework.stereotype.Component;

/**
 * Half-life, in days, for a pattern row.
 *
 * <ul>
 * <li>ephemeral day-state (release, deadline/time pressure, low
 * energy/sleep): 7</li>
 * <li>sticky comfort and safety triggers: 365; lighter questioning: 180; no
 * fluff: 120</li>
 * <li>seasonal style and workflow preferences: 90</li>
 * <li>everything else: {@code clarity.learning.default-half-life-days}</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class PatternHalfLifePolicy {

    static final double EPHEMERAL_DAYS = 7;
    static final double STICKY_TRIGGER_DAYS = 365;
    static final double QUESTION_LIGHT_DAYS = 180;
    static final double NO_FLUFF_DAYS = 120;
    static final double SEASONAL_DAYS = 90;

    private final ClarityProperties properties;

    public double halfLifeDays(PatternKind kind, String key) {
        String k = key != null ? key : "";
        if (k.startsWith("release:")) {
            return EPHEMERAL_DAYS;
        }
        if (k.contains("deadline") || k.contains("time_pressure")) {
            return EPHEMERAL_DAYS;
        }
        if (k.contains("low_energy") || k.contains("low_sleep")) {
            return EPHEMERAL_DAYS;
        }

        if (kind == PatternKind.CONSTRAINT_TRIGGER || k.startsWith("trigger:")) {
            return STICKY_TRIGGER_DAYS;
        }
        if ("question_light".equals(k)) {
            return QUESTION_LIGHT_DAYS;
        }
        if ("prefers_no_fluff".equals(k)) {
            return NO_FLUFF_DAYS;
        }

        if (kind == PatternKind.STYLE_PREFERENCE || kind == PatternKind.WORKFLOW_PREFERENCE) {
            return SEASONAL_DAYS;
        }
        return properties.getLearning().getDefaultHalfLifeDays();
    }
}
