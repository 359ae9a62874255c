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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.clarity.domain.model.Capsule;
import me.golemcore.clarity.domain.model.CapsuleTendency;
import me.golemcore.clarity.domain.model.PatternKind;
import me.golemcore.clarity.domain.model.PatternStat;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Projects pattern statistics into the Capsule's curated learned tendencies.
 *
 * <p>
 * Rows are filtered by reset time and per-kind score thresholds (on decayed
 * scores), sorted into three lanes, capped per lane and globally, and mapped
 * to human statements:
 * <ul>
 * <li>sticky: comfort and safety triggers, sensory noise, lighter
 * questioning</li>
 * <li>seasonal: preferences and patterns that evolve</li>
 * <li>ephemeral: day-state, surfaced only when seen in the last 7 days</li>
 * </ul>
 * The Capsule is written only when the projection differs from what it
 * already holds.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LearningProjectionService {

    static final int STICKY_CAP = 8;
    static final int SEASONAL_CAP = 10;
    static final int EPHEMERAL_CAP = 4;
    static final int GLOBAL_CAP = 24;
    static final int MAX_PER_KIND_WITHIN_LANE = 6;
    static final double EPHEMERAL_RECENCY_DAYS = 7.0;

    private static final Set<String> EXPLICIT_WORKFLOW_KEYS = Set.of("question_light", "question_guided",
            "narrow_first", "explore_space");
    private static final String SUPPRESSED_TRIGGER = "trigger:eye_contact";

    private static final Comparator<PatternStat> BY_SCORE_THEN_RECENCY = Comparator
            .comparingDouble(PatternStat::getScore).reversed()
            .thenComparing(PatternStat::getLastSeenAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(PatternStat::getKey);

    enum Lane {
        STICKY, SEASONAL, EPHEMERAL
    }

    private final PatternLearningService patternLearningService;
    private final CapsuleService capsuleService;

    /**
     * Recompute tendencies as of {@code now} and store them if they changed.
     *
     * @return {@code true} if the Capsule was updated
     */
    public boolean sync(Instant now) {
        Capsule capsule = capsuleService.getCapsule();
        List<CapsuleTendency> projected = project(patternLearningService.all(), capsule, now);
        if (sameProjection(capsule.getLearnedTendencies(), projected)) {
            log.debug("[Learning] Projection unchanged ({} tendencies)", projected.size());
            return false;
        }
        capsuleService.setLearnedTendencies(projected);
        log.info("[Learning] Projected {} learned tendencies", projected.size());
        return true;
    }

    List<CapsuleTendency> project(List<PatternStat> stored, Capsule capsule, Instant now) {
        Instant resetAt = capsule.getLearningResetAt();
        List<PatternStat> rows = stored.stream()
                .filter(stat -> resetAt == null
                        || (stat.getLastSeenAt() != null && stat.getLastSeenAt().isAfter(resetAt)))
                .filter(stat -> !(stat.getKind() == PatternKind.CONSTRAINT_TRIGGER
                        && SUPPRESSED_TRIGGER.equals(stat.getKey())))
                .map(stat -> stat.toBuilder().score(patternLearningService.decayedScore(stat, now)).build())
                .filter(LearningProjectionService::passesThreshold)
                .filter(stat -> lane(stat) != Lane.EPHEMERAL || passesEphemeralGate(stat, now))
                .toList();

        List<PatternStat> sticky = select(rows, Lane.STICKY, STICKY_CAP);
        List<PatternStat> seasonal = select(rows, Lane.SEASONAL, SEASONAL_CAP);
        List<PatternStat> ephemeral = select(rows, Lane.EPHEMERAL, EPHEMERAL_CAP);

        List<PatternStat> combined = new ArrayList<>(sticky);
        combined.addAll(seasonal);
        combined.addAll(ephemeral);
        if (combined.size() > GLOBAL_CAP) {
            combined.sort(BY_SCORE_THEN_RECENCY);
            combined = combined.subList(0, GLOBAL_CAP);
        }

        Set<String> overridden = capsule.getLearnedTendencies() == null ? Set.of()
                : capsule.getLearnedTendencies().stream()
                        .filter(CapsuleTendency::isOverridden)
                        .map(tendency -> identity(tendency.getKind(), tendency.getKey()))
                        .collect(Collectors.toSet());

        return combined.stream()
                .map(stat -> CapsuleTendency.builder()
                        .statement(TendencyStatements.statement(stat.getKind(), stat.getKey()))
                        .evidenceCount(stat.getCount())
                        .firstSeenAt(stat.getFirstSeenAt())
                        .lastSeenAt(stat.getLastSeenAt())
                        .overridden(overridden.contains(identity(stat.getKind(), stat.getKey())))
                        .kind(stat.getKind())
                        .key(stat.getKey())
                        .build())
                .toList();
    }

    static boolean passesThreshold(PatternStat stat) {
        if (stat.getKind() == PatternKind.CONSTRAINTS_SENSITIVITY) {
            return stat.getScore() >= 0.6 && stat.getCount() >= 2;
        }
        if (stat.getKind() == PatternKind.WORKFLOW_PREFERENCE && EXPLICIT_WORKFLOW_KEYS.contains(stat.getKey())) {
            return stat.getScore() >= 0.4 && stat.getCount() >= 2;
        }
        return stat.getScore() >= 0.3;
    }

    static Lane lane(PatternStat stat) {
        PatternKind kind = stat.getKind();
        String key = stat.getKey();
        if (kind == PatternKind.RELEASE_PATTERN) {
            return Lane.EPHEMERAL;
        }
        if (kind == PatternKind.CONSTRAINT_TRIGGER
                && (key.contains("low_sleep") || key.contains("low_energy") || key.contains("deadline_pressure"))) {
            return Lane.EPHEMERAL;
        }
        if (kind == PatternKind.CONSTRAINTS_SENSITIVITY
                && ("time_pressure".equals(key) || "low_energy".equals(key))) {
            return Lane.EPHEMERAL;
        }

        if (kind == PatternKind.CONSTRAINT_TRIGGER) {
            return Lane.STICKY;
        }
        if (kind == PatternKind.CONSTRAINTS_SENSITIVITY && "sensory_noise".equals(key)) {
            return Lane.STICKY;
        }
        if (kind == PatternKind.WORKFLOW_PREFERENCE && "question_light".equals(key)) {
            return Lane.STICKY;
        }
        return Lane.SEASONAL;
    }

    private static boolean passesEphemeralGate(PatternStat stat, Instant now) {
        if (stat.getLastSeenAt() == null) {
            return false;
        }
        double days = Math.max(0d, Duration.between(stat.getLastSeenAt(), now).toMillis() / 86_400_000d);
        if (days > EPHEMERAL_RECENCY_DAYS) {
            return false;
        }
        return switch (stat.getKind()) {
            case RELEASE_PATTERN -> stat.getScore() >= 0.4;
            case CONSTRAINT_TRIGGER -> stat.getScore() >= 0.5 && stat.getCount() >= 2;
            case CONSTRAINTS_SENSITIVITY -> stat.getScore() >= 0.6 && stat.getCount() >= 2;
            default -> stat.getScore() >= 0.5;
        };
    }

    private static List<PatternStat> select(List<PatternStat> rows, Lane lane, int cap) {
        Map<PatternKind, List<PatternStat>> perKind = new EnumMap<>(PatternKind.class);
        rows.stream()
                .filter(stat -> lane(stat) == lane)
                .forEach(stat -> perKind.computeIfAbsent(stat.getKind(), kind -> new ArrayList<>()).add(stat));

        return perKind.values().stream()
                .flatMap(group -> group.stream().sorted(BY_SCORE_THEN_RECENCY).limit(MAX_PER_KIND_WITHIN_LANE))
                .sorted(BY_SCORE_THEN_RECENCY)
                .limit(cap)
                .toList();
    }

    private static boolean sameProjection(List<CapsuleTendency> current, List<CapsuleTendency> projected) {
        List<CapsuleTendency> existing = current != null ? current : List.of();
        if (existing.size() != projected.size()) {
            return false;
        }
        Comparator<CapsuleTendency> order = Comparator
                .comparing((CapsuleTendency tendency) -> Objects.toString(tendency.getStatement(), ""))
                .thenComparing(tendency -> Objects.toString(tendency.getKind(), ""))
                .thenComparing(tendency -> Objects.toString(tendency.getKey(), ""));
        List<CapsuleTendency> left = existing.stream().sorted(order).toList();
        List<CapsuleTendency> right = projected.stream().sorted(order).toList();
        return left.equals(right);
    }

    private static String identity(PatternKind kind, String key) {
        return (kind != null ? kind.getWire() : "") + "|" + key;
    }
}
