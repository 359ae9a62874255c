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

import me.golemcore.clarity.domain.model.CanonicalPrimitive;
import me.golemcore.clarity.domain.model.PrimitiveCandidate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static me.golemcore.clarity.domain.model.CanonicalPrimitive.ATTACHMENT_TO_OUTCOME;
import static me.golemcore.clarity.domain.model.CanonicalPrimitive.AVERSION_RESISTANCE;
import static me.golemcore.clarity.domain.model.CanonicalPrimitive.CONTROL_SEEKING;
import static me.golemcore.clarity.domain.model.CanonicalPrimitive.IDENTITY_TIGHTENING;
import static me.golemcore.clarity.domain.model.CanonicalPrimitive.INTOLERANCE_OF_UNCERTAINTY;
import static me.golemcore.clarity.domain.model.CanonicalPrimitive.NARRATIVE_LOOPING;
import static me.golemcore.clarity.domain.model.CanonicalPrimitive.REASSURANCE_SEEKING;
import static me.golemcore.clarity.domain.model.CanonicalPrimitive.SELF_JUDGEMENT;

/**
 * Scores each {@link CanonicalPrimitive} against a Turn's redacted text.
 *
 * <p>
 * Every matching phrase adds its rule's weight; anti-phrases subtract. Repeated
 * "what if" (three or more) and "if only" (two or more) add a structural
 * bonus. Scores are clamped to 0..100 and only candidates at or above the
 * background threshold are returned, strongest first.
 */
@Component
public class PrimitiveCandidateExtractor {

    static final int WHAT_IF_REPEATS = 3;
    static final int IF_ONLY_REPEATS = 2;
    static final int STRUCTURAL_BONUS = 8;

    private record Rule(CanonicalPrimitive primitive, int weight, List<String> phrases) {
    }

    /**
     * Dominant primitives score at least 70, background ones 45 to 69.
     * Confirmation is needed when nothing is dominant but something sits in
     * the background.
     */
    public record Selection(List<CanonicalPrimitive> dominant, List<CanonicalPrimitive> background,
            boolean needsConfirmation) {
    }

    private static final List<Rule> RULES = List.of(
            // strong
            new Rule(NARRATIVE_LOOPING, 25, List.of("can't stop thinking", "keep replaying", "going over and over",
                    "stuck in my head", "spiralling")),
            new Rule(IDENTITY_TIGHTENING, 25, List.of("it proves i'm", "it means i'm not", "not cut out for",
                    "says something about me")),
            new Rule(ATTACHMENT_TO_OUTCOME, 20, List.of("has to", "must", "need it to go well",
                    "can't let this fail")),
            new Rule(AVERSION_RESISTANCE, 20, List.of("can't face", "avoiding", "dread",
                    "don't want to deal with")),
            new Rule(CONTROL_SEEKING, 20, List.of("make sure", "prevent", "control", "cover every angle",
                    "perfect plan")),
            new Rule(INTOLERANCE_OF_UNCERTAINTY, 20, List.of("need to know", "can't stand not knowing",
                    "until i know i can't relax")),
            new Rule(SELF_JUDGEMENT, 20, List.of("i'm pathetic", "i'm useless", "what's wrong with me",
                    "i hate myself for", "why can't i just")),
            new Rule(REASSURANCE_SEEKING, 20, List.of("tell me it's ok", "am i overreacting", "is this normal")),
            // medium
            new Rule(NARRATIVE_LOOPING, 10, List.of("should have", "if only")),
            new Rule(IDENTITY_TIGHTENING, 10, List.of("always", "never", "everything", "nothing")),
            new Rule(ATTACHMENT_TO_OUTCOME, 15, List.of("consequence if", "single outcome")),
            new Rule(AVERSION_RESISTANCE, 10, List.of("avoiding it", "putting it off")),
            new Rule(CONTROL_SEEKING, 10, List.of("contingency", "every possibility")),
            new Rule(INTOLERANCE_OF_UNCERTAINTY, 10, List.of("what if", "unknowns")),
            new Rule(SELF_JUDGEMENT, 10, List.of("should", "must")),
            new Rule(REASSURANCE_SEEKING, 10, List.of("checking again", "ask again")),
            // anti
            new Rule(NARRATIVE_LOOPING, -15, List.of("so i'll do", "plan is")),
            new Rule(IDENTITY_TIGHTENING, -15, List.of("need to learn", "that meeting was messy")),
            new Rule(AVERSION_RESISTANCE, -10, List.of("i'll do it anyway")),
            new Rule(CONTROL_SEEKING, -10, List.of("good enough", "delegate")),
            new Rule(INTOLERANCE_OF_UNCERTAINTY, -10, List.of("we'll see", "unknown is fine")),
            new Rule(SELF_JUDGEMENT, -10, List.of("it's okay", "i can be kind to myself")),
            new Rule(REASSURANCE_SEEKING, -10, List.of("no reassurance", "don't reassure")));

    public List<PrimitiveCandidate> extract(String redactedText) {
        if (redactedText == null || redactedText.isBlank()) {
            return List.of();
        }
        String text = redactedText.toLowerCase(Locale.ROOT);

        Map<CanonicalPrimitive, Integer> scores = new EnumMap<>(CanonicalPrimitive.class);
        Map<CanonicalPrimitive, Set<String>> evidence = new EnumMap<>(CanonicalPrimitive.class);
        for (Rule rule : RULES) {
            for (String phrase : rule.phrases()) {
                if (!PhraseMatcher.contains(text, phrase)) {
                    continue;
                }
                scores.merge(rule.primitive(), rule.weight(), Integer::sum);
                if (rule.weight() > 0) {
                    evidence.computeIfAbsent(rule.primitive(), key -> new LinkedHashSet<>()).add(phrase);
                }
            }
        }
        if (PhraseMatcher.count(text, "what if") >= WHAT_IF_REPEATS) {
            scores.merge(INTOLERANCE_OF_UNCERTAINTY, STRUCTURAL_BONUS, Integer::sum);
        }
        if (PhraseMatcher.count(text, "if only") >= IF_ONLY_REPEATS) {
            scores.merge(NARRATIVE_LOOPING, STRUCTURAL_BONUS, Integer::sum);
        }

        List<PrimitiveCandidate> candidates = new ArrayList<>();
        scores.forEach((primitive, raw) -> {
            int score = Math.max(0, Math.min(100, raw));
            if (score >= PrimitiveCandidate.BACKGROUND_THRESHOLD) {
                candidates.add(new PrimitiveCandidate(primitive, score, PrimitiveCandidate.Confidence.forScore(score),
                        List.copyOf(evidence.getOrDefault(primitive, Set.of()))));
            }
        });
        candidates.sort(Comparator.comparingInt(PrimitiveCandidate::score).reversed()
                .thenComparing(candidate -> candidate.primitive().getWire()));
        return candidates;
    }

    public Selection select(List<PrimitiveCandidate> candidates, int dominantMax, int backgroundMax) {
        List<CanonicalPrimitive> dominant = candidates.stream()
                .filter(candidate -> candidate.score() >= PrimitiveCandidate.DOMINANT_THRESHOLD)
                .map(PrimitiveCandidate::primitive)
                .limit(Math.max(0, dominantMax))
                .toList();
        List<CanonicalPrimitive> background = candidates.stream()
                .filter(candidate -> candidate.score() >= PrimitiveCandidate.BACKGROUND_THRESHOLD
                        && candidate.score() < PrimitiveCandidate.DOMINANT_THRESHOLD)
                .map(PrimitiveCandidate::primitive)
                .limit(Math.max(0, backgroundMax))
                .toList();
        return new Selection(dominant, background, dominant.isEmpty() && !background.isEmpty());
    }
}
