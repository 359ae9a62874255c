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
import me.golemcore.clarity.domain.model.CanonicalPrimitive;
import me.golemcore.clarity.domain.model.PatternKind;
import me.golemcore.clarity.domain.model.PatternObservation;
import me.golemcore.clarity.domain.model.TurnContextFrame;
import me.golemcore.clarity.domain.model.TurnContextFrame.Constraint;
import me.golemcore.clarity.domain.model.TurnContextFrame.Intent;
import me.golemcore.clarity.domain.model.TurnContextFrame.Level;
import me.golemcore.clarity.domain.model.TurnContextFrame.Output;
import me.golemcore.clarity.domain.model.WorkingSnapshot;
import me.golemcore.clarity.infrastructure.config.ClarityProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives pattern observations from a completed Turn's redacted text.
 *
 * <p>
 * Only explicit phrases from fixed allowlists count; nothing is inferred from
 * tone or silence. Phrases match on word boundaries against the lower-cased
 * text. Deactivation phrases ("not anymore", "stop doing that") produce
 * negative observations that can only weaken existing rows; they replace any
 * positive observation of the same key in that Turn.
 *
 * <p>
 * When the Turn carries a {@link WorkingSnapshot}, its context frame and
 * primitives add style, workflow, resolution, constraint-sensitivity,
 * narrative and contraction observations.
 */
@Component
@RequiredArgsConstructor
public class PatternObservationExtractor {

    static final int MAX_SITUATIONAL_PER_TURN = 6;
    static final double WORKFLOW_STRENGTH = 0.5;
    static final double TRIGGER_STRENGTH = 0.4;
    static final double DEACTIVATION_STRENGTH = -0.6;

    private static final List<String> NOISE = List.of("noise", "noisy", "too loud", "loud noise", "loud noises",
            "background noise");
    private static final List<String> BRIGHT_LIGHT = List.of("bright light", "bright lights", "glare",
            "fluorescent light", "fluorescent lights");
    private static final List<String> CROWDS = List.of("crowds", "crowded", "crowded places", "busy places",
            "too many people");
    private static final List<String> HIERARCHY = List.of("hierarchy games", "power games", "status games",
            "power dynamics");
    private static final List<String> OBSERVED = List.of("being watched", "being observed",
            "people watching me");

    private static final Map<String, List<String>> WORKFLOW_PHRASES = new LinkedHashMap<>();
    private static final Map<String, List<String>> TRIGGER_PHRASES = new LinkedHashMap<>();
    private static final List<Release> RELEASE_PHRASES = List.of(
            new Release("release:ease_present", 0.4, List.of("ease", "easier", "with ease", "can breathe",
                    "could breathe", "breathing easier", "relief", "relieved")),
            new Release("release:settling", 0.4, List.of("settled", "settling", "less tight", "less tense",
                    "unclench", "soften", "softening")),
            new Release("release:openness", 0.3, List.of("more space", "there is space", "space opened",
                    "spacious", "feel space", "sense of space", "let go", "dropped it", "drop it")));

    private static final List<String> DEACTIVATION_MARKERS = List.of("not anymore", "no longer", "it's fine now",
            "it is fine now", "stop doing that", "don't do that", "do not do that", "you can stop",
            "i don't need that", "i do not need that");
    private static final List<Deactivation> DEACTIVATIONS = List.of(
            new Deactivation(PatternKind.CONSTRAINT_TRIGGER, "trigger:noise", NOISE),
            new Deactivation(PatternKind.CONSTRAINT_TRIGGER, "trigger:bright_light", BRIGHT_LIGHT),
            new Deactivation(PatternKind.CONSTRAINT_TRIGGER, "trigger:crowds", CROWDS),
            new Deactivation(PatternKind.CONSTRAINT_TRIGGER, "trigger:hierarchy_games", HIERARCHY),
            new Deactivation(PatternKind.CONSTRAINT_TRIGGER, "trigger:being_observed", OBSERVED),
            new Deactivation(PatternKind.CONSTRAINTS_SENSITIVITY, "sensory_noise", NOISE),
            new Deactivation(PatternKind.WORKFLOW_PREFERENCE, "question_light",
                    List.of("stop asking questions", "no questions", "stop with the questions")));

    static {
        WORKFLOW_PHRASES.put("question_light", List.of("stop asking questions", "just tell me",
                "don't ask me questions", "do not ask me questions", "no questions", "no more questions",
                "quit asking questions", "stop with the questions"));
        WORKFLOW_PHRASES.put("question_guided", List.of("ask me questions", "help me think this through",
                "question me", "can you question me", "guide me with questions",
                "ask questions to help me think"));
        WORKFLOW_PHRASES.put("narrow_first", List.of("one thing at a time", "just pick one", "too many options",
                "pick one for me", "choose one for me", "don't give me options", "do not give me options",
                "just choose for me", "pick one"));
        WORKFLOW_PHRASES.put("explore_space", List.of("what are my options", "map it out", "what else could work",
                "alternatives", "explore options", "show me options", "option space", "lay out the options"));

        TRIGGER_PHRASES.put("trigger:noise", NOISE);
        TRIGGER_PHRASES.put("trigger:bright_light", BRIGHT_LIGHT);
        TRIGGER_PHRASES.put("trigger:crowds", CROWDS);
        TRIGGER_PHRASES.put("trigger:group_dynamics", List.of("group dynamics"));
        TRIGGER_PHRASES.put("trigger:hierarchy_games", HIERARCHY);
        TRIGGER_PHRASES.put("trigger:being_observed", OBSERVED);
        TRIGGER_PHRASES.put("trigger:too_many_variables", List.of("too many variables", "too many moving parts",
                "too many factors"));
        TRIGGER_PHRASES.put("trigger:unclear_requirements", List.of("unclear requirements",
                "requirements unclear", "not clear what is needed"));
        TRIGGER_PHRASES.put("trigger:interruptions", List.of("interruptions", "interrupted",
                "getting interrupted"));
        TRIGGER_PHRASES.put("trigger:context_switching", List.of("context switching", "switching context",
                "switching tasks", "task switching"));
        TRIGGER_PHRASES.put("trigger:deadline_pressure", List.of("deadline pressure", "tight deadline",
                "deadline looming"));
        TRIGGER_PHRASES.put("trigger:low_sleep", List.of("low sleep", "no sleep", "little sleep", "sleep deprived",
                "didn't sleep", "did not sleep"));
        TRIGGER_PHRASES.put("trigger:low_energy", List.of("low energy", "exhausted", "tired", "burnt out",
                "burned out"));
    }

    private static final Map<Constraint, String> SENSITIVITIES = new EnumMap<>(Constraint.class);
    private static final Map<CanonicalPrimitive, String> NARRATIVES = new EnumMap<>(CanonicalPrimitive.class);
    private static final Map<CanonicalPrimitive, String> CONTRACTIONS = new EnumMap<>(CanonicalPrimitive.class);

    static {
        SENSITIVITIES.put(Constraint.TIME, "time_pressure");
        SENSITIVITIES.put(Constraint.ENERGY, "low_energy");
        SENSITIVITIES.put(Constraint.MONEY, "money_limit");
        SENSITIVITIES.put(Constraint.SOCIAL, "social_overload");
        SENSITIVITIES.put(Constraint.DEPENDENCIES, "dependency_blocked");
        SENSITIVITIES.put(Constraint.SENSORY, "sensory_noise");
        SENSITIVITIES.put(Constraint.LEGAL, "legal_risk");

        NARRATIVES.put(CanonicalPrimitive.NARRATIVE_LOOPING, "replay_loop");
        NARRATIVES.put(CanonicalPrimitive.IDENTITY_TIGHTENING, "identity_frame_present");
        NARRATIVES.put(CanonicalPrimitive.ATTACHMENT_TO_OUTCOME, "outcome_fixation");
        NARRATIVES.put(CanonicalPrimitive.CONTROL_SEEKING, "control_frame");
        NARRATIVES.put(CanonicalPrimitive.INTOLERANCE_OF_UNCERTAINTY, "uncertainty_pressure");
        NARRATIVES.put(CanonicalPrimitive.SELF_JUDGEMENT, "self_attack_language");
        NARRATIVES.put(CanonicalPrimitive.REASSURANCE_SEEKING, "reassurance_checking");
        NARRATIVES.put(CanonicalPrimitive.AVERSION_RESISTANCE, "avoidance_language");

        CONTRACTIONS.put(CanonicalPrimitive.IDENTITY_TIGHTENING, "contraction:identity_fixation");
        CONTRACTIONS.put(CanonicalPrimitive.ATTACHMENT_TO_OUTCOME, "contraction:outcome_fixation");
        CONTRACTIONS.put(CanonicalPrimitive.CONTROL_SEEKING, "contraction:control_pressure");
        CONTRACTIONS.put(CanonicalPrimitive.INTOLERANCE_OF_UNCERTAINTY, "contraction:uncertainty_pressure");
        CONTRACTIONS.put(CanonicalPrimitive.NARRATIVE_LOOPING, "contraction:mental_looping");
        CONTRACTIONS.put(CanonicalPrimitive.SELF_JUDGEMENT, "contraction:self_attack");
        CONTRACTIONS.put(CanonicalPrimitive.REASSURANCE_SEEKING, "contraction:checking_for_reassurance");
        CONTRACTIONS.put(CanonicalPrimitive.AVERSION_RESISTANCE, "contraction:avoidance_pressure");
    }

    private record Release(String key, double strength, List<String> phrases) {
    }

    private record Deactivation(PatternKind kind, String key, List<String> phrases) {
    }

    private final ClarityProperties properties;

    /**
     * Observations for one Turn, deduplicated per (kind, key) keeping the
     * strongest, ordered by strength then key, and capped.
     */
    public List<PatternObservation> extract(String redactedText) {
        return extract(redactedText, null);
    }

    /**
     * As {@link #extract(String)}, adding what the Turn's working snapshot
     * says when one is present.
     */
    public List<PatternObservation> extract(String redactedText, WorkingSnapshot snapshot) {
        List<PatternObservation> out = new ArrayList<>();
        if (snapshot != null) {
            out.addAll(fromSnapshot(snapshot));
        }
        if (redactedText == null || redactedText.isBlank()) {
            return dedupe(out, properties.getLearning().getMaxObservationsPerTurn());
        }
        String text = redactedText.toLowerCase(Locale.ROOT);

        RELEASE_PHRASES.stream()
                .filter(release -> containsAny(text, release.phrases()))
                .forEach(release -> out.add(
                        new PatternObservation(PatternKind.RELEASE_PATTERN, release.key(), release.strength())));

        TRIGGER_PHRASES.entrySet().stream()
                .filter(entry -> containsAny(text, entry.getValue()))
                .limit(MAX_SITUATIONAL_PER_TURN)
                .forEach(entry -> out.add(
                        new PatternObservation(PatternKind.CONSTRAINT_TRIGGER, entry.getKey(), TRIGGER_STRENGTH)));

        WORKFLOW_PHRASES.forEach((key, phrases) -> {
            if (containsAny(text, phrases)) {
                out.add(new PatternObservation(PatternKind.WORKFLOW_PREFERENCE, key, WORKFLOW_STRENGTH));
            }
        });

        if (containsAny(text, DEACTIVATION_MARKERS)) {
            List<PatternObservation> released = DEACTIVATIONS.stream()
                    .filter(deactivation -> containsAny(text, deactivation.phrases()))
                    .map(deactivation -> new PatternObservation(deactivation.kind(), deactivation.key(),
                            DEACTIVATION_STRENGTH))
                    .toList();
            // An explicit release replaces the positive match of the same phrase.
            out.removeIf(observation -> released.stream().anyMatch(release -> release.kind() == observation.kind()
                    && release.key().equals(observation.key())));
            out.addAll(released);
        }

        return dedupe(out, properties.getLearning().getMaxObservationsPerTurn());
    }

    static List<PatternObservation> fromSnapshot(WorkingSnapshot snapshot) {
        TurnContextFrame context = snapshot.context();
        List<Output> desired = context.desiredOutputs();
        List<Constraint> constraints = context.constraints();
        boolean steps = desired.contains(Output.STEPS);
        boolean checklist = desired.contains(Output.CHECKLIST);
        boolean summary = desired.contains(Output.SUMMARY);
        boolean options = desired.contains(Output.OPTIONS);

        List<PatternObservation> out = new ArrayList<>();
        if (steps || checklist) {
            out.add(style("bullets", 0.7));
        }
        if (summary) {
            out.add(style("concise", 0.5));
        }
        if (desired.contains(Output.SCRIPT)) {
            out.add(style("scripted_reply", 0.5));
        }
        if (summary && (steps || checklist)) {
            out.add(style("prefers_tldr_then_detail", 0.6));
        } else if (summary) {
            out.add(style("prefers_brief", 0.5));
        }
        if (steps) {
            out.add(style("prefers_numbered_steps", 0.6));
        }
        if (checklist) {
            out.add(style("prefers_checklist", 0.6));
        }
        if (desired.contains(Output.DECISION_TREE)) {
            out.add(style("prefers_decision_tree", 0.6));
        }
        if (context.urgency() == Level.HIGH || context.stakeLevel() == Level.HIGH
                || constraints.contains(Constraint.TIME)) {
            out.add(style("prefers_no_fluff", 0.4));
        }

        if (options) {
            out.add(workflow("options_first", 0.6));
        }
        if (snapshot.needsConfirmation()) {
            out.add(workflow("prefers_confirm_then_execute", 0.4));
        } else if ((steps || options || summary) && !desired.contains(Output.QUESTIONS)) {
            out.add(workflow("prefers_execute_immediately", 0.3));
            out.add(workflow("prefers_few_questions", 0.3));
            if (summary) {
                out.add(workflow("prefers_just_answer", 0.3));
            }
        }

        if (!constraints.isEmpty()) {
            out.add(resolution("constraints_first", 0.5));
        }
        if (context.intent() == Intent.DECIDE
                && (snapshot.isDominant(CanonicalPrimitive.INTOLERANCE_OF_UNCERTAINTY)
                        || snapshot.isBackground(CanonicalPrimitive.INTOLERANCE_OF_UNCERTAINTY))) {
            out.add(resolution("decision_stuck", 0.6));
        }
        if (context.intent() == Intent.VENT && constraints.contains(Constraint.ENERGY)) {
            out.add(resolution("needs_decompression", 0.6));
        }
        if (constraints.size() >= 3) {
            out.add(resolution("complexity_high", 0.5));
        }
        if (desired.contains(Output.REFRAME) && (steps || checklist)) {
            out.add(resolution("prefers_reframe_then_steps", 0.5));
        }

        // Low strength so a single mention does not surface a tendency.
        constraints.stream()
                .filter(SENSITIVITIES::containsKey)
                .forEach(constraint -> out.add(new PatternObservation(PatternKind.CONSTRAINTS_SENSITIVITY,
                        SENSITIVITIES.get(constraint), 0.25)));

        NARRATIVES.forEach((primitive, key) -> primitiveObservation(snapshot, primitive,
                PatternKind.NARRATIVE_PATTERN, key, out));
        CONTRACTIONS.forEach((primitive, key) -> primitiveObservation(snapshot, primitive,
                PatternKind.CONTRACTION_PATTERN, key, out));
        return out;
    }

    private static void primitiveObservation(WorkingSnapshot snapshot, CanonicalPrimitive primitive,
            PatternKind kind, String key, List<PatternObservation> out) {
        if (snapshot.isDominant(primitive)) {
            out.add(new PatternObservation(kind, key, 0.6));
        } else if (snapshot.isBackground(primitive)) {
            out.add(new PatternObservation(kind, key, 0.4));
        }
    }

    private static PatternObservation style(String key, double strength) {
        return new PatternObservation(PatternKind.STYLE_PREFERENCE, key, strength);
    }

    private static PatternObservation workflow(String key, double strength) {
        return new PatternObservation(PatternKind.WORKFLOW_PREFERENCE, key, strength);
    }

    private static PatternObservation resolution(String key, double strength) {
        return new PatternObservation(PatternKind.RESOLUTION_PATTERN, key, strength);
    }

    static List<PatternObservation> dedupe(List<PatternObservation> observations, int limit) {
        Map<String, PatternObservation> unique = new LinkedHashMap<>();
        for (PatternObservation observation : observations) {
            unique.merge(observation.kind().getWire() + "|" + observation.key(), observation,
                    (existing, candidate) -> candidate.strength() > existing.strength() ? candidate : existing);
        }
        return unique.values().stream()
                .sorted(Comparator.comparingDouble(PatternObservation::strength).reversed()
                        .thenComparing(PatternObservation::key))
                .limit(Math.max(0, limit))
                .toList();
    }

    private static boolean containsAny(String text, List<String> phrases) {
        return PhraseMatcher.containsAny(text, phrases);
    }
}
