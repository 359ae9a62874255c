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

import me.golemcore.clarity.domain.model.PatternKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Short human-readable statements for learned tendencies. These are what the
 * remote service sees in place of any user text.
 */
public final class TendencyStatements {

    private static final Map<PatternKind, Map<String, String>> KNOWN = new EnumMap<>(PatternKind.class);

    private static final List<Map.Entry<String, String>> TOPIC_PREFIXES = List.of(
            Map.entry("topic:", "Topic: "),
            Map.entry("profile:language:", "Language: "),
            Map.entry("profile:country:", "Country: "),
            Map.entry("profile:region:", "Region: "));

    static {
        KNOWN.put(PatternKind.STYLE_PREFERENCE, Map.of(
                "bullets", "Prefers bullet points",
                "concise", "Prefers concise summaries",
                "scripted_reply", "Often wants suggested wording",
                "prefers_tldr_then_detail", "Prefers TL;DR first, then details",
                "prefers_brief", "Prefers brief answers",
                "prefers_numbered_steps", "Prefers numbered steps",
                "prefers_checklist", "Prefers checklists",
                "prefers_decision_tree", "Prefers decision trees",
                "prefers_no_fluff", "Prefers direct, no-fluff replies"));
        KNOWN.put(PatternKind.WORKFLOW_PREFERENCE, Map.ofEntries(
                Map.entry("options_first", "Wants options before questions"),
                Map.entry("prefers_confirm_then_execute", "Prefers to confirm once, then proceed"),
                Map.entry("prefers_execute_immediately", "Prefers to execute without preamble"),
                Map.entry("prefers_just_answer", "Prefers a direct answer"),
                Map.entry("prefers_few_questions", "Prefers fewer questions"),
                Map.entry("prefers_no_clarifying_questions", "Prefers no clarifying questions"),
                Map.entry("question_light", "Prefers lighter questioning"),
                Map.entry("question_guided", "Prefers guided questioning"),
                Map.entry("narrow_first", "Prefers one path first"),
                Map.entry("explore_space", "Prefers exploring options")));
        KNOWN.put(PatternKind.RESOLUTION_PATTERN, Map.of(
                "constraints_first", "Responds better when constraints are addressed early",
                "decision_stuck", "Gets stuck deciding under uncertainty",
                "needs_decompression", "Responds better after decompressing first",
                "complexity_high", "Often faces high complexity",
                "prefers_reframe_then_steps", "Responds better with a reframe before steps"));
        KNOWN.put(PatternKind.CONSTRAINTS_SENSITIVITY, Map.of(
                "time_pressure", "Often constrained by time pressure",
                "low_energy", "Often constrained by low energy",
                "money_limit", "Often constrained by money limits",
                "social_overload", "Often constrained by social factors",
                "dependency_blocked", "Often constrained by dependencies",
                "sensory_noise", "Sensitive to sensory overload",
                "legal_risk", "Often constrained by legal risk"));
        KNOWN.put(PatternKind.NARRATIVE_PATTERN, Map.of(
                "replay_loop", "Tends to replay the story",
                "identity_frame_present", "Framing often involves identity",
                "outcome_fixation", "Fixates on a single outcome",
                "control_frame", "Framing leans toward control",
                "uncertainty_pressure", "Feels pressure from uncertainty",
                "self_attack_language", "Uses self-critical language",
                "reassurance_checking", "Seeks reassurance",
                "avoidance_language", "Uses avoidance language"));
        KNOWN.put(PatternKind.LENS_PREFERENCE, Map.of(
                "softening_helps", "Softening lens tends to help",
                "widening_helps", "Widening lens tends to help",
                "letting_be_helps", "Letting-be lens tends to help",
                "compassionate_witnessing_helps", "Compassionate witnessing tends to help",
                "impermanence_helps", "Impermanence lens tends to help",
                "non_identification_helps", "Non-identification lens tends to help"));
        KNOWN.put(PatternKind.CONSTRAINT_TRIGGER, Map.ofEntries(
                Map.entry("trigger:noise", "Often harder in noisy environments"),
                Map.entry("trigger:bright_light", "Often harder with bright light"),
                Map.entry("trigger:crowds", "Often harder in crowds"),
                Map.entry("trigger:group_dynamics", "Often harder with complex group dynamics"),
                Map.entry("trigger:hierarchy_games", "Often harder with power dynamics"),
                Map.entry("trigger:being_observed", "Often harder when being observed"),
                Map.entry("trigger:too_many_variables", "Often harder with many variables"),
                Map.entry("trigger:unclear_requirements", "Often harder when requirements are unclear"),
                Map.entry("trigger:interruptions", "Often harder with frequent interruptions"),
                Map.entry("trigger:context_switching", "Often harder with frequent context switching"),
                Map.entry("trigger:deadline_pressure", "Often harder under deadline pressure"),
                Map.entry("trigger:low_sleep", "Often harder with low sleep"),
                Map.entry("trigger:low_energy", "Often harder with low energy")));
        KNOWN.put(PatternKind.CONTRACTION_PATTERN, Map.of(
                "contraction:identity_fixation", "Identity framing can tighten experience",
                "contraction:outcome_fixation", "Outcome fixation can increase pressure",
                "contraction:control_pressure", "Control efforts can add pressure",
                "contraction:uncertainty_pressure", "Uncertainty can amplify tension",
                "contraction:mental_looping", "Mental replay can sustain tightening",
                "contraction:self_attack", "Self-critical language can tighten experience",
                "contraction:checking_for_reassurance", "Checking for reassurance can sustain tightening",
                "contraction:avoidance_pressure", "Avoidance language can increase pressure"));
        KNOWN.put(PatternKind.RELEASE_PATTERN, Map.of(
                "release:ease_present", "Ease can show up under some conditions",
                "release:settling", "Settling can appear at times",
                "release:openness", "A sense of space can open when pressure drops"));
    }

    private TendencyStatements() {
    }

    public static String statement(PatternKind kind, String key) {
        String safeKey = key != null ? key : "";
        String known = KNOWN.getOrDefault(kind, Map.of()).get(safeKey);
        if (known != null) {
            return known;
        }

        String human = human(safeKey);
        return switch (kind) {
            case STYLE_PREFERENCE -> "Prefers " + human;
            case WORKFLOW_PREFERENCE -> "Often wants " + human;
            case TOPIC_RECURRENCE -> topic(safeKey);
            case RESOLUTION_PATTERN -> "Responds better when " + human;
            case CONSTRAINTS_SENSITIVITY -> "Often constrained by " + human;
            case NARRATIVE_PATTERN -> "Narrative pattern: " + human;
            case LENS_PREFERENCE -> "Lens " + human + " tends to help";
            case CONSTRAINT_TRIGGER -> "Often harder when " + human;
            case CONTRACTION_PATTERN -> "Tightening can show up under certain conditions";
            case RELEASE_PATTERN -> "Ease can appear under certain conditions";
        };
    }

    private static String topic(String key) {
        for (Map.Entry<String, String> prefix : TOPIC_PREFIXES) {
            if (key.startsWith(prefix.getKey())) {
                return prefix.getValue() + human(key.substring(prefix.getKey().length()));
            }
        }
        return "Noted: " + human(key);
    }

    private static String human(String raw) {
        return raw.replace('_', ' ');
    }
}
