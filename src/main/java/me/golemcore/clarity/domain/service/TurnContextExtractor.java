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

import me.golemcore.clarity.domain.model.TurnContextFrame;
import me.golemcore.clarity.domain.model.TurnContextFrame.Constraint;
import me.golemcore.clarity.domain.model.TurnContextFrame.Horizon;
import me.golemcore.clarity.domain.model.TurnContextFrame.Intent;
import me.golemcore.clarity.domain.model.TurnContextFrame.Level;
import me.golemcore.clarity.domain.model.TurnContextFrame.Output;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a {@link TurnContextFrame} from redacted text using fixed phrase
 * tables. Rules are checked in declaration order and the first match wins for
 * single-valued fields.
 */
@Component
public class TurnContextExtractor {

    private static final Map<Intent, List<String>> INTENTS = new LinkedHashMap<>();
    private static final Map<Output, List<String>> OUTPUTS = new LinkedHashMap<>();
    private static final Map<Constraint, List<String>> CONSTRAINTS = new LinkedHashMap<>();
    private static final Map<Level, List<String>> STAKES = new LinkedHashMap<>();
    private static final Map<Level, List<String>> URGENCIES = new LinkedHashMap<>();
    private static final Map<Horizon, List<String>> HORIZONS = new LinkedHashMap<>();

    static {
        INTENTS.put(Intent.DECIDE, List.of("should i", "do i", "choose", "pros and cons", "either/or", "either or",
                "can't decide"));
        INTENTS.put(Intent.PLAN, List.of("how do i", "steps", "plan", "timeline", "what next", "break it down"));
        INTENTS.put(Intent.VENT, List.of("fed up", "can't cope"));
        INTENTS.put(Intent.UNDERSTAND, List.of("why do i", "make sense of", "pattern", "meaning"));
        INTENTS.put(Intent.REHEARSE, List.of("what should i say", "script", "how to phrase", "meeting",
                "conversation"));
        INTENTS.put(Intent.DEBRIEF, List.of("what happened was", "after that",
                "i keep thinking about what i said"));
        INTENTS.put(Intent.CREATE, List.of("draft", "write", "generate", "design"));

        OUTPUTS.put(Output.STEPS, List.of("step by step", "checklist", "actionable", "what next"));
        OUTPUTS.put(Output.CHECKLIST, List.of("step by step", "checklist", "actionable", "what next"));
        OUTPUTS.put(Output.OPTIONS, List.of("options", "alternatives", "ways to"));
        OUTPUTS.put(Output.SCRIPT, List.of("what should i say", "wording", "reply"));
        OUTPUTS.put(Output.SUMMARY, List.of("summarise", "summarize", "tldr", "tl;dr"));
        OUTPUTS.put(Output.REFRAME, List.of("another way to see it", "perspective"));
        OUTPUTS.put(Output.DECISION_TREE, List.of("decision tree", "if/then", "if then", "criteria"));

        CONSTRAINTS.put(Constraint.TIME, List.of("deadline", "tomorrow", "urgent", "no time"));
        CONSTRAINTS.put(Constraint.ENERGY, List.of("exhausted", "burnt out", "can't face it", "cant face"));
        CONSTRAINTS.put(Constraint.MONEY, List.of("budget", "can't afford", "cant afford"));
        CONSTRAINTS.put(Constraint.SOCIAL, List.of("awkward", "politics", "conflict", "what will they think",
                "social situation", "social situations", "socially overwhelmed", "overwhelmed socially",
                "social overwhelm", "socially draining", "socially drained", "draining socially", "crowds",
                "too many people", "group dynamics", "social dynamics", "being watched", "being observed"));
        CONSTRAINTS.put(Constraint.SENSORY, List.of("noisy", "bright", "overwhelming", "overstimulated",
                "overstimulating", "sensory overload", "overloaded"));
        CONSTRAINTS.put(Constraint.DEPENDENCIES, List.of("waiting on", "blocked", "need approval"));
        CONSTRAINTS.put(Constraint.LEGAL, List.of("legal"));
        CONSTRAINTS.put(Constraint.INFORMATION, List.of("lack of info", "no information", "missing info",
                "don't know enough", "dont know enough"));

        STAKES.put(Level.HIGH, List.of("career-ending", "catastrophic", "cannot fail", "must not fail"));
        STAKES.put(Level.MED, List.of("important", "matters a lot"));
        STAKES.put(Level.LOW, List.of("not a big deal", "minor"));

        URGENCIES.put(Level.HIGH, List.of("urgent", "asap", "right now", "today"));
        URGENCIES.put(Level.MED, List.of("soon", "this week"));
        URGENCIES.put(Level.LOW, List.of("no rush", "whenever"));

        HORIZONS.put(Horizon.NOW, List.of("right now", "immediately", "now"));
        HORIZONS.put(Horizon.TODAY, List.of("today"));
        HORIZONS.put(Horizon.WEEK, List.of("this week", "next week"));
        HORIZONS.put(Horizon.LONGER, List.of("this month", "later this year", "long term", "long-term",
                "longer term"));
    }

    public TurnContextFrame extract(String redactedText) {
        if (redactedText == null || redactedText.isBlank()) {
            return TurnContextFrame.EMPTY;
        }
        String text = redactedText.toLowerCase(Locale.ROOT);
        return new TurnContextFrame(
                first(text, INTENTS, Intent.UNKNOWN),
                all(text, OUTPUTS),
                all(text, CONSTRAINTS),
                first(text, STAKES, Level.UNKNOWN),
                first(text, URGENCIES, Level.UNKNOWN),
                first(text, HORIZONS, Horizon.UNKNOWN));
    }

    private static <T> T first(String text, Map<T, List<String>> table, T fallback) {
        for (Map.Entry<T, List<String>> entry : table.entrySet()) {
            if (PhraseMatcher.containsAny(text, entry.getValue())) {
                return entry.getKey();
            }
        }
        return fallback;
    }

    private static <T> List<T> all(String text, Map<T, List<String>> table) {
        List<T> matched = new ArrayList<>();
        table.forEach((value, phrases) -> {
            if (PhraseMatcher.containsAny(text, phrases)) {
                matched.add(value);
            }
        });
        return matched;
    }
}
