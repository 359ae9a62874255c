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

import me.golemcore.clarity.domain.model.ReflectResponse;
import me.golemcore.clarity.domain.model.ReflectTool;
import me.golemcore.clarity.domain.model.StepsProgramme;
import me.golemcore.clarity.domain.model.StepsResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Seed content served when the remote reasoning service is unavailable or
 * fails.
 */
@Component
public class LocalReflectionFallback {

    public static final String PROMPT_VERSION = "local-seed-v1";

    private static final Map<ReflectTool, String> TOOL_TEXT = Map.of(
            ReflectTool.REFLECT, """
                    Read back what you captured, slowly.
                    Notice which part carries the most weight right now.
                    Nothing needs to be solved yet.""",
            ReflectTool.OPTIONS, """
                    1. Do nothing for now and revisit this later today.
                    2. Take the smallest next step you can see.
                    3. Ask one person for the missing piece of information.""",
            ReflectTool.QUESTIONS, """
                    What matters most to you in this?
                    What is in your control here, and what is not?
                    What would make the next hour a little easier?""",
            ReflectTool.PERSPECTIVE, """
                    Situations like this tend to change shape over time.
                    Try describing it as a friend might describe it.
                    See what stays important and what softens.""");

    private static final Map<StepsProgramme, List<StepsResponse.Step>> STEPS = Map.of(
            StepsProgramme.REFLECT, List.of(
                    step(0, "What is here", "Say what is most present right now, in a few words.", "notice"),
                    step(1, "What matters", "Name the part of today that matters most to you.", "values"),
                    step(2, "One next step", "Describe one small step you could take next.", "action")),
            StepsProgramme.FOCUS, List.of(
                    step(0, "Training attention", """
                            Notice where the mind goes when it is not being directed.
                            There is no need to stop it or improve it.
                            Just see how it moves on its own.""", "attention"),
                    step(1, "Working with change", """
                            Everything that appears also changes.
                            This includes thoughts, moods, and situations.
                            Nothing needs to be held in place.""", "change"),
                    step(2, "Softening effort", """
                            Often we add effort on top of experience.
                            See what happens if effort relaxes slightly.
                            Nothing is lost.""", "effort")),
            StepsProgramme.PRACTICE, List.of(
                    step(0, "Three breaths", """
                            Take three natural breaths.
                            Nothing to fix. Nothing to achieve.
                            Just notice the next inhale, then the next exhale.""", "breath"),
                    step(1, "Soften the jaw", """
                            Let the jaw unclench.
                            Let the tongue rest.
                            Notice what changes when the face stops bracing.""", "body"),
                    step(2, "Name the feeling", """
                            Silently name what is most present.
                            "Pressure", "tired", "open", "restless", "fine".
                            No analysis. Just a clean label.""", "feeling")));

    public ReflectResponse reflect(ReflectTool tool) {
        return new ReflectResponse(TOOL_TEXT.get(tool), PROMPT_VERSION);
    }

    public StepsResponse steps(StepsProgramme kind, String programme) {
        List<StepsResponse.Step> steps = STEPS.get(kind);
        String slug = programme != null && !programme.isBlank() ? programme : kind.getDefaultProgramme();
        return new StepsResponse(slug, steps.size(), 1, steps);
    }

    private static StepsResponse.Step step(int index, String title, String body, String tag) {
        return new StepsResponse.Step(index, title, body, List.of(tag), 1);
    }
}
