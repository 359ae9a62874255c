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
import me.golemcore.clarity.domain.model.CanonicalLens;
import me.golemcore.clarity.domain.model.CanonicalPrimitive;
import me.golemcore.clarity.domain.model.PrimitiveCandidate;
import me.golemcore.clarity.domain.model.TurnContextFrame;
import me.golemcore.clarity.domain.model.WorkingSnapshot;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the bounded {@link WorkingSnapshot} for a Turn from its redacted
 * text. Everything runs locally; nothing here calls out.
 *
 * <p>
 * Lens choice: when the strongest candidate is below the dominant threshold
 * the lens is {@link CanonicalLens#SOFTENING} alone. Otherwise the first
 * dominant primitive supplies a primary and a secondary lens, or failing
 * that the first background primitive supplies a primary only.
 */
@Component
@RequiredArgsConstructor
public class WorkingSnapshotBuilder {

    private static final Map<CanonicalPrimitive, CanonicalLens[]> LENSES = new EnumMap<>(CanonicalPrimitive.class);

    static {
        LENSES.put(CanonicalPrimitive.IDENTITY_TIGHTENING,
                new CanonicalLens[] { CanonicalLens.NON_IDENTIFICATION, CanonicalLens.COMPASSIONATE_WITNESSING });
        LENSES.put(CanonicalPrimitive.NARRATIVE_LOOPING,
                new CanonicalLens[] { CanonicalLens.WIDENING, CanonicalLens.SOFTENING });
        LENSES.put(CanonicalPrimitive.ATTACHMENT_TO_OUTCOME,
                new CanonicalLens[] { CanonicalLens.IMPERMANENCE, CanonicalLens.LETTING_BE });
        LENSES.put(CanonicalPrimitive.INTOLERANCE_OF_UNCERTAINTY,
                new CanonicalLens[] { CanonicalLens.LETTING_BE, CanonicalLens.SOFTENING });
        LENSES.put(CanonicalPrimitive.SELF_JUDGEMENT,
                new CanonicalLens[] { CanonicalLens.COMPASSIONATE_WITNESSING, CanonicalLens.SOFTENING });
        LENSES.put(CanonicalPrimitive.AVERSION_RESISTANCE,
                new CanonicalLens[] { CanonicalLens.SOFTENING, CanonicalLens.LETTING_BE });
        LENSES.put(CanonicalPrimitive.CONTROL_SEEKING,
                new CanonicalLens[] { CanonicalLens.LETTING_BE, CanonicalLens.WIDENING });
        LENSES.put(CanonicalPrimitive.REASSURANCE_SEEKING,
                new CanonicalLens[] { CanonicalLens.COMPASSIONATE_WITNESSING, CanonicalLens.LETTING_BE });
    }

    private final TurnContextExtractor contextExtractor;
    private final PrimitiveCandidateExtractor candidateExtractor;

    /**
     * @return {@code null} for blank text
     */
    public WorkingSnapshot build(String redactedText, Instant now) {
        if (redactedText == null || redactedText.isBlank()) {
            return null;
        }
        TurnContextFrame context = contextExtractor.extract(redactedText);
        List<PrimitiveCandidate> candidates = candidateExtractor.extract(redactedText);
        PrimitiveCandidateExtractor.Selection selection = candidateExtractor.select(candidates,
                WorkingSnapshot.MAX_DOMINANT, WorkingSnapshot.MAX_BACKGROUND);
        CanonicalLens[] lenses = selectLenses(selection, candidates.isEmpty() ? null : candidates.get(0).score());
        return new WorkingSnapshot(WorkingSnapshot.CURRENT_VERSION, now, context, selection.dominant(),
                selection.background(), lenses[0], lenses[1], candidates,
                selection.needsConfirmation() ? confirmationQuestion(selection) : "",
                WorkingSnapshot.BUILT_LOCALLY);
    }

    static CanonicalLens[] selectLenses(PrimitiveCandidateExtractor.Selection selection, Integer topScore) {
        if (topScore != null && topScore < PrimitiveCandidate.DOMINANT_THRESHOLD) {
            return new CanonicalLens[] { CanonicalLens.SOFTENING, null };
        }
        if (!selection.dominant().isEmpty()) {
            CanonicalLens[] mapped = LENSES.get(selection.dominant().get(0));
            return new CanonicalLens[] { mapped[0], mapped[1] };
        }
        if (!selection.background().isEmpty()) {
            return new CanonicalLens[] { LENSES.get(selection.background().get(0))[0], null };
        }
        return new CanonicalLens[] { CanonicalLens.SOFTENING, null };
    }

    static String confirmationQuestion(PrimitiveCandidateExtractor.Selection selection) {
        if (!selection.dominant().isEmpty()) {
            return "Does " + selection.dominant().get(0).getLabel() + " fit today, or is it something else?";
        }
        if (!selection.background().isEmpty()) {
            return "Is " + selection.background().get(0).getLabel() + " showing up here?";
        }
        return "";
    }
}
