package me.golemcore.clarity.domain.service;

import me.golemcore.clarity.domain.model.CanonicalPrimitive;
import me.golemcore.clarity.domain.model.PrimitiveCandidate;
import me.golemcore.clarity.domain.model.PrimitiveCandidate.Confidence;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PrimitiveCandidateExtractorTest {

    private final PrimitiveCandidateExtractor extractor = new PrimitiveCandidateExtractor();

    @Test
    void shouldScoreLoopingAsDominantWithEvidence() {
        List<PrimitiveCandidate> candidates = extractor.extract(
                "I can't stop thinking about it, I keep replaying the call and it's stuck in my head.");

        assertEquals(1, candidates.size());
        PrimitiveCandidate looping = candidates.get(0);
        assertEquals(CanonicalPrimitive.NARRATIVE_LOOPING, looping.primitive());
        assertEquals(75, looping.score());
        assertEquals(Confidence.HIGH, looping.confidence());
        assertEquals(List.of("can't stop thinking", "keep replaying", "stuck in my head"), looping.evidence());
    }

    @Test
    void shouldLowerScoreForCounterPhrases() {
        List<PrimitiveCandidate> candidates = extractor.extract(
                "I keep replaying it, can't stop thinking, it's stuck in my head, but the plan is simple.");

        assertEquals(60, candidates.get(0).score());
        assertEquals(Confidence.MED, candidates.get(0).confidence());

        PrimitiveCandidateExtractor.Selection selection = extractor.select(candidates, 2, 1);
        assertTrue(selection.dominant().isEmpty());
        assertEquals(List.of(CanonicalPrimitive.NARRATIVE_LOOPING), selection.background());
        assertTrue(selection.needsConfirmation());
    }

    @Test
    void shouldAddBonusForRepeatedWhatIf() {
        List<PrimitiveCandidate> candidates = extractor.extract("What if it fails? What if they laugh? "
                + "What if I freeze? I need to know, I can't stand not knowing.");

        assertEquals(CanonicalPrimitive.INTOLERANCE_OF_UNCERTAINTY, candidates.get(0).primitive());
        assertEquals(58, candidates.get(0).score());
    }

    @Test
    void shouldClampScoreAtOneHundred() {
        List<PrimitiveCandidate> candidates = extractor.extract("It proves I'm a fraud, it means I'm not good, "
                + "I'm not cut out for this and it says something about me. I always fail, never win, "
                + "everything breaks, nothing works.");

        assertEquals(CanonicalPrimitive.IDENTITY_TIGHTENING, candidates.get(0).primitive());
        assertEquals(100, candidates.get(0).score());
    }

    @Test
    void shouldDropWeakCandidatesAndBlankText() {
        assertTrue(extractor.extract("I need to know.").isEmpty());
        assertTrue(extractor.extract(" ").isEmpty());
    }

    @Test
    void shouldCapDominantSelection() {
        List<PrimitiveCandidate> candidates = List.of(
                new PrimitiveCandidate(CanonicalPrimitive.SELF_JUDGEMENT, 90, null, List.of()),
                new PrimitiveCandidate(CanonicalPrimitive.CONTROL_SEEKING, 80, null, List.of()),
                new PrimitiveCandidate(CanonicalPrimitive.NARRATIVE_LOOPING, 75, null, List.of()),
                new PrimitiveCandidate(CanonicalPrimitive.REASSURANCE_SEEKING, 50, null, List.of()));

        PrimitiveCandidateExtractor.Selection selection = extractor.select(candidates, 2, 1);

        assertEquals(List.of(CanonicalPrimitive.SELF_JUDGEMENT, CanonicalPrimitive.CONTROL_SEEKING),
                selection.dominant());
        assertEquals(List.of(CanonicalPrimitive.REASSURANCE_SEEKING), selection.background());
        assertFalse(selection.needsConfirmation());
    }
}
