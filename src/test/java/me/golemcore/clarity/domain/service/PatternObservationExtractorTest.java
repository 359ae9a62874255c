package me.golemcore.clarity.domain.service;

import me.golemcore.clarity.domain.model.CanonicalLens;
import me.golemcore.clarity.domain.model.CanonicalPrimitive;
import me.golemcore.clarity.domain.model.PatternKind;
import me.golemcore.clarity.domain.model.PatternObservation;
import me.golemcore.clarity.domain.model.TurnContextFrame;
import me.golemcore.clarity.domain.model.TurnContextFrame.Constraint;
import me.golemcore.clarity.domain.model.TurnContextFrame.Horizon;
import me.golemcore.clarity.domain.model.TurnContextFrame.Intent;
import me.golemcore.clarity.domain.model.TurnContextFrame.Level;
import me.golemcore.clarity.domain.model.TurnContextFrame.Output;
import me.golemcore.clarity.domain.model.WorkingSnapshot;
import me.golemcore.clarity.infrastructure.config.ClarityProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatternObservationExtractorTest {

    private PatternObservationExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new PatternObservationExtractor(new ClarityProperties());
    }

    @Test
    void shouldDetectExplicitWorkflowPreference() {
        List<PatternObservation> observations = extractor.extract("Please stop asking questions, just tell me.");

        assertEquals(List.of(new PatternObservation(PatternKind.WORKFLOW_PREFERENCE, "question_light", 0.5)),
                observations);
    }

    @Test
    void shouldDetectSituationalTriggersOrderedByKey() {
        List<PatternObservation> observations = extractor
                .extract("The office was so noisy and crowded, I was exhausted.");

        assertEquals(List.of("trigger:crowds", "trigger:low_energy", "trigger:noise"),
                observations.stream().map(PatternObservation::key).toList());
        assertTrue(observations.stream().allMatch(o -> o.kind() == PatternKind.CONSTRAINT_TRIGGER));
        assertTrue(observations.stream().allMatch(o -> o.strength() == 0.4));
    }

    @Test
    void shouldCapSituationalTriggersPerTurn() {
        List<PatternObservation> observations = extractor.extract(
                "noise, glare, crowds, group dynamics, power games, being watched, too many variables");

        assertEquals(PatternObservationExtractor.MAX_SITUATIONAL_PER_TURN, observations.size());
        assertTrue(observations.stream().noneMatch(o -> "trigger:too_many_variables".equals(o.key())));
    }

    @Test
    void shouldMatchOnWordBoundariesOnly() {
        assertTrue(extractor.extract("It was a pleasant afternoon").isEmpty());

        List<PatternObservation> observations = extractor.extract("It felt easier after the walk");
        assertEquals(List.of(new PatternObservation(PatternKind.RELEASE_PATTERN, "release:ease_present", 0.4)),
                observations);
    }

    @Test
    void shouldReplacePositiveMatchWithExplicitDeactivation() {
        List<PatternObservation> observations = extractor.extract("The noise no longer bothers me.");

        assertEquals(List.of(
                new PatternObservation(PatternKind.CONSTRAINTS_SENSITIVITY, "sensory_noise", -0.6),
                new PatternObservation(PatternKind.CONSTRAINT_TRIGGER, "trigger:noise", -0.6)),
                observations);
    }

    @Test
    void shouldReturnEmptyForBlankText() {
        assertTrue(extractor.extract(null).isEmpty());
        assertTrue(extractor.extract("   ").isEmpty());
    }

    @Test
    void dedupeKeepsStrongestAndCaps() {
        List<PatternObservation> deduped = PatternObservationExtractor.dedupe(List.of(
                new PatternObservation(PatternKind.CONSTRAINT_TRIGGER, "trigger:noise", 0.4),
                new PatternObservation(PatternKind.CONSTRAINT_TRIGGER, "trigger:noise", 0.9),
                new PatternObservation(PatternKind.RELEASE_PATTERN, "release:settling", 0.4),
                new PatternObservation(PatternKind.RELEASE_PATTERN, "release:openness", 0.3)), 2);

        assertEquals(List.of(
                new PatternObservation(PatternKind.CONSTRAINT_TRIGGER, "trigger:noise", 0.9),
                new PatternObservation(PatternKind.RELEASE_PATTERN, "release:settling", 0.4)), deduped);
    }

    @Test
    void shouldDeriveStyleWorkflowAndNarrativeFromSnapshot() {
        WorkingSnapshot snapshot = snapshot(new TurnContextFrame(Intent.PLAN, List.of(Output.STEPS),
                List.of(Constraint.TIME), Level.UNKNOWN, Level.UNKNOWN, Horizon.UNKNOWN),
                List.of(CanonicalPrimitive.NARRATIVE_LOOPING), List.of(), "");

        List<PatternObservation> observations = extractor.extract("", snapshot);

        assertTrue(observations.contains(new PatternObservation(PatternKind.STYLE_PREFERENCE, "bullets", 0.7)));
        assertTrue(observations.contains(
                new PatternObservation(PatternKind.STYLE_PREFERENCE, "prefers_no_fluff", 0.4)));
        assertTrue(observations.contains(
                new PatternObservation(PatternKind.WORKFLOW_PREFERENCE, "prefers_execute_immediately", 0.3)));
        assertTrue(observations.contains(
                new PatternObservation(PatternKind.RESOLUTION_PATTERN, "constraints_first", 0.5)));
        assertTrue(observations.contains(
                new PatternObservation(PatternKind.CONSTRAINTS_SENSITIVITY, "time_pressure", 0.25)));
        assertTrue(observations.contains(
                new PatternObservation(PatternKind.NARRATIVE_PATTERN, "replay_loop", 0.6)));
        assertTrue(observations.contains(
                new PatternObservation(PatternKind.CONTRACTION_PATTERN, "contraction:mental_looping", 0.6)));
        assertEquals("bullets", observations.get(0).key());
    }

    @Test
    void shouldPreferConfirmationWorkflowAndWeakerBackgroundSignals() {
        WorkingSnapshot snapshot = snapshot(new TurnContextFrame(Intent.DECIDE, List.of(Output.OPTIONS), List.of(),
                Level.UNKNOWN, Level.UNKNOWN, Horizon.UNKNOWN), List.of(),
                List.of(CanonicalPrimitive.INTOLERANCE_OF_UNCERTAINTY),
                "Is intolerance of uncertainty showing up here?");

        List<PatternObservation> observations = extractor.extract(null, snapshot);

        assertTrue(observations.contains(
                new PatternObservation(PatternKind.WORKFLOW_PREFERENCE, "prefers_confirm_then_execute", 0.4)));
        assertTrue(observations.stream().noneMatch(o -> "prefers_execute_immediately".equals(o.key())));
        assertTrue(observations.contains(
                new PatternObservation(PatternKind.RESOLUTION_PATTERN, "decision_stuck", 0.6)));
        assertTrue(observations.contains(
                new PatternObservation(PatternKind.NARRATIVE_PATTERN, "uncertainty_pressure", 0.4)));
        assertTrue(observations.contains(
                new PatternObservation(PatternKind.CONTRACTION_PATTERN, "contraction:uncertainty_pressure", 0.4)));
    }

    @Test
    void shouldLetExplicitDeactivationOverrideSnapshotSensitivity() {
        WorkingSnapshot snapshot = snapshot(new TurnContextFrame(Intent.UNKNOWN, List.of(),
                List.of(Constraint.SENSORY), Level.UNKNOWN, Level.UNKNOWN, Horizon.UNKNOWN), List.of(), List.of(),
                "");

        List<PatternObservation> observations = extractor.extract("The noise is not a problem anymore, "
                + "no longer an issue.", snapshot);

        assertTrue(observations.contains(
                new PatternObservation(PatternKind.CONSTRAINTS_SENSITIVITY, "sensory_noise", -0.6)));
        assertTrue(observations.stream().noneMatch(o -> "sensory_noise".equals(o.key()) && o.strength() > 0));
    }

    private static WorkingSnapshot snapshot(TurnContextFrame context, List<CanonicalPrimitive> dominant,
            List<CanonicalPrimitive> background, String question) {
        return new WorkingSnapshot(1, Instant.parse("2026-03-01T10:00:00Z"), context, dominant, background,
                CanonicalLens.SOFTENING, null, List.of(), question, "local");
    }
}
