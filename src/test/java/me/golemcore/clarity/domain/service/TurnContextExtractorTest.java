package me.golemcore.clarity.domain.service;

import me.golemcore.clarity.domain.model.TurnContextFrame;
import me.golemcore.clarity.domain.model.TurnContextFrame.Constraint;
import me.golemcore.clarity.domain.model.TurnContextFrame.Horizon;
import me.golemcore.clarity.domain.model.TurnContextFrame.Intent;
import me.golemcore.clarity.domain.model.TurnContextFrame.Level;
import me.golemcore.clarity.domain.model.TurnContextFrame.Output;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TurnContextExtractorTest {

    private final TurnContextExtractor extractor = new TurnContextExtractor();

    @Test
    void shouldReadDecisionUnderTimeAndMoneyPressure() {
        TurnContextFrame frame = extractor.extract("Should I take the job or not? I need a checklist, it's urgent "
                + "and the deadline is tomorrow. Money is tight, I can't afford it.");

        assertEquals(Intent.DECIDE, frame.intent());
        assertEquals(List.of(Output.STEPS, Output.CHECKLIST), frame.desiredOutputs());
        assertEquals(List.of(Constraint.TIME, Constraint.MONEY), frame.constraints());
        assertEquals(Level.HIGH, frame.urgency());
        assertEquals(Level.UNKNOWN, frame.stakeLevel());
        assertEquals(Horizon.UNKNOWN, frame.timeHorizon());
    }

    @Test
    void shouldReturnEmptyFrameForBlankText() {
        assertEquals(TurnContextFrame.EMPTY, extractor.extract("  "));
        assertEquals(TurnContextFrame.EMPTY, extractor.extract(null));
    }

    @Test
    void shouldCapConstraintsAndDesiredOutputs() {
        TurnContextFrame frame = extractor.extract("deadline, exhausted, budget, awkward, noisy, blocked, legal, "
                + "missing info. step by step options, what should i say, summarise, another perspective, "
                + "decision tree");

        assertEquals(List.of(Constraint.TIME, Constraint.ENERGY, Constraint.MONEY, Constraint.SOCIAL,
                Constraint.SENSORY, Constraint.DEPENDENCIES), frame.constraints());
        assertEquals(List.of(Output.STEPS, Output.CHECKLIST, Output.OPTIONS, Output.SCRIPT),
                frame.desiredOutputs());
    }

    @Test
    void shouldMatchWholeWordsOnly() {
        TurnContextFrame frame = extractor.extract("I watched a documentary about the planet, you know.");

        assertEquals(Intent.UNKNOWN, frame.intent());
        assertEquals(Horizon.UNKNOWN, frame.timeHorizon());
    }

    @Test
    void shouldPreferNowOverLaterHorizons() {
        TurnContextFrame frame = extractor.extract("I need this sorted right now, not next week.");

        assertEquals(Horizon.NOW, frame.timeHorizon());
        assertEquals(Level.HIGH, frame.urgency());
    }
}
