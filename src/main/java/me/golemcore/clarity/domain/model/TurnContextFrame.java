package me.golemcore.clarity.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * What a Turn is for, read from explicit phrases: the primary intent, the
 * outputs asked for, the constraints named, and how pressing it is.
 * Desired outputs are capped at {@value #MAX_DESIRED_OUTPUTS} and constraints
 * at {@value #MAX_CONSTRAINTS}, both de-duplicated in first-seen order.
 */
public record TurnContextFrame(Intent intent, List<Output> desiredOutputs, List<Constraint> constraints,
        Level stakeLevel, Level urgency, Horizon timeHorizon) {

    public static final int MAX_DESIRED_OUTPUTS = 4;
    public static final int MAX_CONSTRAINTS = 6;

    public static final TurnContextFrame EMPTY = new TurnContextFrame(Intent.UNKNOWN, List.of(), List.of(),
            Level.UNKNOWN, Level.UNKNOWN, Horizon.UNKNOWN);

    public TurnContextFrame {
        intent = intent != null ? intent : Intent.UNKNOWN;
        desiredOutputs = bounded(desiredOutputs, MAX_DESIRED_OUTPUTS);
        constraints = bounded(constraints, MAX_CONSTRAINTS);
        stakeLevel = stakeLevel != null ? stakeLevel : Level.UNKNOWN;
        urgency = urgency != null ? urgency : Level.UNKNOWN;
        timeHorizon = timeHorizon != null ? timeHorizon : Horizon.UNKNOWN;
    }

    private static <T> List<T> bounded(List<T> values, int max) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).distinct().limit(max).toList();
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String value, E fallback) {
        if (value == null) {
            return fallback;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(normalized)) {
                return constant;
            }
        }
        return fallback;
    }

    public enum Intent {
        DECIDE, PLAN, VENT, UNDERSTAND, REHEARSE, DEBRIEF, CREATE, UNKNOWN;

        @JsonValue
        public String getWire() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Intent fromWire(String value) {
            return parse(Intent.class, value, UNKNOWN);
        }
    }

    public enum Output {
        STEPS, OPTIONS, SCRIPT, SUMMARY, REFRAME, DECISION_TREE, CHECKLIST, QUESTIONS;

        @JsonValue
        public String getWire() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Output fromWire(String value) {
            return parse(Output.class, value, null);
        }
    }

    public enum Constraint {
        TIME, ENERGY, MONEY, SOCIAL, SENSORY, LEGAL, DEPENDENCIES, INFORMATION;

        @JsonValue
        public String getWire() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Constraint fromWire(String value) {
            return parse(Constraint.class, value, null);
        }
    }

    /** Shared scale for stake level and urgency. */
    public enum Level {
        LOW, MED, HIGH, UNKNOWN;

        @JsonValue
        public String getWire() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Level fromWire(String value) {
            return parse(Level.class, value, UNKNOWN);
        }
    }

    public enum Horizon {
        NOW, TODAY, WEEK, LONGER, UNKNOWN;

        @JsonValue
        public String getWire() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Horizon fromWire(String value) {
            return parse(Horizon.class, value, UNKNOWN);
        }
    }
}
