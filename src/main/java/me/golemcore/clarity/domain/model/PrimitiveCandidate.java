package me.golemcore.clarity.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A primitive scored against one Turn's text, with the matched phrases that
 * raised its score.
 *
 * @param score
 *            clamped to 0..100
 */
public record PrimitiveCandidate(CanonicalPrimitive primitive, int score, Confidence confidence,
        List<String> evidence) {

    public static final int DOMINANT_THRESHOLD = 70;
    public static final int BACKGROUND_THRESHOLD = 45;

    public PrimitiveCandidate {
        score = Math.max(0, Math.min(100, score));
        confidence = confidence != null ? confidence : Confidence.forScore(score);
        evidence = evidence == null ? List.of() : evidence.stream().filter(Objects::nonNull).toList();
    }

    public enum Confidence {
        LOW, MED, HIGH;

        public static Confidence forScore(int score) {
            if (score >= DOMINANT_THRESHOLD) {
                return HIGH;
            }
            return score >= BACKGROUND_THRESHOLD ? MED : LOW;
        }

        @JsonValue
        public String getWire() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Confidence fromWire(String value) {
            if (value == null) {
                return null;
            }
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (Confidence confidence : values()) {
                if (confidence.name().equals(normalized)) {
                    return confidence;
                }
            }
            return null;
        }
    }
}
