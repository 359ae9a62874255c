package me.golemcore.clarity.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Local, bounded reading of one Turn: its context frame, the primitives that
 * dominate or sit in the background, the lenses chosen for them and, when the
 * reading is uncertain, one confirmation question for the user.
 *
 * <p>
 * Every bound is enforced on construction, so a snapshot read back from disk
 * is held to the same limits as a freshly built one.
 */
public record WorkingSnapshot(int version, Instant updatedAt, TurnContextFrame context,
        List<CanonicalPrimitive> dominantPrimitives, List<CanonicalPrimitive> backgroundPrimitives,
        CanonicalLens primaryLens, CanonicalLens secondaryLens, List<PrimitiveCandidate> candidates,
        String confirmationQuestion, String builtBy) {

    public static final int CURRENT_VERSION = 1;
    public static final int MAX_DOMINANT = 2;
    public static final int MAX_BACKGROUND = 1;
    public static final int MAX_CANDIDATES = 8;
    public static final int MAX_EVIDENCE_PER_CANDIDATE = 6;
    public static final int MAX_QUESTION_LENGTH = 160;
    public static final String BUILT_LOCALLY = "local";

    public WorkingSnapshot {
        version = version > 0 ? version : CURRENT_VERSION;
        context = context != null ? context : TurnContextFrame.EMPTY;
        dominantPrimitives = bounded(dominantPrimitives, MAX_DOMINANT);
        backgroundPrimitives = bounded(backgroundPrimitives, MAX_BACKGROUND);
        candidates = candidates == null ? List.of()
                : candidates.stream()
                        .filter(candidate -> candidate != null && candidate.primitive() != null)
                        .limit(MAX_CANDIDATES)
                        .map(candidate -> new PrimitiveCandidate(candidate.primitive(), candidate.score(),
                                candidate.confidence(),
                                candidate.evidence().stream().limit(MAX_EVIDENCE_PER_CANDIDATE).toList()))
                        .toList();
        confirmationQuestion = confirmationQuestion == null ? ""
                : confirmationQuestion.length() > MAX_QUESTION_LENGTH
                        ? confirmationQuestion.substring(0, MAX_QUESTION_LENGTH)
                        : confirmationQuestion;
        builtBy = builtBy != null && !builtBy.isBlank() ? builtBy : BUILT_LOCALLY;
    }

    public boolean needsConfirmation() {
        return !confirmationQuestion.isBlank();
    }

    public boolean isDominant(CanonicalPrimitive primitive) {
        return dominantPrimitives.contains(primitive);
    }

    public boolean isBackground(CanonicalPrimitive primitive) {
        return backgroundPrimitives.contains(primitive);
    }

    private static <T> List<T> bounded(List<T> values, int max) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).distinct().limit(max).toList();
    }
}
