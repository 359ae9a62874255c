package me.golemcore.clarity.domain.model;

/**
 * A single signal extracted from one completed Turn. Negative strength weakens
 * an existing row and never creates one.
 */
public record PatternObservation(PatternKind kind, String key, double strength) {
}
