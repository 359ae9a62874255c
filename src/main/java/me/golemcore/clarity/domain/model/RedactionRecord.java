package me.golemcore.clarity.domain.model;

import java.time.Instant;

/**
 * Append-only provenance entry for one redaction application. Never updated,
 * only superseded by a newer record for the same turn.
 */
public record RedactionRecord(String turnId, int version, Instant timestamp, String inputHash,
        String dictionaryFingerprint, String redactedText) {
}
