package me.golemcore.clarity.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class ContentFingerprintTest {

    @Test
    void emptyInputIsOffsetBasis() {
        assertEquals("cbf29ce484222325", ContentFingerprint.fnv1a64(""));
    }

    @Test
    void matchesKnownVectors() {
        assertEquals("af63dc4c8601ec8c", ContentFingerprint.fnv1a64("a"));
        assertEquals("85944171f73967e8", ContentFingerprint.fnv1a64("foobar"));
    }

    @Test
    void nullRendersAsNil() {
        assertEquals("nil", ContentFingerprint.fnv1a64((String) null));
        assertEquals("nil", ContentFingerprint.fnv1a64((byte[]) null));
    }

    @Test
    void alwaysSixteenLowercaseHexDigits() {
        String fingerprint = ContentFingerprint.fnv1a64("I feel stuck at work");

        assertEquals(16, fingerprint.length());
        assertEquals(fingerprint.toLowerCase(), fingerprint);
        assertEquals(fingerprint, ContentFingerprint.fnv1a64("I feel stuck at work"));
        assertNotEquals(fingerprint, ContentFingerprint.fnv1a64("I feel stuck at home"));
    }
}
