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

import java.nio.charset.StandardCharsets;

/**
 * Deterministic 64-bit FNV-1a content fingerprint.
 *
 * <p>
 * Used for change detection (redaction input hashes, dictionary and snapshot
 * fingerprints), pattern row file names and payload tracing. Not
 * cryptographic: collisions are tolerated.
 */
public final class ContentFingerprint {

    static final long OFFSET_BASIS = 0xcbf29ce484222325L;
    static final long PRIME = 0x100000001b3L;

    private static final String NULL_FINGERPRINT = "nil";

    private ContentFingerprint() {
    }

    /**
     * Fingerprint of the UTF-8 bytes of {@code text}, as 16 lowercase hex
     * digits. {@code null} renders as {@code "nil"}.
     */
    public static String fnv1a64(String text) {
        if (text == null) {
            return NULL_FINGERPRINT;
        }
        return fnv1a64(text.getBytes(StandardCharsets.UTF_8));
    }

    public static String fnv1a64(byte[] bytes) {
        if (bytes == null) {
            return NULL_FINGERPRINT;
        }
        long hash = OFFSET_BASIS;
        for (byte b : bytes) {
            hash ^= b & 0xffL;
            hash *= PRIME;
        }
        return String.format("%016x", hash);
    }
}
