package me.golemcore.clarity.domain.service;

import me.golemcore.clarity.domain.model.Capsule;
import me.golemcore.clarity.domain.model.CapsuleMode;
import me.golemcore.clarity.domain.model.CapsuleSnapshot;
import me.golemcore.clarity.domain.model.CapsuleTendency;
import me.golemcore.clarity.domain.model.LearnedCue;
import me.golemcore.clarity.domain.model.PatternKind;
import me.golemcore.clarity.infrastructure.config.AutoConfiguration;
import me.golemcore.clarity.infrastructure.config.ClarityProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CapsuleSnapshotExporterTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private CapsuleSnapshotExporter exporter;

    @BeforeEach
    void setUp() {
        exporter = new CapsuleSnapshotExporter(new ClarityProperties(), AutoConfiguration.objectMapper());
    }

    @Test
    void shouldReturnNullWithoutCapsule() {
        assertNull(exporter.project(null, CapsuleMode.REFLECT));
        assertNull(exporter.hash(null));
    }

    @Test
    void shouldExportVersionAndTypedPreferences() {
        Capsule capsule = Capsule.empty(T0);
        capsule.setVersion(7);
        capsule.getPreferences().setOutputStyle("  bullets  ");
        capsule.getPreferences().setOptionsBeforeQuestions(true);
        capsule.getPreferences().setNoPersona(false);
        capsule.getPreferences().setPseudonym("Sam");

        CapsuleSnapshot snapshot = exporter.project(capsule, CapsuleMode.REFLECT);

        assertEquals(7, snapshot.getVersion());
        assertEquals("2026-03-01T10:00:00Z", snapshot.getUpdatedAt());
        assertEquals(Map.of("output_style", "bullets", "options_before_questions", "true", "no_persona", "false"),
                snapshot.getPreferences());
    }

    @Test
    void shouldBoundExtras() {
        Capsule capsule = Capsule.empty(T0);
        for (int i = 0; i < 40; i++) {
            capsule.getPreferences().getExtras().put(String.format("extra_key_%02d_%s", i, "k".repeat(30)),
                    "v".repeat(200));
        }

        Map<String, String> preferences = exporter.project(capsule, CapsuleMode.REFLECT).getPreferences();

        assertTrue(preferences.size() <= 24);
        preferences.forEach((key, value) -> {
            assertTrue(key.length() <= 32, key);
            assertTrue(value.length() <= 128);
        });
    }

    @Test
    void shouldExportTypedPreferencesOnTopOfFullExtras() {
        Capsule capsule = Capsule.empty(T0);
        capsule.getPreferences().setOutputStyle("bullets");
        capsule.getPreferences().setOptionsBeforeQuestions(true);
        capsule.getPreferences().setNoTherapyFraming(true);
        capsule.getPreferences().setNoPersona(true);
        for (int i = 0; i < 40; i++) {
            capsule.getPreferences().getExtras().put(String.format("extra_%02d", i), "value");
        }

        Map<String, String> preferences = exporter.project(capsule, CapsuleMode.REFLECT).getPreferences();

        assertEquals(28, preferences.size());
        assertEquals("bullets", preferences.get("output_style"));
        assertEquals("true", preferences.get("no_persona"));
        assertTrue(preferences.containsKey("extra_23"));
        assertFalse(preferences.containsKey("extra_24"));
    }

    @Test
    void shouldSkipBlankExtraValues() {
        Capsule capsule = Capsule.empty(T0);
        capsule.getPreferences().getExtras().put("tone", "   ");

        assertNull(exporter.project(capsule, CapsuleMode.REFLECT).getPreferences());
    }

    @Test
    void shouldOmitCuesWhenLearningDisabled() {
        Capsule capsule = capsuleWithTendencies(3);
        capsule.setLearningEnabled(false);

        CapsuleSnapshot snapshot = exporter.project(capsule, CapsuleMode.REFLECT);

        assertNull(snapshot.getLearnedCues());
    }

    @Test
    void shouldCapCuesByMode() {
        Capsule capsule = capsuleWithTendencies(20);

        assertEquals(12, exporter.project(capsule, CapsuleMode.REFLECT).getLearnedCues().size());
        assertEquals(6, exporter.project(capsule, CapsuleMode.TALK).getLearnedCues().size());
    }

    @Test
    void shouldSkipOverriddenTendenciesAndClampEvidence() {
        Capsule capsule = Capsule.empty(T0);
        capsule.setLearnedTendencies(List.of(
                tendency("Prefers bullet points", "bullets", 5000, true),
                tendency("  " + "x".repeat(200) + "  ", "long", 0, false)));

        List<LearnedCue> cues = exporter.project(capsule, CapsuleMode.REFLECT).getLearnedCues();

        assertEquals(1, cues.size());
        LearnedCue cue = cues.get(0);
        assertEquals(140, cue.getStatement().length());
        assertEquals(1, cue.getEvidenceCount());
        assertEquals("style_preference", cue.getKindRaw());
        assertEquals("long", cue.getKey());
        assertEquals("2026-03-01T10:00:00Z", cue.getLastSeenAtISO());
    }

    @Test
    void shouldClampEvidenceCountAbove999() {
        Capsule capsule = Capsule.empty(T0);
        capsule.setLearnedTendencies(List.of(tendency("Prefers bullet points", "bullets", 5000, false)));

        assertEquals(999, exporter.project(capsule, CapsuleMode.REFLECT).getLearnedCues().get(0).getEvidenceCount());
    }

    @Test
    void shouldHashStablyAndDetectChanges() {
        Capsule capsule = capsuleWithTendencies(2);
        String first = exporter.hash(exporter.project(capsule, CapsuleMode.REFLECT));
        String second = exporter.hash(exporter.project(capsule, CapsuleMode.REFLECT));

        capsule.getPreferences().setOutputStyle("bullets");
        String changed = exporter.hash(exporter.project(capsule, CapsuleMode.REFLECT));

        assertEquals(16, first.length());
        assertEquals(first, second);
        assertNotEquals(first, changed);
    }

    private static Capsule capsuleWithTendencies(int count) {
        Capsule capsule = Capsule.empty(T0);
        List<CapsuleTendency> tendencies = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            tendencies.add(tendency("Statement " + i, "key_" + i, 2, false));
        }
        capsule.setLearnedTendencies(tendencies);
        return capsule;
    }

    private static CapsuleTendency tendency(String statement, String key, int evidence, boolean overridden) {
        return CapsuleTendency.builder()
                .statement(statement)
                .evidenceCount(evidence)
                .firstSeenAt(T0)
                .lastSeenAt(T0)
                .overridden(overridden)
                .kind(PatternKind.STYLE_PREFERENCE)
                .key(key)
                .build();
    }
}
