package me.golemcore.clarity.adapter.inbound.web.controller;

import me.golemcore.clarity.adapter.inbound.web.dto.LearningToggleRequest;
import me.golemcore.clarity.domain.model.Capsule;
import me.golemcore.clarity.domain.model.CapsuleTendency;
import me.golemcore.clarity.domain.model.PatternKind;
import me.golemcore.clarity.domain.model.PatternStat;
import me.golemcore.clarity.domain.model.PreferenceEdits;
import me.golemcore.clarity.domain.service.CapsuleService;
import me.golemcore.clarity.domain.service.CapsuleSnapshotExporter;
import me.golemcore.clarity.domain.service.PatternLearningService;
import me.golemcore.clarity.infrastructure.config.AutoConfiguration;
import me.golemcore.clarity.infrastructure.config.ClarityProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CapsuleControllerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private CapsuleService capsuleService;
    private PatternLearningService patternLearningService;
    private CapsuleController controller;

    @BeforeEach
    void setUp() {
        capsuleService = mock(CapsuleService.class);
        patternLearningService = mock(PatternLearningService.class);
        CapsuleSnapshotExporter exporter = new CapsuleSnapshotExporter(new ClarityProperties(),
                AutoConfiguration.objectMapper());
        controller = new CapsuleController(capsuleService, exporter, patternLearningService,
                Clock.fixed(T0, ZoneOffset.UTC));
    }

    @Test
    void shouldReturnCapsule() {
        when(capsuleService.getCapsule()).thenReturn(Capsule.empty(T0));

        StepVerifier.create(controller.getCapsule())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(1, response.getBody().getVersion());
                })
                .verifyComplete();
    }

    @Test
    void shouldUpdatePreferences() {
        PreferenceEdits edits = PreferenceEdits.builder().outputStyle("bullets").build();
        Capsule updated = Capsule.empty(T0);
        updated.setVersion(2);
        updated.getPreferences().setOutputStyle("bullets");
        when(capsuleService.update(edits)).thenReturn(updated);

        StepVerifier.create(controller.updatePreferences(edits))
                .assertNext(response -> assertEquals("bullets", response.getBody().getPreferences().getOutputStyle()))
                .verifyComplete();
    }

    @Test
    void shouldToggleLearning() {
        Capsule disabled = Capsule.empty(T0);
        disabled.setLearningEnabled(false);
        when(capsuleService.setLearningEnabled(false)).thenReturn(disabled);

        StepVerifier.create(controller.setLearning(new LearningToggleRequest(false)))
                .assertNext(response -> assertFalse(response.getBody().isLearningEnabled()))
                .verifyComplete();
        verify(capsuleService).setLearningEnabled(false);
    }

    @Test
    void shouldResetLearning() {
        Capsule reset = Capsule.empty(T0);
        reset.setLearningResetAt(T0);
        when(capsuleService.resetLearnedProfile()).thenReturn(reset);

        StepVerifier.create(controller.resetLearning())
                .assertNext(response -> assertEquals(T0, response.getBody().getLearningResetAt()))
                .verifyComplete();
    }

    @Test
    void shouldExportSnapshotForTalkMode() {
        Capsule capsule = Capsule.empty(T0);
        List<CapsuleTendency> tendencies = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            tendencies.add(CapsuleTendency.builder()
                    .statement("Statement " + i)
                    .evidenceCount(2)
                    .kind(PatternKind.STYLE_PREFERENCE)
                    .key("key_" + i)
                    .lastSeenAt(T0)
                    .build());
        }
        capsule.setLearnedTendencies(tendencies);
        when(capsuleService.getCapsule()).thenReturn(capsule);

        StepVerifier.create(controller.export("talk"))
                .assertNext(response -> assertEquals(6, response.getBody().getLearnedCues().size()))
                .verifyComplete();
    }

    @Test
    void shouldOmitCuesFromExportWhenLearningDisabled() {
        Capsule capsule = Capsule.empty(T0);
        capsule.setLearningEnabled(false);
        capsule.setLearnedTendencies(List.of(CapsuleTendency.builder().statement("x").build()));
        when(capsuleService.getCapsule()).thenReturn(capsule);

        StepVerifier.create(controller.export("reflect"))
                .assertNext(response -> assertNull(response.getBody().getLearnedCues()))
                .verifyComplete();
    }

    @Test
    void shouldFilterAndClampPatternQuery() {
        List<PatternStat> stats = List.of(PatternStat.builder()
                .kind(PatternKind.CONSTRAINT_TRIGGER)
                .key("trigger:noise")
                .score(0.4)
                .build());
        when(patternLearningService.topPatterns(PatternKind.CONSTRAINT_TRIGGER, 100, T0)).thenReturn(stats);

        StepVerifier.create(controller.topPatterns("constraint_trigger", 5000))
                .assertNext(response -> assertEquals(stats, response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldQueryAllKindsWhenKindIsBlank() {
        when(patternLearningService.topPatterns(null, 1, T0)).thenReturn(List.of());

        StepVerifier.create(controller.topPatterns(" ", 0))
                .assertNext(response -> assertEquals(List.of(), response.getBody()))
                .verifyComplete();
        verify(patternLearningService).topPatterns(null, 1, T0);
    }
}
