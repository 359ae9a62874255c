package me.golemcore.clarity.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.clarity.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.clarity.domain.model.Capsule;
import me.golemcore.clarity.domain.model.CaptureContext;
import me.golemcore.clarity.domain.model.PatternKind;
import me.golemcore.clarity.domain.model.PatternStat;
import me.golemcore.clarity.domain.model.TurnCompletedEvent;
import me.golemcore.clarity.domain.model.TurnSource;
import me.golemcore.clarity.infrastructure.config.AutoConfiguration;
import me.golemcore.clarity.infrastructure.config.ClarityProperties;
import me.golemcore.clarity.infrastructure.event.SpringEventBus;
import me.golemcore.clarity.port.outbound.AudioFilePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TurnLearningListenerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final String QUESTION_LIGHT_TEXT = "Please stop asking questions, just tell me.";
    private static final String LOOPING_TEXT = "I can't stop thinking about it, I keep replaying the call and "
            + "it's stuck in my head. Give me a step by step checklist.";

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private Clock clock;
    private TurnService turnService;
    private CapsuleService capsuleService;
    private PatternObservationExtractor extractor;
    private PatternLearningService patternLearningService;
    private LearningProjectionService projectionService;
    private TurnLearningListener listener;

    @BeforeEach
    void setUp() {
        ClarityProperties properties = new ClarityProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        clock = Clock.fixed(T0, ZoneOffset.UTC);

        turnService = new TurnService(storage, mock(AudioFilePort.class), new RedactionEngine(),
                new WorkingSnapshotBuilder(new TurnContextExtractor(), new PrimitiveCandidateExtractor()),
                mock(SpringEventBus.class), objectMapper, clock);
        patternLearningService = new PatternLearningService(storage, new PatternHalfLifePolicy(properties),
                objectMapper);
        capsuleService = new CapsuleService(storage, patternLearningService, objectMapper, clock);
        extractor = new PatternObservationExtractor(properties);
        projectionService = new LearningProjectionService(patternLearningService, capsuleService);
        listener = new TurnLearningListener(turnService, capsuleService, extractor, patternLearningService,
                projectionService, objectMapper, clock);
    }

    @Test
    void shouldObserveTurnAndRecordSnapshot() {
        String id = importAndPublish(QUESTION_LIGHT_TEXT);

        PatternStat stat = patternLearningService.all().get(0);
        assertEquals(PatternKind.WORKFLOW_PREFERENCE, stat.getKind());
        assertEquals("question_light", stat.getKey());
        assertTrue(turnService.require(id).getLearningSnapshotJson().contains("question_light"));
    }

    @Test
    void shouldProjectTendencyOnceEvidenceRepeats() {
        importAndPublish(QUESTION_LIGHT_TEXT);
        assertTrue(capsuleService.getCapsule().getLearnedTendencies().isEmpty());

        importAndPublish(QUESTION_LIGHT_TEXT);

        Capsule capsule = capsuleService.getCapsule();
        assertEquals(1, capsule.getLearnedTendencies().size());
        assertEquals("Prefers lighter questioning", capsule.getLearnedTendencies().get(0).getStatement());
        assertEquals(2, capsule.getLearnedTendencies().get(0).getEvidenceCount());
    }

    @Test
    void shouldLearnFromTurnOnlyOnceWhenCompletionIsDeliveredTwice() {
        String id = importAndPublish(QUESTION_LIGHT_TEXT);

        listener.onTurnCompleted(new TurnCompletedEvent(id, TurnSource.IMPORTED_TEXT, T0));

        assertEquals(1, patternLearningService.all().get(0).getCount());
        assertTrue(capsuleService.getCapsule().getLearnedTendencies().isEmpty());
        assertEquals(T0, turnService.require(id).getLearnedAt());
    }

    @Test
    void shouldLearnFromWorkingSnapshot() {
        importAndPublish(LOOPING_TEXT);

        List<String> keys = patternLearningService.all().stream().map(PatternStat::getKey).toList();
        assertTrue(keys.contains("bullets"));
        assertTrue(keys.contains("replay_loop"));
        assertTrue(keys.contains("contraction:mental_looping"));
    }

    @Test
    void shouldSkipLearningWhenDisabled() {
        capsuleService.setLearningEnabled(false);

        String id = importAndPublish(QUESTION_LIGHT_TEXT);

        assertTrue(patternLearningService.all().isEmpty());
        assertEquals("{}", turnService.require(id).getLearningSnapshotJson());
    }

    @Test
    void shouldIgnoreDeletedTurn() {
        listener.onTurnCompleted(new TurnCompletedEvent("gone", TurnSource.CAPTURED, T0));

        assertTrue(patternLearningService.all().isEmpty());
    }

    @Test
    void shouldLeaveSnapshotEmptyWhenNothingMatches() {
        String id = importAndPublish("Went for a walk by the river.");

        assertTrue(patternLearningService.all().isEmpty());
        assertEquals("{}", turnService.require(id).getLearningSnapshotJson());
    }

    @Test
    void shouldSwallowLearningFailures() {
        LearningProjectionService failing = mock(LearningProjectionService.class);
        when(failing.sync(any())).thenThrow(new IllegalStateException("projection broke"));
        TurnLearningListener fragile = new TurnLearningListener(turnService, capsuleService, extractor,
                patternLearningService, failing, objectMapper, clock);
        String id = turnService.createTextImport(QUESTION_LIGHT_TEXT, T0, CaptureContext.HANDHELD);

        assertDoesNotThrow(() -> fragile.onTurnCompleted(new TurnCompletedEvent(id, TurnSource.IMPORTED_TEXT, T0)));
        assertEquals(List.of("question_light"),
                patternLearningService.all().stream().map(PatternStat::getKey).toList());
    }

    private String importAndPublish(String text) {
        String id = turnService.createTextImport(text, T0, CaptureContext.HANDHELD);
        listener.onTurnCompleted(new TurnCompletedEvent(id, TurnSource.IMPORTED_TEXT, T0));
        return id;
    }
}
