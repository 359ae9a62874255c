package me.golemcore.clarity.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.clarity.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.clarity.domain.exception.StorageException;
import me.golemcore.clarity.domain.exception.TurnValidationException;
import me.golemcore.clarity.domain.model.CaptureContext;
import me.golemcore.clarity.domain.model.TranscriptionProvider;
import me.golemcore.clarity.domain.model.Turn;
import me.golemcore.clarity.domain.model.TurnState;
import me.golemcore.clarity.infrastructure.config.AutoConfiguration;
import me.golemcore.clarity.infrastructure.config.ClarityProperties;
import me.golemcore.clarity.infrastructure.event.SpringEventBus;
import me.golemcore.clarity.port.outbound.AudioFilePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.InOrder;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CapturePipelineServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private ClarityProperties properties;
    private TurnService turnService;
    private RedactionDictionaryService dictionaryService;
    private Clock clock;
    private CapturePipelineService pipeline;

    @BeforeEach
    void setUp() {
        properties = new ClarityProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        ObjectMapper objectMapper = AutoConfiguration.objectMapper();
        clock = Clock.fixed(T0, ZoneOffset.UTC);
        RedactionEngine engine = new RedactionEngine();

        turnService = new TurnService(storage, mock(AudioFilePort.class), engine,
                new WorkingSnapshotBuilder(new TurnContextExtractor(), new PrimitiveCandidateExtractor()),
                mock(SpringEventBus.class), objectMapper, clock);
        dictionaryService = new RedactionDictionaryService(storage, objectMapper);
        pipeline = new CapturePipelineService(turnService, dictionaryService, engine, properties, clock);
    }

    @Test
    void shouldStartCaptureInRecordingState() {
        String id = pipeline.startCapture("/audio/a.m4a", CaptureContext.HANDHELD);

        Turn turn = turnService.require(id);
        assertEquals(TurnState.RECORDING, turn.getState());
        assertEquals(T0, turn.getRecordedAt());
    }

    @Test
    void shouldRedactTranscriptAndKeepRawWhenAllowed() {
        String id = pipeline.startCapture("/audio/a.m4a", CaptureContext.HANDHELD);
        pipeline.finishRecording(id, T0.plusSeconds(20), 1024L);

        Turn ready = pipeline.handleTranscriptArrived(id, "Email me at jane@example.com about the rota tomorrow",
                T0.plusSeconds(20), TranscriptionProvider.ON_DEVICE, "en-GB");

        assertEquals(TurnState.READY, ready.getState());
        assertEquals("Email me at [EMAIL] about the rota tomorrow", ready.getTranscriptRedactedActive());
        assertEquals("Email me at jane@example.com about the rota tomorrow", ready.getTranscriptRaw());
        assertEquals("Email me at [EMAIL] about the rota", ready.getTitle());
        assertEquals(TranscriptionProvider.ON_DEVICE, ready.getTranscriptionProvider());
        assertEquals(1, turnService.redactionHistory(id).size());
    }

    @Test
    void shouldStepThroughTranscribedRawBeforeRedacting() {
        TurnService tracked = spy(turnService);
        CapturePipelineService trackedPipeline = new CapturePipelineService(tracked, dictionaryService,
                new RedactionEngine(), properties, clock);
        String id = trackedPipeline.startCapture("/audio/a.m4a", CaptureContext.HANDHELD);

        trackedPipeline.handleTranscriptArrived(id, "hello there", T0.plusSeconds(5));

        InOrder order = inOrder(tracked);
        order.verify(tracked).markTranscribing(eq(id), any(), any());
        order.verify(tracked).markTranscribedRaw(id);
        order.verify(tracked).markRedacting(id);
        order.verify(tracked).markReady(eq(id), any(), any(), any(), anyInt(), any(), any());
    }

    @Test
    void shouldDropRawTranscriptWhenStorageOfRawIsDisabled() {
        properties.getPrivacy().setStoreRawTranscript(false);
        String id = pipeline.startCapture("/audio/a.m4a", CaptureContext.HANDHELD);

        Turn ready = pipeline.handleTranscriptArrived(id, "call 07700 900123 later", null);

        assertNull(ready.getTranscriptRaw());
        assertFalse(ready.getTranscriptRedactedActive().contains("07700"));
        assertEquals(T0, ready.getEndedAt());
    }

    @Test
    void shouldApplyUserDictionary() {
        dictionaryService.add("Alice");
        String id = pipeline.startCapture("/audio/a.m4a", CaptureContext.HANDHELD);

        Turn ready = pipeline.handleTranscriptArrived(id, "alice said no", null);

        assertEquals("[CUSTOM] said no", ready.getTranscriptRedactedActive());
    }

    @Test
    void shouldIgnoreBlankTranscript() {
        String id = pipeline.startCapture("/audio/a.m4a", CaptureContext.HANDHELD);

        Turn turn = pipeline.handleTranscriptArrived(id, "   ", null);

        assertEquals(TurnState.RECORDING, turn.getState());
        assertTrue(turnService.redactionHistory(id).isEmpty());
    }

    @Test
    void shouldImportTextAsReadyTurnWithoutRaw() {
        String id = pipeline.importText("I feel stuck at work", CaptureContext.INTENT);

        Turn turn = turnService.require(id);
        assertEquals(TurnState.READY, turn.getState());
        assertEquals("I feel stuck at work", turn.getTranscriptRedactedActive());
        assertNull(turn.getTranscriptRaw());
        assertEquals("I feel stuck at work", turn.getTitle());
    }

    @Test
    void shouldRedactImportedText() {
        String id = pipeline.importText("  my card is 4111 1111 1111 1111  ", null);

        assertEquals("my card is [CARD]", turnService.require(id).getTranscriptRedactedActive());
    }

    @Test
    void shouldRejectBlankImport() {
        assertThrows(TurnValidationException.class, () -> pipeline.importText("   \n  ", CaptureContext.HANDHELD));
        assertThrows(TurnValidationException.class, () -> pipeline.importText(null, CaptureContext.HANDHELD));
        assertTrue(turnService.listNewestFirst().isEmpty());
    }

    @Test
    void shouldMapTranscriptionErrorToUserFacingKey() {
        String id = pipeline.startCapture("/audio/a.m4a", CaptureContext.HANDHELD);

        Turn failed = pipeline.handleTranscriptionError(id, "Speech not authorised by user");

        assertEquals(TurnState.FAILED, failed.getState());
        assertEquals("speech_denied", failed.getError().getUserFacingKey());
        assertEquals(403, failed.getError().getCode());
        assertEquals("clarity.transcription", failed.getError().getDomain());
        assertEquals("Speech not authorised by user", failed.getError().getDebugMessage());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Speech not authorized                  | speech_denied",
            "SPEECH RECOGNISER UNAVAILABLE           | speech_unavailable",
            "speech recognizer unavailable offline   | speech_unavailable",
            "No transcript captured                  | no_transcript",
            "Something odd happened                  | unknown",
    })
    void shouldClassifyTranscriptionErrors(String message, String expectedKey) {
        assertEquals(expectedKey, CapturePipelineService.userFacingKey(message));
    }

    @Test
    void shouldTreatMissingErrorMessageAsUnknown() {
        assertEquals("unknown", CapturePipelineService.userFacingKey(null));
        assertEquals("unknown", CapturePipelineService.userFacingKey(" "));
    }

    @Test
    void shouldBuildAutoTitleFromFirstSevenWords() {
        assertEquals("one two three four five six seven",
                CapturePipelineService.autoTitle("  one two   three four five six seven eight nine"));
        assertNull(CapturePipelineService.autoTitle("  "));
    }

    @Test
    void shouldCapAutoTitleLength() {
        String title = CapturePipelineService.autoTitle(
                "extraordinarily complicated circumstances surrounding yesterday's unexpected meeting");

        assertTrue(title.length() <= CapturePipelineService.AUTO_TITLE_MAX_CHARS);
        assertTrue(title.startsWith("extraordinarily complicated"));
    }

    @Test
    void shouldMarkTurnFailedWhenProcessingFails() {
        TurnService turns = mock(TurnService.class);
        RedactionDictionaryService dictionary = mock(RedactionDictionaryService.class);
        when(dictionary.tokens()).thenReturn(List.of());
        when(dictionary.fingerprint()).thenReturn("fp");
        StorageException failure = new StorageException("disk full", new IllegalStateException("io"));
        when(turns.applyRedaction(eq("t1"), anyString(), anyList(), anyString(), anyInt())).thenThrow(failure);
        CapturePipelineService failing = new CapturePipelineService(turns, dictionary, new RedactionEngine(),
                properties, clock);

        StorageException thrown = assertThrows(StorageException.class,
                () -> failing.handleTranscriptArrived("t1", "hello there", null));

        assertSame(failure, thrown);
        verify(turns).markFailed("t1", "disk full");
        verify(turns).markTranscribing(eq("t1"), any(), any());
    }
}
