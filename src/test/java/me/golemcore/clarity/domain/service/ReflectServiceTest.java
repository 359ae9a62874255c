package me.golemcore.clarity.domain.service;

import me.golemcore.clarity.domain.exception.ReflectGatewayException;
import me.golemcore.clarity.domain.exception.TurnNotFoundException;
import me.golemcore.clarity.domain.exception.TurnValidationException;
import me.golemcore.clarity.domain.model.Capsule;
import me.golemcore.clarity.domain.model.ReflectProvider;
import me.golemcore.clarity.domain.model.ReflectRequest;
import me.golemcore.clarity.domain.model.ReflectResponse;
import me.golemcore.clarity.domain.model.ReflectTool;
import me.golemcore.clarity.domain.model.StepsProgramme;
import me.golemcore.clarity.domain.model.StepsResponse;
import me.golemcore.clarity.domain.model.TalkRequest;
import me.golemcore.clarity.domain.model.TalkResponse;
import me.golemcore.clarity.domain.model.Turn;
import me.golemcore.clarity.domain.model.TurnState;
import me.golemcore.clarity.infrastructure.config.AutoConfiguration;
import me.golemcore.clarity.infrastructure.config.ClarityProperties;
import me.golemcore.clarity.port.outbound.ReflectGatewayPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReflectServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final String TURN_ID = "turn-1";

    private TurnService turnService;
    private CapsuleService capsuleService;
    private CapsuleSnapshotExporter exporter;
    private ReflectGatewayPort gateway;
    private ReflectService service;

    @BeforeEach
    void setUp() {
        turnService = mock(TurnService.class);
        capsuleService = mock(CapsuleService.class);
        gateway = mock(ReflectGatewayPort.class);
        ClarityProperties properties = new ClarityProperties();
        exporter = new CapsuleSnapshotExporter(properties, AutoConfiguration.objectMapper());
        service = new ReflectService(turnService, capsuleService, exporter, gateway, new LocalReflectionFallback(),
                properties);

        Capsule capsule = Capsule.empty(T0);
        capsule.getPreferences().setOutputStyle("bullets");
        when(capsuleService.getCapsule()).thenReturn(capsule);
    }

    @Test
    void shouldSendRedactedTextOnlyAndRecordCloudResult() {
        when(turnService.require(TURN_ID)).thenReturn(turn("I feel stuck at [EMAIL]"));
        when(gateway.runTool(eq(ReflectTool.REFLECT), any())).thenReturn(new ReflectResponse("reflection", "v4"));

        service.runTool(TURN_ID, ReflectTool.REFLECT);

        ArgumentCaptor<ReflectRequest> request = ArgumentCaptor.forClass(ReflectRequest.class);
        verify(gateway).runTool(eq(ReflectTool.REFLECT), request.capture());
        assertEquals("I feel stuck at [EMAIL]", request.getValue().text());
        assertEquals("2026-03-01T10:00:00Z", request.getValue().recordedAt());
        assertEquals("clarity-java", request.getValue().client());
        assertEquals("bullets", request.getValue().capsule().getPreferences().get("output_style"));

        String expectedHash = exporter.hash(request.getValue().capsule());
        verify(turnService).recordReflection(TURN_ID, ReflectTool.REFLECT, "reflection", "v4",
                ReflectProvider.CLOUD_TAP, expectedHash);
    }

    @Test
    void shouldFallBackToLocalContentOnGatewayFailure() {
        when(turnService.require(TURN_ID)).thenReturn(turn("some text"));
        when(gateway.runTool(eq(ReflectTool.QUESTIONS), any()))
                .thenThrow(ReflectGatewayException.network(new IOException("offline")));

        service.runTool(TURN_ID, ReflectTool.QUESTIONS);

        verify(turnService).recordReflection(eq(TURN_ID), eq(ReflectTool.QUESTIONS), anyString(),
                eq(LocalReflectionFallback.PROMPT_VERSION), eq(ReflectProvider.NONE), isNull());
    }

    @Test
    void shouldRejectToolRunWithoutTranscript() {
        when(turnService.require(TURN_ID)).thenReturn(turn("  "));

        assertThrows(IllegalStateException.class, () -> service.runTool(TURN_ID, ReflectTool.OPTIONS));
        verify(gateway, never()).runTool(any(), any());
    }

    @Test
    void shouldPropagateUnknownTurn() {
        when(turnService.require("missing")).thenThrow(new TurnNotFoundException("missing"));

        assertThrows(TurnNotFoundException.class, () -> service.runTool("missing", ReflectTool.REFLECT));
    }

    @Test
    void shouldContinueTalkFromStoredResponseId() {
        Turn turn = turn("some text");
        turn.setTalkLastResponseId("resp_1");
        when(turnService.require(TURN_ID)).thenReturn(turn);
        when(gateway.talk(any())).thenReturn(new TalkResponse("go on", "resp_2", "talk-v1"));

        TalkResponse response = service.talk(TURN_ID, "  and then?  ");

        ArgumentCaptor<TalkRequest> request = ArgumentCaptor.forClass(TalkRequest.class);
        verify(gateway).talk(request.capture());
        assertEquals("and then?", request.getValue().text());
        assertEquals("resp_1", request.getValue().previousResponseId());
        assertEquals("go on", response.text());
        verify(turnService).recordTalkContinuation(TURN_ID, "resp_2", "talk-v1");
    }

    @Test
    void shouldPropagateTalkFailureWithoutRecording() {
        when(turnService.require(TURN_ID)).thenReturn(turn("some text"));
        when(gateway.talk(any())).thenThrow(ReflectGatewayException.http(500, "boom"));

        assertThrows(ReflectGatewayException.class, () -> service.talk(TURN_ID, "hello"));
        verify(turnService, never()).recordTalkContinuation(anyString(), any(), any());
    }

    @Test
    void shouldRejectBlankTalkMessage() {
        assertThrows(TurnValidationException.class, () -> service.talk(TURN_ID, " "));
        verify(gateway, never()).talk(any());
    }

    @Test
    void shouldFallBackToLocalSteps() {
        when(gateway.steps(StepsProgramme.FOCUS, null)).thenThrow(ReflectGatewayException.unavailable("disabled"));

        StepsResponse steps = service.steps(StepsProgramme.FOCUS, null);

        assertEquals("core", steps.programmeSlug());
        assertEquals(3, steps.count());
        assertEquals("Training attention", steps.steps().get(0).title());
    }

    @Test
    void shouldReturnRemoteStepsWhenAvailable() {
        StepsResponse remote = new StepsResponse("starter_5day", 0, 1, List.of());
        when(gateway.steps(StepsProgramme.REFLECT, "starter_5day")).thenReturn(remote);

        assertSame(remote, service.steps(StepsProgramme.REFLECT, "starter_5day"));
    }

    private static Turn turn(String redacted) {
        return Turn.builder()
                .id(TURN_ID)
                .recordedAt(T0)
                .state(TurnState.READY)
                .transcriptRedactedActive(redacted)
                .build();
    }
}
