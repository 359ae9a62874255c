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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.clarity.domain.exception.ReflectGatewayException;
import me.golemcore.clarity.domain.exception.TurnValidationException;
import me.golemcore.clarity.domain.model.CapsuleMode;
import me.golemcore.clarity.domain.model.CapsuleSnapshot;
import me.golemcore.clarity.domain.model.ReflectProvider;
import me.golemcore.clarity.domain.model.ReflectRequest;
import me.golemcore.clarity.domain.model.ReflectResponse;
import me.golemcore.clarity.domain.model.ReflectTool;
import me.golemcore.clarity.domain.model.StepsProgramme;
import me.golemcore.clarity.domain.model.StepsResponse;
import me.golemcore.clarity.domain.model.TalkRequest;
import me.golemcore.clarity.domain.model.TalkResponse;
import me.golemcore.clarity.domain.model.Turn;
import me.golemcore.clarity.infrastructure.config.ClarityProperties;
import me.golemcore.clarity.port.outbound.ReflectGatewayPort;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;

/**
 * Runs reflection tools and talk continuations for a Turn against the remote
 * reasoning service.
 *
 * <p>
 * Only the redacted transcript and the exported Capsule snapshot are sent.
 * Single-shot tools and content lists fall back to
 * {@link LocalReflectionFallback} on any gateway failure; talk has no local
 * equivalent and propagates the failure.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReflectService {

    private final TurnService turnService;
    private final CapsuleService capsuleService;
    private final CapsuleSnapshotExporter exporter;
    private final ReflectGatewayPort gateway;
    private final LocalReflectionFallback fallback;
    private final ClarityProperties properties;

    public Turn runTool(String turnId, ReflectTool tool) {
        Turn turn = turnService.require(turnId);
        String text = requireRedactedText(turn);
        CapsuleSnapshot snapshot = exporter.project(capsuleService.getCapsule(), CapsuleMode.REFLECT);
        ClarityProperties.ReflectProperties config = properties.getReflect();

        ReflectRequest request = new ReflectRequest(text, iso(turn), config.getClient(), config.getAppVersion(),
                snapshot);
        try {
            ReflectResponse response = gateway.runTool(tool, request);
            log.info("[Reflect] {} completed for turn {}", tool.getWire(), turnId);
            return turnService.recordReflection(turnId, tool, response.text(), response.promptVersion(),
                    ReflectProvider.CLOUD_TAP, exporter.hash(snapshot));
        } catch (ReflectGatewayException e) {
            log.warn("[Reflect] {} failed for turn {} ({}), using local content", tool.getWire(), turnId,
                    e.getKind());
            ReflectResponse local = fallback.reflect(tool);
            return turnService.recordReflection(turnId, tool, local.text(), local.promptVersion(),
                    ReflectProvider.NONE, null);
        }
    }

    /**
     * Send one talk message, continuing from the Turn's stored response id.
     *
     * @throws ReflectGatewayException
     *             if the gateway call fails
     */
    public TalkResponse talk(String turnId, String userText) {
        if (userText == null || userText.isBlank()) {
            throw new TurnValidationException("Talk message must not be blank");
        }
        Turn turn = turnService.require(turnId);
        CapsuleSnapshot snapshot = exporter.project(capsuleService.getCapsule(), CapsuleMode.TALK);
        ClarityProperties.ReflectProperties config = properties.getReflect();

        TalkRequest request = new TalkRequest(userText.trim(), iso(turn), config.getClient(),
                config.getAppVersion(), turn.getTalkLastResponseId(), snapshot);
        TalkResponse response = gateway.talk(request);
        turnService.recordTalkContinuation(turnId, response.responseId(), response.promptVersion());
        log.info("[Reflect] talk continued for turn {}", turnId);
        return response;
    }

    public StepsResponse steps(StepsProgramme kind, String programme) {
        try {
            return gateway.steps(kind, programme);
        } catch (ReflectGatewayException e) {
            log.warn("[Reflect] {} unavailable ({}), using local list", kind.getEndpoint(), e.getKind());
            return fallback.steps(kind, programme);
        }
    }

    private static String requireRedactedText(Turn turn) {
        String text = turn.getTranscriptRedactedActive();
        if (text == null || text.isBlank()) {
            throw new IllegalStateException("Turn " + turn.getId() + " has no transcript yet");
        }
        return text;
    }

    private static String iso(Turn turn) {
        return turn.getRecordedAt() != null ? DateTimeFormatter.ISO_INSTANT.format(turn.getRecordedAt()) : null;
    }
}
