package me.golemcore.clarity.adapter.inbound.web.controller;

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
import me.golemcore.clarity.adapter.inbound.web.dto.CaptureRequest;
import me.golemcore.clarity.adapter.inbound.web.dto.FailureRequest;
import me.golemcore.clarity.adapter.inbound.web.dto.ImportTextRequest;
import me.golemcore.clarity.adapter.inbound.web.dto.RenameRequest;
import me.golemcore.clarity.adapter.inbound.web.dto.TalkMessageRequest;
import me.golemcore.clarity.adapter.inbound.web.dto.TranscriptRequest;
import me.golemcore.clarity.adapter.inbound.web.dto.TurnDetailDto;
import me.golemcore.clarity.adapter.inbound.web.dto.TurnSummaryDto;
import me.golemcore.clarity.domain.model.CaptureContext;
import me.golemcore.clarity.domain.model.ReflectTool;
import me.golemcore.clarity.domain.model.TalkResponse;
import me.golemcore.clarity.domain.model.ToolOutput;
import me.golemcore.clarity.domain.model.TranscriptionProvider;
import me.golemcore.clarity.domain.model.Turn;
import me.golemcore.clarity.domain.model.TurnError;
import me.golemcore.clarity.domain.model.WorkingSnapshot;
import me.golemcore.clarity.domain.service.CapturePipelineService;
import me.golemcore.clarity.domain.service.ReflectService;
import me.golemcore.clarity.domain.service.TurnService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turn capture, import and reflection endpoints. Responses carry the redacted
 * transcript only.
 */
@RestController
@RequestMapping("/api/turns")
@RequiredArgsConstructor
@Slf4j
public class TurnsController {

    private final TurnService turnService;
    private final CapturePipelineService pipelineService;
    private final ReflectService reflectService;

    @GetMapping
    public Mono<ResponseEntity<List<TurnSummaryDto>>> listTurns() {
        List<TurnSummaryDto> dtos = turnService.listNewestFirst().stream()
                .map(TurnsController::toSummary)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<TurnDetailDto>> getTurn(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(toDetail(turnService.require(id))));
    }

    @PostMapping("/capture")
    public Mono<ResponseEntity<TurnDetailDto>> startCapture(@RequestBody CaptureRequest request) {
        String id = pipelineService.startCapture(request.getAudioPath(),
                CaptureContext.fromWire(request.getCaptureContext()));
        log.info("[API] Capture started: {}", id);
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toDetail(turnService.require(id))));
    }

    @PostMapping("/import")
    public Mono<ResponseEntity<TurnDetailDto>> importText(@RequestBody ImportTextRequest request) {
        String id = pipelineService.importText(request.getText(),
                CaptureContext.fromWire(request.getCaptureContext()));
        log.info("[API] Text imported: {}", id);
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toDetail(turnService.require(id))));
    }

    @PostMapping("/{id}/transcript")
    public Mono<ResponseEntity<TurnDetailDto>> submitTranscript(@PathVariable String id,
            @RequestBody TranscriptRequest request) {
        Turn turn = pipelineService.handleTranscriptArrived(id, request.getTranscript(), request.getEndedAt(),
                request.getProvider() != null ? TranscriptionProvider.fromWire(request.getProvider()) : null,
                request.getLocale());
        return Mono.just(ResponseEntity.ok(toDetail(turn)));
    }

    @PostMapping("/{id}/failed")
    public Mono<ResponseEntity<TurnDetailDto>> reportFailure(@PathVariable String id,
            @RequestBody FailureRequest request) {
        Turn turn = pipelineService.handleTranscriptionError(id, request.getMessage());
        return Mono.just(ResponseEntity.ok(toDetail(turn)));
    }

    @PutMapping("/{id}/title")
    public Mono<ResponseEntity<TurnDetailDto>> rename(@PathVariable String id, @RequestBody RenameRequest request) {
        return Mono.just(ResponseEntity.ok(toDetail(turnService.rename(id, request.getTitle()))));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteTurn(@PathVariable String id) {
        if (!turnService.delete(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Turn not found: " + id);
        }
        return Mono.just(ResponseEntity.noContent().build());
    }

    @PostMapping("/{id}/reflect/{tool}")
    public Mono<ResponseEntity<TurnDetailDto>> runTool(@PathVariable String id, @PathVariable String tool) {
        ReflectTool reflectTool = ReflectTool.fromWire(tool);
        return Mono.fromCallable(() -> ResponseEntity.ok(toDetail(reflectService.runTool(id, reflectTool))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{id}/talk")
    public Mono<ResponseEntity<TalkReply>> talk(@PathVariable String id, @RequestBody TalkMessageRequest request) {
        return Mono.fromCallable(() -> {
            TalkResponse response = reflectService.talk(id, request.getText());
            return ResponseEntity.ok(new TalkReply(response.text(), response.responseId(),
                    response.promptVersion()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private static TurnSummaryDto toSummary(Turn turn) {
        return TurnSummaryDto.builder()
                .id(turn.getId())
                .title(turn.getTitle())
                .state(turn.getState() != null ? turn.getState().getWire() : null)
                .source(turn.getSource() != null ? turn.getSource().getWire() : null)
                .captureContext(turn.getCaptureContext() != null ? turn.getCaptureContext().getWire() : null)
                .recordedAt(iso(turn.getRecordedAt()))
                .durationSeconds(turn.getDurationSeconds())
                .build();
    }

    static TurnDetailDto toDetail(Turn turn) {
        Map<String, TurnDetailDto.ToolOutputDto> outputs = new LinkedHashMap<>();
        if (turn.getToolOutputs() != null) {
            turn.getToolOutputs().forEach((tool, output) -> outputs.put(tool, toOutputDto(output)));
        }
        TurnError failure = turn.getState() != null && turn.getState().isFailure() ? turn.getError() : null;
        WorkingSnapshot snapshot = turn.getWorkingSnapshot();
        return TurnDetailDto.builder()
                .id(turn.getId())
                .title(turn.getTitle())
                .state(turn.getState() != null ? turn.getState().getWire() : null)
                .source(turn.getSource() != null ? turn.getSource().getWire() : null)
                .captureContext(turn.getCaptureContext() != null ? turn.getCaptureContext().getWire() : null)
                .recordedAt(iso(turn.getRecordedAt()))
                .endedAt(iso(turn.getEndedAt()))
                .durationSeconds(turn.getDurationSeconds())
                .transcript(turn.getTranscriptRedactedActive())
                .redactionVersion(turn.getRedactionVersion())
                .transcriptionProvider(turn.getTranscriptionProvider() != null
                        ? turn.getTranscriptionProvider().getWire()
                        : null)
                .reflectProvider(turn.getReflectProvider() != null ? turn.getReflectProvider().getWire() : null)
                .promptVersion(turn.getPromptVersion())
                .errorKey(failure != null ? failure.getUserFacingKey() : null)
                .errorMessage(failure != null ? failure.getDebugMessage() : null)
                .toolOutputs(outputs)
                .primaryLens(snapshot != null && snapshot.primaryLens() != null
                        ? snapshot.primaryLens().getWire()
                        : null)
                .secondaryLens(snapshot != null && snapshot.secondaryLens() != null
                        ? snapshot.secondaryLens().getWire()
                        : null)
                .confirmationQuestion(snapshot != null && snapshot.needsConfirmation()
                        ? snapshot.confirmationQuestion()
                        : null)
                .build();
    }

    private static TurnDetailDto.ToolOutputDto toOutputDto(ToolOutput output) {
        return new TurnDetailDto.ToolOutputDto(output.getText(), output.getPromptVersion(),
                output.getProvider() != null ? output.getProvider().getWire() : null,
                iso(output.getUpdatedAt()));
    }

    private static String iso(Instant instant) {
        return instant != null ? DateTimeFormatter.ISO_INSTANT.format(instant) : null;
    }

    record TalkReply(String text, String responseId, String promptVersion) {
    }
}
