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
import me.golemcore.clarity.adapter.inbound.web.dto.LearningToggleRequest;
import me.golemcore.clarity.domain.model.Capsule;
import me.golemcore.clarity.domain.model.CapsuleMode;
import me.golemcore.clarity.domain.model.CapsuleSnapshot;
import me.golemcore.clarity.domain.model.PatternKind;
import me.golemcore.clarity.domain.model.PatternStat;
import me.golemcore.clarity.domain.model.PreferenceEdits;
import me.golemcore.clarity.domain.service.CapsuleService;
import me.golemcore.clarity.domain.service.CapsuleSnapshotExporter;
import me.golemcore.clarity.domain.service.PatternLearningService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/**
 * Capsule preferences, learning controls and export preview.
 */
@RestController
@RequestMapping("/api/capsule")
@RequiredArgsConstructor
@Slf4j
public class CapsuleController {

    private static final int MAX_PATTERN_LIMIT = 100;

    private final CapsuleService capsuleService;
    private final CapsuleSnapshotExporter exporter;
    private final PatternLearningService patternLearningService;
    private final Clock clock;

    @GetMapping
    public Mono<ResponseEntity<Capsule>> getCapsule() {
        return Mono.just(ResponseEntity.ok(capsuleService.getCapsule()));
    }

    @PutMapping("/preferences")
    public Mono<ResponseEntity<Capsule>> updatePreferences(@RequestBody PreferenceEdits edits) {
        Capsule updated = capsuleService.update(edits);
        log.info("[API] Capsule preferences updated (version {})", updated.getVersion());
        return Mono.just(ResponseEntity.ok(updated));
    }

    @PutMapping("/learning")
    public Mono<ResponseEntity<Capsule>> setLearning(@RequestBody LearningToggleRequest request) {
        return Mono.just(ResponseEntity.ok(capsuleService.setLearningEnabled(request.isEnabled())));
    }

    @PostMapping("/reset-learning")
    public Mono<ResponseEntity<Capsule>> resetLearning() {
        return Mono.just(ResponseEntity.ok(capsuleService.resetLearnedProfile()));
    }

    @GetMapping("/export")
    public Mono<ResponseEntity<CapsuleSnapshot>> export(@RequestParam(defaultValue = "reflect") String mode) {
        CapsuleSnapshot snapshot = exporter.project(capsuleService.getCapsule(), CapsuleMode.fromWire(mode));
        return Mono.just(ResponseEntity.ok(snapshot));
    }

    @GetMapping("/patterns")
    public Mono<ResponseEntity<List<PatternStat>>> topPatterns(
            @RequestParam(required = false) String kind,
            @RequestParam(defaultValue = "20") int limit) {
        PatternKind filter = kind == null || kind.isBlank() ? null : PatternKind.fromWire(kind);
        int normalizedLimit = Math.max(1, Math.min(limit, MAX_PATTERN_LIMIT));
        return Mono.just(ResponseEntity.ok(patternLearningService.topPatterns(filter, normalizedLimit,
                clock.instant())));
    }
}
