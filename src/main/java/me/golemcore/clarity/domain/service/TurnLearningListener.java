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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.clarity.domain.model.PatternObservation;
import me.golemcore.clarity.domain.model.Turn;
import me.golemcore.clarity.domain.model.TurnCompletedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Feeds completed Turns into the pattern store and refreshes the Capsule's
 * learned tendencies.
 *
 * <p>
 * Learning is best-effort: failures are logged and never reach the Turn
 * lifecycle that published the event. Each Turn is learned from at most once,
 * however many completion events arrive for it.
 * </p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TurnLearningListener {

    private final TurnService turnService;
    private final CapsuleService capsuleService;
    private final PatternObservationExtractor extractor;
    private final PatternLearningService patternLearningService;
    private final LearningProjectionService projectionService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @EventListener
    public void onTurnCompleted(TurnCompletedEvent event) {
        try {
            learn(event);
        } catch (RuntimeException e) { // NOSONAR - learning must not fail the Turn
            log.warn("[Learning] Failed to learn from turn {}: {}", event.turnId(), e.getMessage());
        }
    }

    private void learn(TurnCompletedEvent event) {
        if (!capsuleService.getCapsule().isLearningEnabled()) {
            log.debug("[Learning] Disabled, skipping turn {}", event.turnId());
            return;
        }
        Optional<Turn> turn = turnService.get(event.turnId());
        if (turn.isEmpty()) {
            log.debug("[Learning] Turn {} no longer exists", event.turnId());
            return;
        }

        if (!turnService.claimLearning(event.turnId())) {
            log.debug("[Learning] Turn {} already learned from, skipping", event.turnId());
            return;
        }

        Instant now = event.completedAt() != null ? event.completedAt() : clock.instant();
        List<PatternObservation> observations = extractor.extract(turn.get().getTranscriptRedactedActive(),
                turn.get().getWorkingSnapshot());
        if (!observations.isEmpty()) {
            patternLearningService.observeAll(observations, now);
            recordSnapshot(event.turnId(), observations);
        }
        log.debug("[Learning] Turn {} produced {} observation(s)", event.turnId(), observations.size());

        projectionService.sync(now);
    }

    private void recordSnapshot(String turnId, List<PatternObservation> observations) {
        try {
            String json = objectMapper.writeValueAsString(Map.of("observations", observations));
            turnService.updateLearningSnapshot(turnId, json);
        } catch (JsonProcessingException | RuntimeException e) { // NOSONAR - snapshot is informational
            log.warn("[Learning] Could not store learning snapshot for {}: {}", turnId, e.getMessage());
        }
    }
}
