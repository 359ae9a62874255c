package me.golemcore.clarity;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Clarity Core.
 *
 * <p>
 * Clarity Core is the capture and preference engine behind a personal
 * reflection app. It tracks each capture ("turn") from raw audio or imported
 * text to a redacted, versioned transcript, learns a decay-scored model of the
 * user's preferences from completed turns, and exports a bounded snapshot of
 * that model to a remote reasoning service.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Turn lifecycle</b> - persisted state machine with per-turn write
 * serialization</li>
 * <li><b>Redaction</b> - structural PII detection plus a user token
 * dictionary, versioned and fingerprinted</li>
 * <li><b>Pattern learning</b> - lazily decayed scores, no background
 * scheduler</li>
 * <li><b>Capsule</b> - explicit preferences and curated learned
 * tendencies</li>
 * <li><b>Snapshot export</b> - strictly bounded outbound preference
 * payload</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Inbound Layer      → TurnsController, CapsuleController
 * Domain Layer       → TurnService, RedactionEngine, PatternLearningService, CapsuleService
 * Outbound Layer     → LocalStorageAdapter, LocalAudioFileAdapter, ReflectGatewayAdapter
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code clarity.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ClarityApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClarityApplication.class, args);
    }

}
