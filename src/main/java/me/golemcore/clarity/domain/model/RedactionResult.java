package me.golemcore.clarity.domain.model;

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

/**
 * Output of one redaction pass.
 *
 * @param redactedText
 *            text with every detected span replaced by its placeholder
 * @param inputHash
 *            fingerprint of the pre-redaction text
 * @param didRedact
 *            whether any span was replaced
 */
public record RedactionResult(String redactedText, String inputHash, boolean didRedact) {
}
