package me.golemcore.clarity.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for persistent storage within the local workspace. Files are organized
 * by directory (turns, redactions, learning, capsule, redaction) with atomic
 * whole-file writes for records and append-only writes for JSONL logs.
 *
 * <p>
 * Futures complete exceptionally on I/O failure; callers translate that into
 * their own error taxonomy.
 */
public interface StoragePort {

    /**
     * Read text content from file.
     *
     * @return the content, or {@code null} when the file does not exist
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Check if file exists.
     */
    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Delete a file. Missing files are not an error.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List regular files under {@code directory/prefix}, relative to
     * {@code directory}. Temporary and backup siblings of atomic writes are
     * not listed.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Append text to a file (JSONL logs).
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Atomically replace a file's content.
     *
     * <p>
     * The content is written to a temporary sibling, forced to disk, then
     * renamed over the target, so a crash leaves either the old or the new
     * version and never a torn file.
     *
     * @param directory
     *            subdirectory
     * @param path
     *            relative path within directory
     * @param content
     *            text content to write
     * @param backup
     *            if true, preserve previous version as .bak
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
