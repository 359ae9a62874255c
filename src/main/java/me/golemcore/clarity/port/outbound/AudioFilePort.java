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

/**
 * Access to captured audio files, which live outside the workspace.
 */
public interface AudioFilePort {

    /**
     * Delete the audio file at {@code audioPath}.
     *
     * @return {@code true} if a file was removed, {@code false} if none existed
     * @throws java.io.UncheckedIOException
     *             if the file exists but could not be removed
     */
    boolean delete(String audioPath);

    /**
     * Size in bytes of the audio file, or {@code 0} when it does not exist.
     */
    long size(String audioPath);
}
