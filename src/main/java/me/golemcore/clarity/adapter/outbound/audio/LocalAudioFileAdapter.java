package me.golemcore.clarity.adapter.outbound.audio;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.clarity.port.outbound.AudioFilePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Filesystem access to captured audio. Paths are absolute, as handed over by
 * the recorder.
 */
@Component
@Slf4j
public class LocalAudioFileAdapter implements AudioFilePort {

    @Override
    public boolean delete(String audioPath) {
        if (audioPath == null || audioPath.isBlank()) {
            return false;
        }
        Path path = Paths.get(audioPath);
        try {
            boolean deleted = Files.deleteIfExists(path);
            log.debug("[Audio] Delete {}: {}", path.getFileName(), deleted ? "removed" : "absent");
            return deleted;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete audio file: " + path.getFileName(), e);
        }
    }

    @Override
    public long size(String audioPath) {
        if (audioPath == null || audioPath.isBlank()) {
            return 0L;
        }
        Path path = Paths.get(audioPath);
        try {
            return Files.exists(path) ? Files.size(path) : 0L;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat audio file: " + path.getFileName(), e);
        }
    }
}
