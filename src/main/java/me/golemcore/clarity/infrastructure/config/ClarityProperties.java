package me.golemcore.clarity.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code clarity.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link HttpProperties} - shared HTTP client</li>
 * <li>{@link PrivacyProperties} - raw transcript persistence</li>
 * <li>{@link RedactionProperties} - current redaction version</li>
 * <li>{@link LearningProperties} - pattern store defaults</li>
 * <li>{@link ExportProperties} - snapshot bounds</li>
 * <li>{@link ReflectProperties} - remote reasoning gateway</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "clarity")
@Data
public class ClarityProperties {

    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private PrivacyProperties privacy = new PrivacyProperties();
    private RedactionProperties redaction = new RedactionProperties();
    private LearningProperties learning = new LearningProperties();
    private ExportProperties export = new ExportProperties();
    private ReflectProperties reflect = new ReflectProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/clarity";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class PrivacyProperties {
        private boolean storeRawTranscript = true;
    }

    @Data
    public static class RedactionProperties {
        private int version = 1;
    }

    @Data
    public static class LearningProperties {
        private double defaultHalfLifeDays = 14.0;
        private int maxObservationsPerTurn = 12;
    }

    @Data
    public static class ExportProperties {
        private int preferenceValueMax = 128;
        private int extrasMaxItems = 24;
        private int extrasKeyMax = 32;
        private int cueMaxReflect = 12;
        private int cueMaxTalk = 6;
        private int cueStatementMax = 140;
        private int cueEvidenceMax = 999;
    }

    @Data
    public static class ReflectProperties {
        private boolean enabled = false;
        private String baseUrl;
        private String anonKey;
        private String client = "clarity-java";
        private String appVersion = "0.1.0";
        private int generativeTimeoutSeconds = 90;
        private int metadataTimeoutSeconds = 30;
    }
}
