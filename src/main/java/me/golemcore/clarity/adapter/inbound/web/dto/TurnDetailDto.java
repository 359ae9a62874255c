package me.golemcore.clarity.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Full Turn view. Carries the redacted transcript only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnDetailDto {
    private String id;
    private String title;
    private String state;
    private String source;
    private String captureContext;
    private String recordedAt;
    private String endedAt;
    private double durationSeconds;
    private String transcript;
    private int redactionVersion;
    private String transcriptionProvider;
    private String reflectProvider;
    private String promptVersion;
    private String errorKey;
    private String errorMessage;
    private Map<String, ToolOutputDto> toolOutputs;
    private String primaryLens;
    private String secondaryLens;
    private String confirmationQuestion;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolOutputDto {
        private String text;
        private String promptVersion;
        private String provider;
        private String updatedAt;
    }
}
