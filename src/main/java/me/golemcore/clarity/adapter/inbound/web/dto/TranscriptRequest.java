package me.golemcore.clarity.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Transcription result posted by the recording client.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptRequest {
    private String transcript;
    private Instant endedAt;
    private String provider;
    private String locale;
}
