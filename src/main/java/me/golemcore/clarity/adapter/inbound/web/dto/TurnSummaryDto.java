package me.golemcore.clarity.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnSummaryDto {
    private String id;
    private String title;
    private String state;
    private String source;
    private String captureContext;
    private String recordedAt;
    private double durationSeconds;
}
