package me.golemcore.clarity.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Last output of one reflection tool for a Turn (local only).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolOutput {

    private String text;
    private String promptVersion;
    private ReflectProvider provider;
    private Instant updatedAt;
}
