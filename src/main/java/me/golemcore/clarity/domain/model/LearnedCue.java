package me.golemcore.clarity.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LearnedCue {

    private String statement;
    private int evidenceCount;
    private String lastSeenAtISO;
    private String kindRaw;
    private String key;
}
