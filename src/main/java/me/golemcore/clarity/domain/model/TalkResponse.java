package me.golemcore.clarity.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TalkResponse(String text, @JsonProperty("response_id") String responseId,
        @JsonProperty("prompt_version") String promptVersion) {
}
