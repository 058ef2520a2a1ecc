package com.tgnote.backend.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

public record CreateNoteRequest(
        @NotNull(message = "userId is required")
        Long userId,
        @NotNull(message = "title is required")
        String title,
        @NotNull(message = "content is required")
        String content,
        @JsonProperty("isPinned")
        Boolean isPinned
) {
    public boolean pinned() {
        return Boolean.TRUE.equals(isPinned);
    }
}
