package com.tgnote.backend.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

public record UpdateNoteRequest(
        @NotNull(message = "title is required")
        String title,
        @NotNull(message = "content is required")
        String content,
        @JsonProperty("isPinned")
        Boolean isPinned  // absent means unpinned, same as the mini app sends
) {
    public boolean pinned() {
        return Boolean.TRUE.equals(isPinned);
    }
}
