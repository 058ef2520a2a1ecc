package com.tgnote.backend.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

public record TogglePinRequest(
        @JsonProperty("isPinned")
        @NotNull(message = "isPinned is required")
        Boolean isPinned
) {}
