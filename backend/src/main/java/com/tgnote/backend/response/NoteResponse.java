package com.tgnote.backend.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record NoteResponse(
        Long id,
        Long userId,
        String title,
        String content,
        Instant lastModified,
        @JsonProperty("isPinned")
        boolean isPinned,
        List<AttachmentResponse> attachments
) {}
