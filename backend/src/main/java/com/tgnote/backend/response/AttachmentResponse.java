package com.tgnote.backend.response;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AttachmentResponse(
        Long id,
        Long noteId,
        @JsonProperty("filename")
        String fileName,
        String extension,
        long size,
        String url
) {}
