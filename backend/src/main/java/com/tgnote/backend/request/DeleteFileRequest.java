package com.tgnote.backend.request;

import jakarta.validation.constraints.NotNull;

public record DeleteFileRequest(
        @NotNull(message = "attachmentId is required")
        Long attachmentId
) {}
