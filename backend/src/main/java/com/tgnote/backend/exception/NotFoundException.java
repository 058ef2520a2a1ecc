package com.tgnote.backend.exception;

public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException note(Long id) {
        return new NotFoundException("Note not found: " + id);
    }

    public static NotFoundException attachment(Long id, Long noteId) {
        return new NotFoundException("File not found: " + id + " (note " + noteId + ")");
    }
}
