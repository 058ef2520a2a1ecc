package com.tgnote.backend.service;

/**
 * What update, pin and delete do when the note id matches no row.
 */
public enum MissingNotePolicy {
    /** Answer 404. */
    NOT_FOUND,
    /** Succeed without changing anything. */
    IGNORE
}
