package com.tgnote.backend.service;

import com.tgnote.backend.request.CreateNoteRequest;
import com.tgnote.backend.request.TogglePinRequest;
import com.tgnote.backend.request.UpdateNoteRequest;
import com.tgnote.backend.response.NoteResponse;

import java.util.List;

public interface NoteService {
    List<NoteResponse> list();

    NoteResponse get(Long id);

    Long create(CreateNoteRequest request);

    void update(Long id, UpdateNoteRequest request);

    void setPinned(Long id, TogglePinRequest request);

    /** Deletes the note, its attachment rows and, best effort, the stored files. */
    void delete(Long id);
}
