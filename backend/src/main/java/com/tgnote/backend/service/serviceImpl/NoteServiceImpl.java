package com.tgnote.backend.service.serviceImpl;

import com.tgnote.backend.exception.NotFoundException;
import com.tgnote.backend.mapper.NoteMapper;
import com.tgnote.backend.repository.NoteStore;
import com.tgnote.backend.request.CreateNoteRequest;
import com.tgnote.backend.request.TogglePinRequest;
import com.tgnote.backend.request.UpdateNoteRequest;
import com.tgnote.backend.response.NoteResponse;
import com.tgnote.backend.service.AttachmentService;
import com.tgnote.backend.service.MissingNotePolicy;
import com.tgnote.backend.service.NoteService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class NoteServiceImpl implements NoteService {

    private final NoteStore noteStore;
    private final AttachmentService attachmentService;
    private final NoteMapper noteMapper;
    private final MissingNotePolicy missingNotePolicy;

    public NoteServiceImpl(
            NoteStore noteStore,
            AttachmentService attachmentService,
            NoteMapper noteMapper,
            @Value("${application.config.notes.missing-note-policy:NOT_FOUND}") MissingNotePolicy missingNotePolicy
    ) {
        this.noteStore = noteStore;
        this.attachmentService = attachmentService;
        this.noteMapper = noteMapper;
        this.missingNotePolicy = missingNotePolicy;
    }

    @Override
    public List<NoteResponse> list() {
        List<NoteResponse> notes = noteStore.listNotes().stream()
                .map(noteMapper::toResponse)
                .toList();
        log.info("Retrieved {} notes", notes.size());
        return notes;
    }

    @Override
    public NoteResponse get(Long id) {
        return noteStore.getNote(id)
                .map(noteMapper::toResponse)
                .orElseThrow(() -> NotFoundException.note(id));
    }

    @Override
    public Long create(CreateNoteRequest request) {
        Long id = noteStore.insertNote(request.userId(), request.title(), request.content(), request.pinned());
        log.info("Created note {} for user {}", id, request.userId());
        return id;
    }

    @Override
    public void update(Long id, UpdateNoteRequest request) {
        int rows = noteStore.updateNote(id, request.title(), request.content(), request.pinned());
        if (rows == 0) {
            onMissing(id, "update");
            return;
        }
        log.info("Updated note {}", id);
    }

    @Override
    public void setPinned(Long id, TogglePinRequest request) {
        int rows = noteStore.setPinned(id, request.isPinned());
        if (rows == 0) {
            onMissing(id, "toggle-pin");
            return;
        }
        log.info("Set pin status of note {} to {}", id, request.isPinned());
    }

    @Override
    public void delete(Long id) {
        if (!noteStore.noteExists(id)) {
            onMissing(id, "delete");
            return;
        }
        attachmentService.purgeObjects(id);
        noteStore.deleteNote(id);
        log.info("Deleted note {} and its attachments", id);
    }

    private void onMissing(Long id, String operation) {
        if (missingNotePolicy == MissingNotePolicy.NOT_FOUND) {
            throw NotFoundException.note(id);
        }
        log.info("Ignoring {} of missing note {}", operation, id);
    }
}
