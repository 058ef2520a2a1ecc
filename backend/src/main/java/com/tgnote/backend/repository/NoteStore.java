package com.tgnote.backend.repository;

import com.tgnote.backend.entity.Note;
import com.tgnote.backend.entity.NoteFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Relational side of notes and their attachments. Missing rows come back as an empty
 * {@link Optional} or a zero count; connectivity and constraint failures surface as
 * Spring's {@code DataAccessException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NoteStore {

    private final NoteRepository noteRepository;
    private final NoteFileRepository noteFileRepository;

    @Transactional(readOnly = true)
    public List<Note> listNotes() {
        return noteRepository.findAllWithAttachments();
    }

    @Transactional(readOnly = true)
    public Optional<Note> getNote(Long id) {
        return noteRepository.findWithAttachmentsById(id);
    }

    @Transactional(readOnly = true)
    public boolean noteExists(Long id) {
        return noteRepository.existsById(id);
    }

    @Transactional
    public Long insertNote(Long userId, String title, String content, boolean pinned) {
        Note note = Note.builder()
                .userId(userId)
                .title(title)
                .content(content)
                .pinned(pinned)
                .lastModified(Instant.now())
                .build();
        return noteRepository.save(note).getId();
    }

    @Transactional
    public int updateNote(Long id, String title, String content, boolean pinned) {
        return noteRepository.updateContent(id, title, content, pinned, Instant.now());
    }

    @Transactional
    public int setPinned(Long id, boolean pinned) {
        return noteRepository.updatePinned(id, pinned);
    }

    /**
     * Removes the attachment rows of the note and then the note row, in one transaction.
     *
     * @return true when a note row was deleted
     */
    @Transactional
    public boolean deleteNote(Long id) {
        int files = noteFileRepository.deleteAllByNoteId(id);
        int notes = noteRepository.deleteNoteById(id);
        log.debug("Deleted note {}: {} note row(s), {} attachment row(s)", id, notes, files);
        return notes > 0;
    }

    @Transactional
    public NoteFile insertAttachment(Long noteId, String fileName, String extension, long size, String url) {
        NoteFile file = NoteFile.builder()
                .note(noteRepository.getReferenceById(noteId))
                .noteId(noteId)
                .fileName(fileName)
                .extension(extension)
                .size(size)
                .url(url)
                .build();
        return noteFileRepository.save(file);
    }

    @Transactional(readOnly = true)
    public List<NoteFile> listAttachments(Long noteId) {
        return noteFileRepository.findByNoteIdOrderByIdAsc(noteId);
    }

    @Transactional(readOnly = true)
    public Optional<NoteFile> getAttachment(Long id, Long noteId) {
        return noteFileRepository.findByIdAndNoteId(id, noteId);
    }

    @Transactional
    public int deleteAttachment(Long id, Long noteId) {
        return noteFileRepository.deleteByIdAndNoteId(id, noteId);
    }

    @Transactional
    public int updateAttachmentUrl(Long id, Long noteId, String url) {
        return noteFileRepository.updateUrl(id, noteId, url);
    }
}
