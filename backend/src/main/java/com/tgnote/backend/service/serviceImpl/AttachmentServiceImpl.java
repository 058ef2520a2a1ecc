package com.tgnote.backend.service.serviceImpl;

import com.tgnote.backend.entity.NoteFile;
import com.tgnote.backend.exception.NotFoundException;
import com.tgnote.backend.mapper.NoteMapper;
import com.tgnote.backend.repository.NoteStore;
import com.tgnote.backend.response.AttachmentResponse;
import com.tgnote.backend.service.AttachmentService;
import com.tgnote.backend.storage.AttachmentKeys;
import com.tgnote.backend.storage.ObjectStorage;
import com.tgnote.backend.storage.ObjectStorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;

@Slf4j
@Service
public class AttachmentServiceImpl implements AttachmentService {

    private final NoteStore noteStore;
    private final ObjectStorage objectStorage;
    private final NoteMapper noteMapper;
    private final String bucket;

    public AttachmentServiceImpl(
            NoteStore noteStore,
            ObjectStorage objectStorage,
            NoteMapper noteMapper,
            @Value("${application.config.storage.bucket:notes-files}") String bucket
    ) {
        this.noteStore = noteStore;
        this.objectStorage = objectStorage;
        this.noteMapper = noteMapper;
        this.bucket = bucket;
    }

    @Override
    public AttachmentResponse upload(Long noteId, MultipartFile file) {
        if (file == null) {
            throw new IllegalArgumentException("file is required");
        }
        log.info("[upload] Received file {} ({} bytes) for note {}", file.getOriginalFilename(), file.getSize(), noteId);
        if (!noteStore.noteExists(noteId)) {
            throw NotFoundException.note(noteId);
        }

        AttachmentKeys.FileName name = AttachmentKeys.split(file.getOriginalFilename());
        String key = AttachmentKeys.objectKey(noteId, name.baseName(), name.extension());
        // one object per key, a second row would share and later lose it
        boolean taken = noteStore.listAttachments(noteId).stream()
                .anyMatch(f -> f.getFileName().equals(name.baseName()) && f.getExtension().equals(name.extension()));
        if (taken) {
            throw new IllegalArgumentException("Note " + noteId + " already has a file stored as " + key);
        }

        byte[] data;
        try {
            data = file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read uploaded file", e);
        }

        // nothing is recorded unless the object made it to storage
        String url = objectStorage.put(bucket, key, data, file.getContentType());

        NoteFile saved;
        try {
            saved = noteStore.insertAttachment(noteId, name.baseName(), name.extension(), data.length, url);
        } catch (RuntimeException e) {
            log.error("[upload] Stored {}/{} but failed to save its metadata, object is orphaned", bucket, key, e);
            throw e;
        }
        log.info("[upload] Saved attachment {} for note {} as {}", saved.getId(), noteId, key);
        return noteMapper.toResponse(saved);
    }

    @Override
    public void delete(Long noteId, Long attachmentId) {
        NoteFile file = requireAttachment(noteId, attachmentId);
        String key = keyOf(file);

        // the row stays when storage fails, so the mismatch is visible and the delete can be retried
        objectStorage.delete(bucket, key);

        int rows = noteStore.deleteAttachment(attachmentId, noteId);
        log.info("[delete-file] Deleted attachment {} of note {} (rows affected: {})", attachmentId, noteId, rows);
    }

    @Override
    public void purgeObjects(Long noteId) {
        for (NoteFile file : noteStore.listAttachments(noteId)) {
            String key = keyOf(file);
            try {
                objectStorage.delete(bucket, key);
            } catch (RuntimeException e) {
                log.warn("Could not delete {}/{} while deleting note {}, continuing: {}", bucket, key, noteId, e.getMessage());
            }
        }
    }

    @Override
    public StoredFile download(Long noteId, Long attachmentId) {
        NoteFile file = requireAttachment(noteId, attachmentId);
        try {
            byte[] content = objectStorage.get(bucket, keyOf(file));
            return new StoredFile(displayName(file), content);
        } catch (ObjectStorageException e) {
            if (e.isNotFound()) {
                throw new NotFoundException("Stored file missing for attachment " + attachmentId);
            }
            throw e;
        }
    }

    @Override
    public AttachmentResponse refreshUrl(Long noteId, Long attachmentId) {
        NoteFile file = requireAttachment(noteId, attachmentId);
        String url = objectStorage.presign(bucket, keyOf(file));
        noteStore.updateAttachmentUrl(attachmentId, noteId, url);
        file.setUrl(url);
        log.info("Refreshed download link of attachment {} (note {})", attachmentId, noteId);
        return noteMapper.toResponse(file);
    }

    private NoteFile requireAttachment(Long noteId, Long attachmentId) {
        return noteStore.getAttachment(attachmentId, noteId)
                .orElseThrow(() -> NotFoundException.attachment(attachmentId, noteId));
    }

    private static String keyOf(NoteFile file) {
        return AttachmentKeys.objectKey(file.getNoteId(), file.getFileName(), file.getExtension());
    }

    private static String displayName(NoteFile file) {
        return file.getExtension().isEmpty() ? file.getFileName() : file.getFileName() + "." + file.getExtension();
    }
}
