package com.tgnote.backend.service;

import com.tgnote.backend.response.AttachmentResponse;
import org.springframework.web.multipart.MultipartFile;

public interface AttachmentService {
    AttachmentResponse upload(Long noteId, MultipartFile file);

    void delete(Long noteId, Long attachmentId);

    /**
     * Removes the stored object of every attachment of the note. Failures are logged and
     * swallowed so the note itself can still be deleted.
     */
    void purgeObjects(Long noteId);

    StoredFile download(Long noteId, Long attachmentId);

    AttachmentResponse refreshUrl(Long noteId, Long attachmentId);

    record StoredFile(String fileName, byte[] content) {}
}
