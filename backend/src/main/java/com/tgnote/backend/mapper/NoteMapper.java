package com.tgnote.backend.mapper;

import com.tgnote.backend.entity.Note;
import com.tgnote.backend.entity.NoteFile;
import com.tgnote.backend.response.AttachmentResponse;
import com.tgnote.backend.response.NoteResponse;
import org.springframework.stereotype.Service;

@Service
public class NoteMapper {

    public NoteResponse toResponse(Note note) {
        return new NoteResponse(
                note.getId(),
                note.getUserId(),
                note.getTitle(),
                note.getContent(),
                note.getLastModified(),
                note.isPinned(),
                note.getAttachments().stream().map(this::toResponse).toList()
        );
    }

    public AttachmentResponse toResponse(NoteFile file) {
        return new AttachmentResponse(
                file.getId(),
                file.getNoteId(),
                file.getFileName(),
                file.getExtension(),
                file.getSize(),
                file.getUrl()
        );
    }
}
