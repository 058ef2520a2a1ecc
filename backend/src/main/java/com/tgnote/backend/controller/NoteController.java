package com.tgnote.backend.controller;

import com.tgnote.backend.request.CreateNoteRequest;
import com.tgnote.backend.request.DeleteFileRequest;
import com.tgnote.backend.request.TogglePinRequest;
import com.tgnote.backend.request.UpdateNoteRequest;
import com.tgnote.backend.response.AttachmentResponse;
import com.tgnote.backend.response.NoteResponse;
import com.tgnote.backend.service.AttachmentService;
import com.tgnote.backend.service.NoteService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/notes")
@RequiredArgsConstructor
public class NoteController {

    private final NoteService noteService;
    private final AttachmentService attachmentService;

    public record CreateNoteResponse(Long id) {}

    @GetMapping
    public ResponseEntity<List<NoteResponse>> list() {
        return ResponseEntity.ok(noteService.list());
    }

    @GetMapping("/{id}")
    public ResponseEntity<NoteResponse> get(@PathVariable Long id) {
        return ResponseEntity.ok(noteService.get(id));
    }

    @PostMapping
    public ResponseEntity<CreateNoteResponse> create(@RequestBody @Valid CreateNoteRequest req) {
        return ResponseEntity.ok(new CreateNoteResponse(noteService.create(req)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Void> update(@PathVariable Long id, @RequestBody @Valid UpdateNoteRequest req) {
        noteService.update(id, req);
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        noteService.delete(id);
        return ResponseEntity.ok().build();
    }

    @PutMapping("/{id}/toggle-pin")
    public ResponseEntity<Void> togglePin(@PathVariable Long id, @RequestBody @Valid TogglePinRequest req) {
        noteService.setPinned(id, req);
        return ResponseEntity.ok().build();
    }

    @PostMapping(value = "/{id}/upload-file", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<AttachmentResponse> uploadFile(@PathVariable Long id, @RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(attachmentService.upload(id, file));
    }

    @DeleteMapping("/{id}/delete-file")
    public ResponseEntity<Void> deleteFile(@PathVariable Long id, @RequestBody @Valid DeleteFileRequest req) {
        attachmentService.delete(id, req.attachmentId());
        return ResponseEntity.ok().build();
    }

    @GetMapping("/{id}/files/{attachmentId}")
    public ResponseEntity<byte[]> downloadFile(@PathVariable Long id, @PathVariable Long attachmentId) {
        AttachmentService.StoredFile file = attachmentService.download(id, attachmentId);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(file.fileName(), StandardCharsets.UTF_8)
                        .build()
                        .toString())
                .body(file.content());
    }

    @PutMapping("/{id}/files/{attachmentId}/refresh-url")
    public ResponseEntity<AttachmentResponse> refreshFileUrl(@PathVariable Long id, @PathVariable Long attachmentId) {
        return ResponseEntity.ok(attachmentService.refreshUrl(id, attachmentId));
    }
}
