package com.tgnote.backend.entity;

import com.tgnote.backend.storage.AttachmentKeys;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Metadata row of a file attached to a {@link Note}. The bytes live in the object store
 * under a key derived from the note id, file name and extension.
 */
@Entity
@Table(
        name = "note_files",
        indexes = {
                @Index(name = "ix_note_files_note_id", columnList = "note_id")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NoteFile {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "note_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Note note;

    // same column, read-only, so the id is available without touching the lazy association
    @Column(name = "note_id", insertable = false, updatable = false)
    private Long noteId;

    @JdbcTypeCode(SqlTypes.LONGVARCHAR)
    @Column(name = "file_name", nullable = false)
    private String fileName; // without extension

    @Column(name = "ext", nullable = false, length = AttachmentKeys.MAX_EXTENSION_LENGTH)
    private String extension; // without the leading dot, may be empty

    @Column(nullable = false)
    private long size;

    // presigned, expires after application.config.storage.url-expiry
    @JdbcTypeCode(SqlTypes.LONGVARCHAR)
    @Column(name = "file_url", nullable = false)
    private String url;

    @CreationTimestamp
    @Column(name = "uploaded_at", updatable = false)
    private Instant uploadedAt;
}
