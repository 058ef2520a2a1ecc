package com.tgnote.backend.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(
        name = "notes",
        indexes = {
                @Index(name = "ix_notes_user_id", columnList = "user_id")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Note {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId; // telegram user id

    @JdbcTypeCode(SqlTypes.LONGVARCHAR)
    @Column(nullable = false)
    private String title;

    @JdbcTypeCode(SqlTypes.LONGVARCHAR)
    @Column(nullable = false)
    private String content;

    @Column(name = "last_modified", nullable = false)
    private Instant lastModified;

    @Column(name = "is_pin", nullable = false)
    private boolean pinned;

    @OneToMany(mappedBy = "note", fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    @Builder.Default
    private List<NoteFile> attachments = new ArrayList<>();
}
