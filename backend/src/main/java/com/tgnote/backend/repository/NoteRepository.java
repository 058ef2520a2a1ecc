package com.tgnote.backend.repository;

import com.tgnote.backend.entity.Note;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface NoteRepository extends JpaRepository<Note, Long> {

    @EntityGraph(attributePaths = "attachments")
    @Query("select distinct n from Note n")
    List<Note> findAllWithAttachments();

    @EntityGraph(attributePaths = "attachments")
    @Query("select n from Note n where n.id = :id")
    Optional<Note> findWithAttachmentsById(@Param("id") Long id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Note n set n.title = :title, n.content = :content, n.pinned = :pinned, "
            + "n.lastModified = :lastModified where n.id = :id")
    int updateContent(@Param("id") Long id,
                      @Param("title") String title,
                      @Param("content") String content,
                      @Param("pinned") boolean pinned,
                      @Param("lastModified") Instant lastModified);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Note n set n.pinned = :pinned where n.id = :id")
    int updatePinned(@Param("id") Long id, @Param("pinned") boolean pinned);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Note n where n.id = :id")
    int deleteNoteById(@Param("id") Long id);
}
