package com.tgnote.backend.repository;

import com.tgnote.backend.entity.NoteFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface NoteFileRepository extends JpaRepository<NoteFile, Long> {

    List<NoteFile> findByNoteIdOrderByIdAsc(Long noteId);

    Optional<NoteFile> findByIdAndNoteId(Long id, Long noteId);

    long countByNoteId(Long noteId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from NoteFile f where f.noteId = :noteId")
    int deleteAllByNoteId(@Param("noteId") Long noteId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from NoteFile f where f.id = :id and f.noteId = :noteId")
    int deleteByIdAndNoteId(@Param("id") Long id, @Param("noteId") Long noteId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update NoteFile f set f.url = :url where f.id = :id and f.noteId = :noteId")
    int updateUrl(@Param("id") Long id, @Param("noteId") Long noteId, @Param("url") String url);
}
