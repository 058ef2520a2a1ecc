package com.tgnote.backend.storage;

import org.springframework.util.StringUtils;

/**
 * Object key and file name handling for note attachments. Upload, download and delete all go
 * through {@link #objectKey(Long, String, String)} so the stored key and the looked-up key agree.
 */
public final class AttachmentKeys {
    /** Width of the {@code note_files.ext} column. */
    public static final int MAX_EXTENSION_LENGTH = 64;

    private AttachmentKeys() {}

    public static String objectKey(Long noteId, String fileName, String extension) {
        if (noteId == null) {
            throw new IllegalArgumentException("noteId is required");
        }
        StringBuilder key = new StringBuilder()
                .append(noteId)
                .append('-')
                .append(fileName == null ? "" : fileName);
        if (StringUtils.hasLength(extension)) {
            key.append('.').append(extension);
        }
        return key.toString();
    }

    /**
     * Splits an uploaded file name into base name and extension, dropping any client-side
     * directory part. {@code "report.pdf"} gives {@code ("report", "pdf")}, {@code "README"}
     * gives {@code ("README", "")}. Extensions longer than {@link #MAX_EXTENSION_LENGTH} are rejected.
     */
    public static FileName split(String originalFilename) {
        String name = StringUtils.getFilename(StringUtils.cleanPath(
                originalFilename == null ? "" : originalFilename.replace('\\', '/')));
        if (!StringUtils.hasText(name)) {
            throw new IllegalArgumentException("file name is required");
        }
        String extension = StringUtils.getFilenameExtension(name);
        if (extension != null && extension.length() > MAX_EXTENSION_LENGTH) {
            throw new IllegalArgumentException("file extension is longer than " + MAX_EXTENSION_LENGTH + " characters");
        }
        String base = StringUtils.stripFilenameExtension(name);
        return new FileName(base, extension == null ? "" : extension);
    }

    public record FileName(String baseName, String extension) {}
}
