package com.tgnote.backend.storage;

/**
 * Raised by {@link ObjectStorage} implementations. The code tells a missing object apart from
 * one that survived a delete and from a plain backend failure.
 */
public class ObjectStorageException extends RuntimeException {

    /** The object did not exist. */
    public static final String NOT_FOUND = "object_not_found";

    /** The object was still present after a delete. */
    public static final String STILL_PRESENT = "object_still_present";

    /** Generic storage backend error. */
    public static final String STORAGE_ERROR = "storage_error";

    private final String code;

    public ObjectStorageException(String code, String message) {
        this(code, message, null);
    }

    public ObjectStorageException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static ObjectStorageException notFound(String bucket, String key) {
        return new ObjectStorageException(NOT_FOUND, "Object not found: " + bucket + "/" + key);
    }

    public static ObjectStorageException stillPresent(String bucket, String key) {
        return new ObjectStorageException(STILL_PRESENT, "Object still exists after deletion attempt: " + bucket + "/" + key);
    }

    public static ObjectStorageException storageError(String message, Throwable cause) {
        return new ObjectStorageException(STORAGE_ERROR, message, cause);
    }

    public String getCode() {
        return code;
    }

    public boolean isNotFound() {
        return NOT_FOUND.equals(code);
    }
}
