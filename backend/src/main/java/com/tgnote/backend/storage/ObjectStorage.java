package com.tgnote.backend.storage;

public interface ObjectStorage {

    /** Creates the bucket when it does not exist yet. Safe to call repeatedly. */
    void ensureBucket(String bucket) throws ObjectStorageException;

    /**
     * Stores the bytes under {@code key}, provisioning the bucket first if needed.
     *
     * @return a presigned download URL for the stored object
     */
    String put(String bucket, String key, byte[] data, String contentType) throws ObjectStorageException;

    byte[] get(String bucket, String key) throws ObjectStorageException;

    /** Mints a new presigned download URL for an existing key. */
    String presign(String bucket, String key) throws ObjectStorageException;

    /**
     * Deletes the object. Fails with {@link ObjectStorageException#NOT_FOUND} when the object did
     * not exist and with {@link ObjectStorageException#STILL_PRESENT} when it survives the delete.
     */
    void delete(String bucket, String key) throws ObjectStorageException;
}
