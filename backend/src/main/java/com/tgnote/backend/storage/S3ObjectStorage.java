package com.tgnote.backend.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.BucketAlreadyOwnedByYouException;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.time.Duration;

/**
 * {@link ObjectStorage} on top of the AWS SDK v2. Download links are presigned GET URLs valid
 * for {@code application.config.storage.url-expiry}; nothing renews them automatically.
 */
@Slf4j
@Component
public class S3ObjectStorage implements ObjectStorage {

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final Duration urlExpiry;

    public S3ObjectStorage(
            S3Client s3Client,
            S3Presigner s3Presigner,
            @Value("${application.config.storage.url-expiry:7d}") Duration urlExpiry
    ) {
        this.s3Client = s3Client;
        this.s3Presigner = s3Presigner;
        this.urlExpiry = urlExpiry;
    }

    @Override
    public void ensureBucket(String bucket) {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
            return;
        } catch (NoSuchBucketException e) {
            log.info("Bucket {} does not exist, creating it", bucket);
        } catch (Exception e) {
            throw ObjectStorageException.storageError("Failed to check bucket " + bucket, e);
        }

        try {
            s3Client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
        } catch (BucketAlreadyOwnedByYouException e) {
            log.debug("Bucket {} was created concurrently", bucket);
        } catch (Exception e) {
            throw ObjectStorageException.storageError("Failed to create bucket " + bucket, e);
        }
    }

    @Override
    public String put(String bucket, String key, byte[] data, String contentType) {
        ensureBucket(bucket);
        log.info("Uploading object - bucket: {}, key: {}, size: {} bytes", bucket, key, data.length);
        try {
            s3Client.putObject(
                    PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentLength((long) data.length)
                            .contentType(contentType == null ? "application/octet-stream" : contentType)
                            .build(),
                    RequestBody.fromBytes(data));
        } catch (Exception e) {
            throw ObjectStorageException.storageError("Failed to upload " + bucket + "/" + key, e);
        }
        return presign(bucket, key);
    }

    @Override
    public byte[] get(String bucket, String key) {
        try {
            return s3Client.getObjectAsBytes(
                            GetObjectRequest.builder().bucket(bucket).key(key).build())
                    .asByteArray();
        } catch (NoSuchKeyException e) {
            throw ObjectStorageException.notFound(bucket, key);
        } catch (Exception e) {
            throw ObjectStorageException.storageError("Failed to download " + bucket + "/" + key, e);
        }
    }

    @Override
    public String presign(String bucket, String key) {
        try {
            return s3Presigner.presignGetObject(
                            GetObjectPresignRequest.builder()
                                    .signatureDuration(urlExpiry)
                                    .getObjectRequest(
                                            GetObjectRequest.builder().bucket(bucket).key(key).build())
                                    .build())
                    .url()
                    .toString();
        } catch (Exception e) {
            throw ObjectStorageException.storageError("Failed to presign " + bucket + "/" + key, e);
        }
    }

    @Override
    public void delete(String bucket, String key) {
        log.info("Deleting object - bucket: {}, key: {}", bucket, key);
        if (!exists(bucket, key)) {
            throw ObjectStorageException.notFound(bucket, key);
        }

        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
        } catch (Exception e) {
            throw ObjectStorageException.storageError("Failed to delete " + bucket + "/" + key, e);
        }

        if (exists(bucket, key)) {
            throw ObjectStorageException.stillPresent(bucket, key);
        }
        log.info("Deleted object {}/{}", bucket, key);
    }

    private boolean exists(String bucket, String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw ObjectStorageException.storageError("Failed to stat " + bucket + "/" + key, e);
        } catch (Exception e) {
            throw ObjectStorageException.storageError("Failed to stat " + bucket + "/" + key, e);
        }
    }
}
