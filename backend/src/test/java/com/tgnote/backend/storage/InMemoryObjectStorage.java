package com.tgnote.backend.storage;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link ObjectStorage} for tests. URLs look like {@code memory://bucket/key} and can
 * be read back with {@link #fetch(String)}.
 */
public class InMemoryObjectStorage implements ObjectStorage {

    private final Set<String> buckets = ConcurrentHashMap.newKeySet();
    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    private final Set<String> failingKeys = new HashSet<>();
    private boolean failPuts;

    @Override
    public void ensureBucket(String bucket) {
        buckets.add(bucket);
    }

    @Override
    public String put(String bucket, String key, byte[] data, String contentType) {
        if (failPuts) {
            throw ObjectStorageException.storageError("injected put failure", null);
        }
        ensureBucket(bucket);
        objects.put(bucket + "/" + key, data.clone());
        return presign(bucket, key);
    }

    @Override
    public byte[] get(String bucket, String key) {
        byte[] data = objects.get(bucket + "/" + key);
        if (data == null) {
            throw ObjectStorageException.notFound(bucket, key);
        }
        return data.clone();
    }

    @Override
    public String presign(String bucket, String key) {
        return "memory://" + bucket + "/" + key + "?v=" + System.nanoTime();
    }

    @Override
    public void delete(String bucket, String key) {
        if (failingKeys.contains(key)) {
            throw ObjectStorageException.storageError("injected delete failure for " + key, null);
        }
        if (objects.remove(bucket + "/" + key) == null) {
            throw ObjectStorageException.notFound(bucket, key);
        }
    }

    public byte[] fetch(String url) {
        String path = url.substring("memory://".length(), url.indexOf('?'));
        int slash = path.indexOf('/');
        return get(path.substring(0, slash), path.substring(slash + 1));
    }

    public boolean contains(String bucket, String key) {
        return objects.containsKey(bucket + "/" + key);
    }

    public boolean hasBucket(String bucket) {
        return buckets.contains(bucket);
    }

    public void failPuts() {
        failPuts = true;
    }

    public void failDeletesOf(String key) {
        failingKeys.add(key);
    }
}
