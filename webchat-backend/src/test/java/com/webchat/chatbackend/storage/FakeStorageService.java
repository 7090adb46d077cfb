package com.webchat.chatbackend.storage;

import java.io.IOException;
import java.io.InputStream;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class FakeStorageService implements StorageService {

    private final ConcurrentHashMap<String, byte[]> store = new ConcurrentHashMap<>();

    @Override
    public StoredFile save(InputStream in, long size, String originalFilename, String folder, String contentType) throws IOException {
        String key = folder + "/" + UUID.randomUUID();
        byte[] bytes = in.readAllBytes();
        store.put(key, bytes);
        return new StoredFile(key, "/test-storage/" + key, bytes.length, contentType, originalFilename);
    }

    @Override
    public void delete(String keyOrUrl) {
        store.remove(keyOrUrl);
    }

    public boolean exists(String key) {
        return store.containsKey(key);
    }

    public int size() {
        return store.size();
    }

    public void clear() {
        store.clear();
    }
}
