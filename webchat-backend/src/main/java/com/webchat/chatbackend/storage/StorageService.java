package com.webchat.chatbackend.storage;

import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

public interface StorageService {

    /** Save an upload under a logical folder (e.g. "attachments") and describe where it went. */
    default StoredFile save(MultipartFile file, String folder) throws IOException {
        try (InputStream in = file.getInputStream()) {
            return save(in, file.getSize(), file.getOriginalFilename(), folder, file.getContentType());
        }
    }

    StoredFile save(InputStream in, long size, String originalFilename, String folder, String contentType) throws IOException;

    /** Delete by key or public URL (impl handles both). Missing files are not an error. */
    void delete(String keyOrUrl) throws IOException;
}
