package com.webchat.chatbackend.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

@Service
@Slf4j
public class LocalStorageService implements StorageService {

    private final Path rootDir;       // e.g. /var/app/uploads
    private final String webBase;     // e.g. /uploads

    public LocalStorageService(
            @Value("${app.upload.root:uploads}") String uploadRoot,
            @Value("${app.storage.local.web-base:/uploads}") String webBase
    ) throws IOException {
        this.rootDir = Path.of(uploadRoot).toAbsolutePath().normalize();
        this.webBase = webBase.replaceAll("/+$", "");
        Files.createDirectories(this.rootDir);
    }

    @Override
    public StoredFile save(InputStream in, long size, String originalFilename, String folder, String contentType) throws IOException {
        String ext = ext(originalFilename);
        String name = UUID.randomUUID() + (ext.isBlank() ? "" : "." + ext);
        String safeFolder = (folder == null || folder.isBlank()) ? "misc" : folder;

        Path target = rootDir.resolve(safeFolder).resolve(name).normalize();
        if (!target.startsWith(rootDir)) {
            throw new IOException("Refusing to write outside the upload root: " + folder);
        }
        Files.createDirectories(target.getParent());
        long written = Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);

        String key = safeFolder + "/" + name;
        log.debug("Stored {} ({} bytes) as {}", originalFilename, written, key);
        return new StoredFile(key, webBase + "/" + key, written, contentType, originalFilename);
    }

    @Override
    public void delete(String keyOrUrl) throws IOException {
        if (keyOrUrl == null || keyOrUrl.isBlank()) return;

        // Accept either "/uploads/attachments/..." or "attachments/..."
        String key = keyOrUrl.startsWith(webBase + "/") ? keyOrUrl.substring(webBase.length() + 1) : keyOrUrl;
        Path p = rootDir.resolve(key).normalize();
        if (!p.startsWith(rootDir)) {
            log.warn("Ignoring delete outside the upload root: {}", keyOrUrl);
            return;
        }
        Files.deleteIfExists(p);
    }

    private static String ext(String name) {
        if (name == null) return "";
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1).toLowerCase() : "";
    }
}
