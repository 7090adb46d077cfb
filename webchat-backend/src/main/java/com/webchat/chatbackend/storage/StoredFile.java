package com.webchat.chatbackend.storage;

/**
 * Result of persisting one upload.
 *
 * @param key         storage key, e.g. "attachments/2f1c....png"
 * @param url         public URL the client downloads from
 * @param size        bytes written
 * @param contentType declared MIME type, may be null
 * @param filename    original client-side file name
 */
public record StoredFile(String key, String url, long size, String contentType, String filename) {
}
