package com.webchat.chatbackend.chat;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.util.InvalidMimeTypeException;
import org.springframework.util.MimeType;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;

import java.util.Collection;

public enum MessageType {
    TEXT,
    IMAGE,
    FILE,
    VIDEO,
    SYSTEM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * IMAGE when every attachment is an image, FILE when at least one is not,
     * TEXT when there are no attachments.
     */
    public static MessageType infer(Collection<String> attachmentContentTypes) {
        if (attachmentContentTypes == null || attachmentContentTypes.isEmpty()) {
            return TEXT;
        }
        return attachmentContentTypes.stream().allMatch(MessageType::isImage) ? IMAGE : FILE;
    }

    public static boolean isImage(String contentType) {
        if (!StringUtils.hasText(contentType)) {
            return false;
        }
        try {
            MimeType mimeType = MimeTypeUtils.parseMimeType(contentType);
            return "image".equalsIgnoreCase(mimeType.getType());
        } catch (InvalidMimeTypeException e) {
            return false;
        }
    }
}
