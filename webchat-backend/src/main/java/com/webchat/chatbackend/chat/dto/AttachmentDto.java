package com.webchat.chatbackend.chat.dto;

import com.webchat.chatbackend.chat.Attachment;

public record AttachmentDto(Long id, String url, String fileName, String mimeType, long size) {

    public static AttachmentDto from(Attachment a) {
        return new AttachmentDto(a.getId(), a.getUrl(), a.getFileName(), a.getMimeType(), a.getSizeBytes());
    }
}
