package com.mailsync.provider;

/**
 * Attachment metadata reported by the provider
 */
public record AttachmentMeta(String attachmentId, String filename, String mimeType, long sizeBytes) {
}
