package com.mailsync.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Attachment metadata. Content is never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttachmentRef {

    private String messageId;
    private String attachmentId;
    private String filename;
    private String mimeType;
    private long sizeBytes;
}
