package com.mailsync.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ingested message. Immutable once stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MailMessage {

    private String id;                  // Provider-assigned
    private String mailboxId;
    private String threadId;
    private String sender;
    @Builder.Default
    private List<String> recipients = new ArrayList<>();
    private String subject;
    private String body;
    private String receivedAt;          // ISO-8601 instant
    private boolean reply;
    @Builder.Default
    private List<AttachmentRef> attachmentRefs = new ArrayList<>();
}
