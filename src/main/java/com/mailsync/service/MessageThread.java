package com.mailsync.service;

import com.mailsync.domain.MailMessage;

import java.util.List;

/**
 * Messages sharing a thread id, oldest first. A message without a thread id forms its own thread
 * keyed by the message id.
 */
public record MessageThread(String threadId, String subject, List<MailMessage> messages) {

    public MessageThread {
        messages = List.copyOf(messages);
    }
}
