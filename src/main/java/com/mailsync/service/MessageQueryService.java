package com.mailsync.service;

import com.mailsync.domain.MailMessage;
import com.mailsync.domain.MessageStats;
import com.mailsync.mapper.AttachmentRefMapper;
import com.mailsync.mapper.MailMessageMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read access to the ingested store
 */
@Service
@RequiredArgsConstructor
public class MessageQueryService {

    private static final int MAX_LIMIT = 500;

    private final MailMessageMapper messageMapper;
    private final AttachmentRefMapper attachmentMapper;

    /**
     * Stored message with its attachment refs, or null
     */
    public MailMessage getMessage(String messageId) {
        MailMessage message = messageMapper.findById(messageId);
        if (message != null) {
            message.setAttachmentRefs(attachmentMapper.findByMessageId(messageId));
        }
        return message;
    }

    /**
     * Messages of a thread, oldest first
     */
    public List<MailMessage> getThread(String threadId) {
        return messageMapper.findByThreadId(threadId);
    }

    /**
     * Most recent messages of a mailbox, newest first
     */
    public List<MailMessage> getRecent(String mailboxId, int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        return messageMapper.findRecent(mailboxId, bounded);
    }

    /**
     * Recent messages grouped into threads, most recently active thread first
     *
     * @param mailboxId null for every mailbox
     * @param limit     number of recent messages considered
     */
    public List<MessageThread> getThreads(String mailboxId, int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        Map<String, List<MailMessage>> grouped = new LinkedHashMap<>();
        for (MailMessage message : messageMapper.findRecent(mailboxId, bounded)) {
            String key = hasThread(message) ? message.getThreadId() : message.getId();
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(message);
        }

        List<MessageThread> threads = new ArrayList<>(grouped.size());
        grouped.forEach((threadId, messages) -> {
            Collections.reverse(messages);
            threads.add(new MessageThread(threadId, messages.get(0).getSubject(), messages));
        });
        return threads;
    }

    /**
     * Message, thread and reply totals; null mailboxId for the whole store
     */
    public MessageStats getStats(String mailboxId) {
        MessageStats stats = messageMapper.selectStats(mailboxId);
        return stats != null ? stats : new MessageStats();
    }

    private static boolean hasThread(MailMessage message) {
        return message.getThreadId() != null && !message.getThreadId().isBlank();
    }
}
