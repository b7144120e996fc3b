package com.mailsync.service;

import com.mailsync.domain.AttachmentRef;
import com.mailsync.domain.MailMessage;
import com.mailsync.exception.MessageNotFoundException;
import com.mailsync.mapper.AttachmentRefMapper;
import com.mailsync.mapper.MailMessageMapper;
import com.mailsync.provider.AttachmentMeta;
import com.mailsync.provider.MessageDetail;
import com.mailsync.provider.ProviderCallPolicy;
import com.mailsync.provider.ProviderClient;
import com.mailsync.util.MessageParser;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Message ingestion
 * - Fetch full detail and attachment metadata for each id
 * - Insert-or-ignore keyed on message id, one transaction per message
 * - A failing message is recorded and the batch continues
 */
@Slf4j
@Service
public class MessageIngester {

    private final ProviderClient providerClient;
    private final ProviderCallPolicy callPolicy;
    private final MailMessageMapper messageMapper;
    private final AttachmentRefMapper attachmentMapper;
    private final TransactionTemplate transactionTemplate;

    private final Counter ingestedCounter;
    private final Counter failedCounter;

    public MessageIngester(ProviderClient providerClient,
            ProviderCallPolicy callPolicy,
            MailMessageMapper messageMapper,
            AttachmentRefMapper attachmentMapper,
            TransactionTemplate transactionTemplate,
            MeterRegistry meterRegistry) {
        this.providerClient = providerClient;
        this.callPolicy = callPolicy;
        this.messageMapper = messageMapper;
        this.attachmentMapper = attachmentMapper;
        this.transactionTemplate = transactionTemplate;
        this.ingestedCounter = Counter.builder("mailsync.messages.ingested")
                .description("Messages written to the local store")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("mailsync.messages.failed")
                .description("Messages whose ingestion failed")
                .register(meterRegistry);
    }

    /**
     * Ingest a batch of message ids for a mailbox
     *
     * @param mailboxId  mailbox the ids belong to
     * @param messageIds ids in processing order; repeats are ingested once
     * @return persisted / failed / skipped ids
     */
    public IngestResult ingest(String mailboxId, List<String> messageIds) {
        List<String> persisted = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (String messageId : new LinkedHashSet<>(messageIds)) {
            try {
                if (messageMapper.countById(messageId) > 0) {
                    log.debug("Message {} already stored, skipping fetch", messageId);
                    persisted.add(messageId);
                    continue;
                }

                MessageDetail detail = callPolicy.call("getMessage " + messageId,
                        () -> providerClient.getMessage(mailboxId, messageId));
                List<AttachmentMeta> attachments = callPolicy.call("listAttachments " + messageId,
                        () -> providerClient.listAttachments(mailboxId, messageId));

                MailMessage message = MessageParser.toMailMessage(mailboxId, detail, attachments);
                boolean inserted = store(message);
                if (inserted) {
                    ingestedCounter.increment();
                    log.info("Message ingested: id={}, thread={}, subject={}, attachments={}",
                            message.getId(), message.getThreadId(), message.getSubject(),
                            message.getAttachmentRefs().size());
                }
                persisted.add(messageId);
            } catch (MessageNotFoundException e) {
                log.info("Message {} no longer exists on the provider, skipped", messageId);
                skipped.add(messageId);
            } catch (RuntimeException e) {
                failedCounter.increment();
                log.warn("Failed to ingest message {} for {}: {}", messageId, mailboxId, e.getMessage());
                failed.add(messageId);
            }
        }

        IngestResult result = new IngestResult(persisted, failed, skipped);
        log.debug("Ingestion for {}: {} persisted, {} failed, {} skipped",
                mailboxId, persisted.size(), failed.size(), skipped.size());
        return result;
    }

    /**
     * Write one message with its attachment refs atomically.
     *
     * @return false when another writer stored the id first
     */
    private boolean store(MailMessage message) {
        Boolean inserted = transactionTemplate.execute(status -> {
            if (messageMapper.insertIfAbsent(message) == 0) {
                return false;
            }
            for (AttachmentRef ref : message.getAttachmentRefs()) {
                attachmentMapper.insertIfAbsent(ref);
            }
            return true;
        });
        return Boolean.TRUE.equals(inserted);
    }
}
