package com.mailsync.queue;

import com.mailsync.config.SyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jms.core.JmsTemplate;
import org.springframework.stereotype.Component;

/**
 * ActiveMQ sync job producer
 * - One job per admitted notification
 * - Carries only the mailbox id and the notified cursor
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncJobProducer {

    static final String MAILBOX_ID = "mailboxId";
    static final String CURSOR = "cursor";

    private final JmsTemplate jmsTemplate;
    private final SyncProperties properties;

    /**
     * Enqueue a sync job to the sync queue
     */
    public void enqueueSync(String mailboxId, long cursor) {
        String destination = properties.getQueue().getSyncDestination();
        jmsTemplate.send(destination, session -> {
            var message = session.createMessage();
            message.setStringProperty(MAILBOX_ID, mailboxId);
            message.setLongProperty(CURSOR, cursor);
            return message;
        });
        log.debug("Sync job enqueued: {} at cursor {}", mailboxId, cursor);
    }
}
