package com.mailsync.queue;

import com.mailsync.exception.PartialIngestionException;
import com.mailsync.exception.SyncFailureException;
import com.mailsync.service.SyncCoordinator;
import com.mailsync.service.SyncOutcome;
import jakarta.jms.JMSException;
import jakarta.jms.Message;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jms.annotation.JmsListener;
import org.springframework.stereotype.Component;

/**
 * ActiveMQ sync job consumer
 * - Runs on the bounded listener pool, never on the webhook thread
 * - Failed cycles are logged and left for the next notification
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncJobConsumer {

    private final SyncCoordinator coordinator;

    @JmsListener(destination = "${mailsync.queue.sync-destination:mailsync.sync.queue}")
    public void processSync(Message message) {
        String mailboxId;
        try {
            mailboxId = message.getStringProperty(SyncJobProducer.MAILBOX_ID);
        } catch (JMSException e) {
            // No mailbox id means no flight to release; the producer always sets it
            log.warn("Sync job without readable mailbox id dropped", e);
            return;
        }
        if (mailboxId == null || mailboxId.isBlank()) {
            log.warn("Sync job without mailbox id dropped");
            return;
        }

        long cursor;
        try {
            cursor = message.getLongProperty(SyncJobProducer.CURSOR);
        } catch (JMSException | NumberFormatException e) {
            log.warn("Sync job for {} has no readable cursor", mailboxId, e);
            coordinator.discard(mailboxId);
            return;
        }

        log.info("Processing sync job: {} at cursor {}", mailboxId, cursor);
        try {
            SyncOutcome outcome = coordinator.execute(mailboxId, cursor);
            log.debug("Sync job for {} done: {} persisted, cursor {}",
                    mailboxId, outcome.persisted().size(), outcome.committedCursor());
        } catch (PartialIngestionException e) {
            log.warn("{} (failed: {})", e.getMessage(), e.getFailedIds());
        } catch (SyncFailureException e) {
            log.error("Sync for {} failed, cursor not advanced: {}", mailboxId, e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error in sync job for {}", mailboxId, e);
        }
    }
}
