package com.mailsync.service;

import com.mailsync.domain.SyncState;
import com.mailsync.notification.DecodeResult;
import com.mailsync.notification.DecodedNotification;
import com.mailsync.notification.NotificationDecoder;
import com.mailsync.notification.NotificationResult;
import com.mailsync.notification.NotificationResult.Accepted;
import com.mailsync.notification.NotificationResult.Disposition;
import com.mailsync.notification.NotificationResult.Rejected;
import com.mailsync.notification.ValidationError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Push notification intake
 * - Validates the envelope, never walks history inline
 * - Unknown/stopped mailboxes and already-covered cursors trigger no provider calls
 * - Everything else is handed to the coordinator's bounded queue
 */
@Slf4j
@Service
public class NotificationReceiver {

    private final NotificationDecoder decoder;
    private final SyncStateStore stateStore;
    private final SyncCoordinator coordinator;

    private final Counter receivedCounter;
    private final Counter rejectedCounter;

    public NotificationReceiver(NotificationDecoder decoder,
            SyncStateStore stateStore,
            SyncCoordinator coordinator,
            MeterRegistry meterRegistry) {
        this.decoder = decoder;
        this.stateStore = stateStore;
        this.coordinator = coordinator;
        this.receivedCounter = Counter.builder("mailsync.notifications.received")
                .description("Valid push notifications")
                .register(meterRegistry);
        this.rejectedCounter = Counter.builder("mailsync.notifications.rejected")
                .description("Malformed push notifications")
                .register(meterRegistry);
    }

    /**
     * Accept a raw webhook body
     */
    public NotificationResult accept(String rawPayload) {
        DecodeResult decoded = decoder.decode(rawPayload);
        if (decoded instanceof DecodeResult.Err err) {
            rejectedCounter.increment();
            log.warn("Notification rejected: {}", err.error().reason());
            return new Rejected(err.error());
        }

        DecodedNotification notification = ((DecodeResult.Ok) decoded).notification();
        log.debug("Notification {} for {} at cursor {} (published {})", notification.messageId(),
                notification.mailboxId(), notification.cursor(), notification.publishTime());
        return dispatch(notification.mailboxId(), notification.cursor());
    }

    /**
     * Accept an already-decoded {mailboxId, cursor} pair, e.g. from a manual trigger
     */
    public NotificationResult trigger(String mailboxId, long cursor) {
        if (mailboxId == null || mailboxId.isBlank()) {
            return new Rejected(new ValidationError("missing mailboxId"));
        }
        if (cursor <= 0) {
            return new Rejected(new ValidationError("missing or invalid cursor"));
        }
        return dispatch(mailboxId.trim(), cursor);
    }

    private NotificationResult dispatch(String mailboxId, long cursor) {
        receivedCounter.increment();

        Optional<SyncState> state = stateStore.get(mailboxId);
        if (state.isEmpty() || !state.get().isActive()) {
            log.info("Notification for unwatched mailbox {} ignored", mailboxId);
            return new Accepted(mailboxId, cursor, Disposition.IGNORED);
        }

        Long stored = state.get().getCursor();
        if (stored != null && cursor <= stored) {
            log.debug("Notification cursor {} for {} already covered by {}", cursor, mailboxId, stored);
            return new Accepted(mailboxId, cursor, Disposition.NO_OP);
        }

        SyncCoordinator.Admission admission = coordinator.submit(mailboxId, cursor);
        Disposition disposition = admission == SyncCoordinator.Admission.QUEUED
                ? Disposition.QUEUED
                : Disposition.COALESCED;
        log.info("Notification for {} at cursor {}: {}", mailboxId, cursor, disposition);
        return new Accepted(mailboxId, cursor, disposition);
    }
}
