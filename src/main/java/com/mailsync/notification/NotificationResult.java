package com.mailsync.notification;

/**
 * Outcome of accepting a notification
 */
public sealed interface NotificationResult permits NotificationResult.Accepted, NotificationResult.Rejected {

    enum Disposition {
        /** Mailbox unknown or stopped */
        IGNORED,
        /** Cursor already covered */
        NO_OP,
        /** Sync job handed to a worker */
        QUEUED,
        /** Folded into the cycle already in flight */
        COALESCED
    }

    record Accepted(String mailboxId, long cursor, Disposition disposition) implements NotificationResult {
    }

    record Rejected(ValidationError error) implements NotificationResult {
    }
}
