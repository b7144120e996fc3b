package com.mailsync.exception;

import lombok.Getter;

/**
 * A sync cycle gave up. The cursor was not advanced, so the next notification covers the same range.
 */
@Getter
public class SyncFailureException extends MailSyncException {

    private final String mailboxId;

    public SyncFailureException(String mailboxId, String message, Throwable cause) {
        super(message, cause);
        this.mailboxId = mailboxId;
    }
}
