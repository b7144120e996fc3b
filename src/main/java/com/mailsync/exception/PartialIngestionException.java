package com.mailsync.exception;

import lombok.Getter;

import java.util.List;

/**
 * Some messages of a batch could not be ingested; the cursor is held at its pre-batch value.
 */
@Getter
public class PartialIngestionException extends MailSyncException {

    private final String mailboxId;
    private final List<String> failedIds;
    private final Long heldCursor;

    public PartialIngestionException(String mailboxId, List<String> failedIds, Long heldCursor) {
        super("Ingestion failed for " + failedIds.size() + " message(s) of " + mailboxId
                + ", cursor held at " + heldCursor);
        this.mailboxId = mailboxId;
        this.failedIds = List.copyOf(failedIds);
        this.heldCursor = heldCursor;
    }
}
