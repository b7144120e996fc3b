package com.mailsync.service;

import java.util.List;

/**
 * Result of a committed sync cycle
 *
 * @param committedCursor cursor stored after the cycle (null if none is known yet)
 * @param advanced        true when this cycle moved the stored cursor
 */
public record SyncOutcome(String mailboxId,
                          List<String> persisted,
                          List<String> skipped,
                          Long committedCursor,
                          boolean advanced,
                          boolean fullResync) {

    public SyncOutcome {
        persisted = List.copyOf(persisted);
        skipped = List.copyOf(skipped);
    }

    public static SyncOutcome idle(String mailboxId, Long cursor) {
        return new SyncOutcome(mailboxId, List.of(), List.of(), cursor, false, false);
    }
}
