package com.mailsync.service;

import java.util.List;

/**
 * Result of a delta fetch
 *
 * @param messageIds  newly added ids, deduplicated, first-seen order
 * @param fromCursor  cursor the fetch started from, null on a first sync
 * @param newCursor   highest cursor observed; to be committed once the ids are ingested
 * @param fullResync  true when history was bypassed for the recent-messages fallback
 */
public record DeltaResult(List<String> messageIds, Long fromCursor, long newCursor, boolean fullResync) {

    public DeltaResult {
        messageIds = List.copyOf(messageIds);
    }

    public static DeltaResult unchanged(long cursor) {
        return new DeltaResult(List.of(), cursor, cursor, false);
    }
}
