package com.mailsync.service;

import com.mailsync.domain.SyncState;
import com.mailsync.domain.WatchState;

/**
 * Watch status as reported to the renewal scheduler
 */
public record WatchStatus(String mailboxId, WatchState state, Long cursor, Long expiration, String lastUpdated) {

    public static WatchStatus of(SyncState state) {
        return new WatchStatus(state.getMailboxId(), state.getStatus(), state.getCursor(),
                state.getExpiration(), state.getLastUpdated());
    }
}
