package com.mailsync.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Synchronization state, one row per mailbox
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncState {

    private String mailboxId;
    private Long cursor;                // Null until the provider reported one
    private Long expiration;            // Watch expiration, epoch millis
    private WatchState status;
    private String notificationTarget;
    private String labelFilter;         // Comma separated label ids
    private String lastUpdated;         // ISO-8601 instant

    public boolean isActive() {
        return status == WatchState.ACTIVE;
    }
}
