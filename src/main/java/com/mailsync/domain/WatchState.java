package com.mailsync.domain;

/**
 * Watch state of a mailbox. INACTIVE is never persisted: it means no row exists.
 */
public enum WatchState {
    INACTIVE,
    ACTIVE,
    STOPPED
}
