package com.mailsync.service;

import com.mailsync.domain.SyncState;
import com.mailsync.domain.WatchState;
import com.mailsync.mapper.SyncStateMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Durable sync state, one row per mailbox
 * - Writes for a mailbox are serialized by a per-mailbox lock
 * - The cursor only moves forward; the SQL update is conditional as well
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncStateStore {

    private final SyncStateMapper stateMapper;
    private final Clock clock;

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public Optional<SyncState> get(String mailboxId) {
        return Optional.ofNullable(stateMapper.findById(mailboxId));
    }

    public List<SyncState> findAll() {
        return stateMapper.findAll();
    }

    /**
     * Atomically replace cursor and expiration of the mailbox row.
     * A cursor lower than the stored one is ignored.
     */
    public SyncState set(String mailboxId, long cursor, long expiration) {
        return withLock(mailboxId, () -> {
            SyncState existing = stateMapper.findById(mailboxId);
            SyncState next = existing != null ? existing : SyncState.builder()
                    .mailboxId(mailboxId)
                    .status(WatchState.ACTIVE)
                    .build();
            next.setCursor(maxCursor(next.getCursor(), cursor));
            next.setExpiration(expiration);
            next.setLastUpdated(now());
            stateMapper.upsert(next);
            return next;
        });
    }

    /**
     * Mark the mailbox ACTIVE with a freshly registered watch
     */
    public SyncState activate(String mailboxId, long cursor, long expiration,
                              String notificationTarget, String labelFilter) {
        return withLock(mailboxId, () -> {
            SyncState existing = stateMapper.findById(mailboxId);
            Long storedCursor = existing != null ? existing.getCursor() : null;
            SyncState next = SyncState.builder()
                    .mailboxId(mailboxId)
                    .cursor(maxCursor(storedCursor, cursor))
                    .expiration(expiration)
                    .status(WatchState.ACTIVE)
                    .notificationTarget(notificationTarget)
                    .labelFilter(labelFilter)
                    .lastUpdated(now())
                    .build();
            stateMapper.upsert(next);
            log.info("Sync state for {} ACTIVE (cursor={}, expiration={})", mailboxId, next.getCursor(), expiration);
            return next;
        });
    }

    /**
     * Flip the mailbox to STOPPED, keeping the last cursor
     */
    public boolean markStopped(String mailboxId) {
        return withLock(mailboxId, () -> {
            int updated = stateMapper.updateStatus(mailboxId, WatchState.STOPPED.name(), now());
            if (updated > 0) {
                log.info("Sync state for {} STOPPED", mailboxId);
            }
            return updated > 0;
        });
    }

    /**
     * Move the cursor forward after a committed cycle.
     *
     * @return true when the stored cursor changed
     */
    public boolean advanceCursor(String mailboxId, long cursor) {
        return withLock(mailboxId, () -> {
            SyncState existing = stateMapper.findById(mailboxId);
            if (existing == null) {
                log.warn("No sync state for {}, cursor {} not recorded", mailboxId, cursor);
                return false;
            }
            if (existing.getCursor() != null && existing.getCursor() >= cursor) {
                log.debug("Cursor for {} already at {} (offered {})", mailboxId, existing.getCursor(), cursor);
                return false;
            }
            boolean advanced = stateMapper.advanceCursor(mailboxId, cursor, now()) > 0;
            if (advanced) {
                log.debug("Cursor for {} advanced {} -> {}", mailboxId, existing.getCursor(), cursor);
            }
            return advanced;
        });
    }

    private <T> T withLock(String mailboxId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(mailboxId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static Long maxCursor(Long stored, long offered) {
        return stored == null ? offered : Math.max(stored, offered);
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
