package com.mailsync.provider;

import java.util.List;

/**
 * Authenticated access to the remote mailbox.
 * <p>
 * Implementations signal failures with the {@code com.mailsync.exception} hierarchy:
 * {@code TransientProviderException} for anything worth retrying,
 * {@code StaleCursorException} when history no longer reaches a cursor,
 * {@code MessageNotFoundException} for a vanished message and
 * {@code ConfigurationException} when a watch cannot be registered.
 * Calls block; callers run them on worker threads.
 */
public interface ProviderClient {

    /**
     * Register (or refresh) the change watch for a mailbox.
     *
     * @param labelFilter label ids to watch, empty for the whole mailbox
     */
    WatchRegistration startWatch(String mailboxId, String notificationTarget, List<String> labelFilter);

    void stopWatch(String mailboxId);

    /**
     * One page of message-added history events after {@code cursor}.
     *
     * @param pageToken null for the first page
     */
    HistoryPage listHistorySince(String mailboxId, long cursor, String pageToken, List<String> labelFilter);

    MessageDetail getMessage(String mailboxId, String messageId);

    List<AttachmentMeta> listAttachments(String mailboxId, String messageId);

    /**
     * Ids of the most recent messages, newest first. Used when history cannot be walked.
     */
    List<String> listRecentMessageIds(String mailboxId, int limit, List<String> labelFilter);

    /**
     * The mailbox's current history cursor.
     */
    long currentCursor(String mailboxId);
}
