package com.mailsync.notification;

/**
 * A validated change notification
 *
 * @param messageId   broker message id, may be null
 * @param publishTime broker publish time as sent, may be null
 */
public record DecodedNotification(String mailboxId, long cursor, String messageId, String publishTime) {
}
