package com.mailsync.exception;

/**
 * Base class of every sync failure
 */
public class MailSyncException extends RuntimeException {

    public MailSyncException(String message) {
        super(message);
    }

    public MailSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
