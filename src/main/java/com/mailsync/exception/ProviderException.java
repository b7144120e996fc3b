package com.mailsync.exception;

/**
 * Non-retryable provider failure
 */
public class ProviderException extends MailSyncException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
