package com.mailsync.exception;

/**
 * Timeout, rate limit or server-side hiccup. Retried with backoff.
 */
public class TransientProviderException extends ProviderException {

    public TransientProviderException(String message) {
        super(message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
