package com.mailsync.exception;

/**
 * Watch registration refused: bad target, missing permission or billing, missing credentials.
 * Fatal for the caller of start(); no state is written.
 */
public class ConfigurationException extends MailSyncException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
