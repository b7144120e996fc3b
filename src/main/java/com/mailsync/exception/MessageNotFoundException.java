package com.mailsync.exception;

import lombok.Getter;

/**
 * Message deleted on the provider side before it could be fetched
 */
@Getter
public class MessageNotFoundException extends ProviderException {

    private final String messageId;

    public MessageNotFoundException(String messageId, Throwable cause) {
        super("Message not found: " + messageId, cause);
        this.messageId = messageId;
    }
}
