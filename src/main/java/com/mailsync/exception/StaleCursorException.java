package com.mailsync.exception;

import lombok.Getter;

/**
 * The provider no longer keeps history back to the requested cursor.
 */
@Getter
public class StaleCursorException extends ProviderException {

    private final long cursor;

    public StaleCursorException(long cursor, Throwable cause) {
        super("History cursor " + cursor + " is outside the provider retention window", cause);
        this.cursor = cursor;
    }
}
