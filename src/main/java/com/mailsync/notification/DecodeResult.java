package com.mailsync.notification;

/**
 * Tagged result of payload decoding
 */
public sealed interface DecodeResult permits DecodeResult.Ok, DecodeResult.Err {

    record Ok(DecodedNotification notification) implements DecodeResult {
    }

    record Err(ValidationError error) implements DecodeResult {
    }

    static DecodeResult ok(DecodedNotification notification) {
        return new Ok(notification);
    }

    static DecodeResult err(String reason) {
        return new Err(new ValidationError(reason));
    }
}
