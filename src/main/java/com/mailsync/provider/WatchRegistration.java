package com.mailsync.provider;

/**
 * Watch registered with the provider
 *
 * @param cursor     history cursor at registration time
 * @param expiration epoch millis after which notifications stop unless renewed
 */
public record WatchRegistration(long cursor, long expiration) {
}
