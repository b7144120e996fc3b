package com.mailsync.notification;

/**
 * Why an inbound payload was rejected
 */
public record ValidationError(String reason) {
}
