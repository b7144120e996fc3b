package com.mailsync.provider;

import java.util.Map;

/**
 * Full message as fetched from the provider
 *
 * @param headers      raw header values by name
 * @param body         plain-text body, empty when the message has none
 * @param internalDate provider receive time in epoch millis, null if unknown
 */
public record MessageDetail(String id,
                            String threadId,
                            Map<String, String> headers,
                            String body,
                            Long internalDate) {

    public MessageDetail {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? "" : body;
    }

    /**
     * Case-insensitive header lookup
     */
    public String header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
