package com.mailsync.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Strict decoder for push envelopes
 * <pre>
 * { "message": { "data": base64(JSON{mailboxId, cursor}), "messageId": ..., "publishTime": ... },
 *   "subscription": "..." }
 * </pre>
 * The inner document may also use the provider's native names {@code emailAddress} and {@code historyId}.
 * Bad input yields {@link DecodeResult.Err}; nothing is thrown.
 */
@Component
@RequiredArgsConstructor
public class NotificationDecoder {

    private static final Pattern DIGITS = Pattern.compile("\\d{1,19}");

    private final ObjectMapper objectMapper;

    public DecodeResult decode(String rawPayload) {
        if (rawPayload == null || rawPayload.isBlank()) {
            return DecodeResult.err("empty body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(rawPayload);
        } catch (JsonProcessingException e) {
            return DecodeResult.err("body is not valid JSON");
        }
        if (root == null || !root.isObject()) {
            return DecodeResult.err("body is not a JSON object");
        }

        JsonNode subscription = root.get("subscription");
        if (subscription == null || !subscription.isTextual() || subscription.asText().isBlank()) {
            return DecodeResult.err("missing subscription");
        }

        JsonNode message = root.get("message");
        if (message == null || !message.isObject()) {
            return DecodeResult.err("missing message object");
        }

        JsonNode data = message.get("data");
        if (data == null || !data.isTextual() || data.asText().isBlank()) {
            return DecodeResult.err("missing message.data");
        }

        byte[] decoded = decodeBase64(data.asText().trim());
        if (decoded == null) {
            return DecodeResult.err("message.data is not base64");
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(new String(decoded, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            return DecodeResult.err("message.data is not JSON");
        }
        if (payload == null || !payload.isObject()) {
            return DecodeResult.err("message.data is not a JSON object");
        }

        String mailboxId = firstText(payload, "mailboxId", "emailAddress");
        if (mailboxId == null) {
            return DecodeResult.err("missing mailboxId");
        }

        JsonNode cursorNode = payload.has("cursor") ? payload.get("cursor") : payload.get("historyId");
        Long cursor = parseCursor(cursorNode);
        if (cursor == null) {
            return DecodeResult.err("missing or invalid cursor");
        }

        return DecodeResult.ok(new DecodedNotification(mailboxId, cursor,
                firstText(message, "messageId", "message_id"),
                firstText(message, "publishTime", "publish_time")));
    }

    /**
     * Positive 64-bit cursor given as a JSON integer or a decimal string
     */
    static Long parseCursor(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        long value;
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            value = node.asLong();
        } else if (node.isTextual() && DIGITS.matcher(node.asText().trim()).matches()) {
            try {
                value = Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return value > 0 ? value : null;
    }

    private static byte[] decodeBase64(String text) {
        try {
            return Base64.getDecoder().decode(text);
        } catch (IllegalArgumentException e) {
            try {
                return Base64.getUrlDecoder().decode(text);
            } catch (IllegalArgumentException urlError) {
                return null;
            }
        }
    }

    private static String firstText(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }
}
