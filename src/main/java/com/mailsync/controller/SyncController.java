package com.mailsync.controller;

import com.mailsync.exception.ConfigurationException;
import com.mailsync.exception.ProviderException;
import com.mailsync.exception.TransientProviderException;
import com.mailsync.notification.NotificationResult;
import com.mailsync.provider.WatchRegistration;
import com.mailsync.service.NotificationReceiver;
import com.mailsync.service.WatchLifecycleManager;
import com.mailsync.service.WatchStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Sync REST API
 * - Push webhook (POST /sync/webhook)
 * - Watch control for the external scheduler (POST /sync/start, POST /sync/stop, GET /sync/status)
 * - Watch listing (GET /sync/watches)
 * - Manual trigger (POST /sync/trigger)
 */
@Slf4j
@RestController
@RequestMapping("/sync")
@RequiredArgsConstructor
public class SyncController {

    private final NotificationReceiver notificationReceiver;
    private final WatchLifecycleManager watchManager;

    /**
     * Push webhook
     * POST /sync/webhook
     * Body: { "message": { "data": "base64", "messageId": "...", "publishTime": "..." }, "subscription": "..." }
     * 200 accepted or no-op, 400 malformed, 500 internal failure (the broker redelivers)
     */
    @PostMapping("/webhook")
    public ResponseEntity<Map<String, Object>> webhook(@RequestBody(required = false) String body) {
        try {
            return notificationResponse(notificationReceiver.accept(body));
        } catch (RuntimeException e) {
            log.error("Webhook processing failed", e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Notification could not be processed.");
        }
    }

    /**
     * Manual trigger, skipping the envelope
     * POST /sync/trigger
     * Body: { "mailboxId": "user@example.com", "cursor": 12345 }
     */
    @PostMapping("/trigger")
    public ResponseEntity<Map<String, Object>> trigger(@RequestBody Map<String, Object> request) {
        Object mailboxId = request.get("mailboxId");
        Long cursor = toLong(request.get("cursor"));
        try {
            return notificationResponse(notificationReceiver.trigger(
                    mailboxId instanceof String id ? id : null, cursor != null ? cursor : 0L));
        } catch (RuntimeException e) {
            log.error("Manual trigger failed", e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Notification could not be processed.");
        }
    }

    /**
     * Register or renew a watch
     * POST /sync/start
     * Body: { "mailboxId": "...", "notificationTarget": "projects/p/topics/t", "labelFilter": "INBOX" }
     */
    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start(@RequestBody Map<String, Object> request) {
        Object mailboxId = request.get("mailboxId");
        Object target = request.get("notificationTarget");
        try {
            WatchRegistration registration = watchManager.start(
                    mailboxId instanceof String id ? id : null,
                    target instanceof String topic ? topic : null,
                    toLabelFilter(request.get("labelFilter")));

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("cursor", registration.cursor());
            response.put("expiration", registration.expiration());
            return ResponseEntity.ok(response);
        } catch (ConfigurationException e) {
            log.warn("Watch start refused for {}: {}", mailboxId, e.getMessage());
            return errorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (RuntimeException e) {
            return providerFailure("start", mailboxId, e);
        }
    }

    /**
     * Cancel a watch
     * POST /sync/stop
     * Body: { "mailboxId": "..." }
     */
    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop(@RequestBody Map<String, Object> request) {
        Object mailboxId = request.get("mailboxId");
        if (!(mailboxId instanceof String id) || id.isBlank()) {
            return errorResponse(HttpStatus.BAD_REQUEST, "mailboxId is required.");
        }
        try {
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("stopped", watchManager.stop(id));
            return ResponseEntity.ok(response);
        } catch (ConfigurationException e) {
            return errorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (RuntimeException e) {
            return providerFailure("stop", id, e);
        }
    }

    /**
     * Watch status
     * GET /sync/status?mailboxId=
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status(@RequestParam String mailboxId) {
        Optional<WatchStatus> status = watchManager.status(mailboxId);
        if (status.isEmpty()) {
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("mailboxId", mailboxId);
            response.put("state", "INACTIVE");
            return ResponseEntity.ok(response);
        }
        return ResponseEntity.ok(toMap(status.get()));
    }

    /**
     * All known watches
     * GET /sync/watches
     */
    @GetMapping("/watches")
    public ResponseEntity<Map<String, Object>> watches() {
        List<Map<String, Object>> watches = watchManager.listWatches().stream()
                .map(this::toMap)
                .collect(Collectors.toList());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("count", watches.size());
        response.put("watches", watches);
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, Object>> notificationResponse(NotificationResult result) {
        if (result instanceof NotificationResult.Rejected rejected) {
            return errorResponse(HttpStatus.BAD_REQUEST, rejected.error().reason());
        }
        NotificationResult.Accepted accepted = (NotificationResult.Accepted) result;
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("mailboxId", accepted.mailboxId());
        response.put("cursor", accepted.cursor());
        response.put("disposition", accepted.disposition().name());
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, Object>> providerFailure(String operation, Object mailboxId, RuntimeException e) {
        if (e instanceof TransientProviderException) {
            log.warn("Watch {} for {} failed after retries: {}", operation, mailboxId, e.getMessage());
            return errorResponse(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
        }
        if (e instanceof ProviderException) {
            log.error("Watch {} for {} rejected by provider: {}", operation, mailboxId, e.getMessage());
            return errorResponse(HttpStatus.BAD_GATEWAY, e.getMessage());
        }
        log.error("Watch {} for {} failed", operation, mailboxId, e);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error.");
    }

    private Map<String, Object> toMap(WatchStatus status) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("mailboxId", status.mailboxId());
        map.put("state", status.state().name());
        map.put("cursor", status.cursor());
        map.put("expiration", status.expiration());
        map.put("lastUpdated", status.lastUpdated());
        return map;
    }

    private static String toLabelFilter(Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Collection<?> labels) {
            return labels.stream().map(String::valueOf).collect(Collectors.joining(","));
        }
        return null;
    }

    private static Long toLong(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
