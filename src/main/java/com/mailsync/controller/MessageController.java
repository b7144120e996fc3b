package com.mailsync.controller;

import com.mailsync.domain.AttachmentRef;
import com.mailsync.domain.MailMessage;
import com.mailsync.domain.MessageStats;
import com.mailsync.service.MessageQueryService;
import com.mailsync.service.MessageThread;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read API over the ingested store
 * - Get message (GET /api/messages/{id})
 * - List thread (GET /api/messages?threadId=)
 * - List recent (GET /api/messages?mailboxId=&limit=)
 * - Threads (GET /api/messages/threads?mailboxId=&limit=)
 * - Store totals (GET /api/messages/stats?mailboxId=)
 */
@RestController
@RequestMapping("/api/messages")
@RequiredArgsConstructor
public class MessageController {

    private final MessageQueryService queryService;

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getMessage(@PathVariable String id) {
        MailMessage message = queryService.getMessage(id);
        if (message == null) {
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("status", "error");
            response.put("message", "Message not found: " + id);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
        }
        Map<String, Object> response = toMap(message);
        response.put("attachments", message.getAttachmentRefs().stream()
                .map(MessageController::toMap)
                .collect(Collectors.toList()));
        return ResponseEntity.ok(response);
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> listMessages(@RequestParam(required = false) String threadId,
                                                            @RequestParam(required = false) String mailboxId,
                                                            @RequestParam(defaultValue = "50") int limit) {
        List<MailMessage> messages;
        if (threadId != null && !threadId.isBlank()) {
            messages = queryService.getThread(threadId);
        } else if (mailboxId != null && !mailboxId.isBlank()) {
            messages = queryService.getRecent(mailboxId, limit);
        } else {
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("status", "error");
            response.put("message", "threadId or mailboxId is required.");
            return ResponseEntity.badRequest().body(response);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("count", messages.size());
        response.put("messages", messages.stream().map(MessageController::toMap).collect(Collectors.toList()));
        return ResponseEntity.ok(response);
    }

    /**
     * Recent messages grouped by thread; threadless messages appear as single-message threads
     */
    @GetMapping("/threads")
    public ResponseEntity<Map<String, Object>> listThreads(@RequestParam(required = false) String mailboxId,
                                                           @RequestParam(defaultValue = "200") int limit) {
        List<Map<String, Object>> threads = new ArrayList<>();
        for (MessageThread thread : queryService.getThreads(blankToNull(mailboxId), limit)) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("threadId", thread.threadId());
            map.put("subject", thread.subject());
            map.put("messages", thread.messages().stream().map(MessageController::toMap).collect(Collectors.toList()));
            threads.add(map);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("count", threads.size());
        response.put("threads", threads);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats(@RequestParam(required = false) String mailboxId) {
        MessageStats stats = queryService.getStats(blankToNull(mailboxId));

        Map<String, Object> totals = new LinkedHashMap<>();
        totals.put("totalMessages", stats.getTotalMessages());
        totals.put("totalThreads", stats.getTotalThreads());
        totals.put("totalReplies", stats.getTotalReplies());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("stats", totals);
        return ResponseEntity.ok(response);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Map<String, Object> toMap(MailMessage message) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", message.getId());
        map.put("threadId", message.getThreadId());
        map.put("sender", message.getSender());
        map.put("recipients", message.getRecipients());
        map.put("subject", message.getSubject());
        map.put("body", message.getBody());
        map.put("receivedAt", message.getReceivedAt());
        map.put("isReply", message.isReply());
        return map;
    }

    private static Map<String, Object> toMap(AttachmentRef ref) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("attachmentId", ref.getAttachmentId());
        map.put("filename", ref.getFilename());
        map.put("mimeType", ref.getMimeType());
        map.put("sizeBytes", ref.getSizeBytes());
        return map;
    }
}
