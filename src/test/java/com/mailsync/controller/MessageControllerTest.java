package com.mailsync.controller;

import com.mailsync.domain.MailMessage;
import com.mailsync.domain.MessageStats;
import com.mailsync.service.MessageQueryService;
import com.mailsync.service.MessageThread;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * MessageController unit tests
 */
@ExtendWith(MockitoExtension.class)
class MessageControllerTest {

    @Mock
    private MessageQueryService queryService;

    @InjectMocks
    private MessageController controller;

    private static MailMessage message(String id, String threadId) {
        return MailMessage.builder()
                .id(id)
                .mailboxId("user@example.com")
                .threadId(threadId)
                .subject("Plan")
                .receivedAt("2024-05-01T10:00:00Z")
                .build();
    }

    @Test
    @DisplayName("Threads endpoint lists each thread with its messages")
    @SuppressWarnings("unchecked")
    void testListThreads() {
        when(queryService.getThreads("user@example.com", 200)).thenReturn(List.of(
                new MessageThread("T1", "Plan", List.of(message("A", "T1"), message("B", "T1"))),
                new MessageThread("C", "Plan", List.of(message("C", null)))));

        ResponseEntity<Map<String, Object>> response = controller.listThreads("user@example.com", 200);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsEntry("status", "success").containsEntry("count", 2);
        List<Map<String, Object>> threads = (List<Map<String, Object>>) response.getBody().get("threads");
        assertThat(threads.get(0)).containsEntry("threadId", "T1").containsEntry("subject", "Plan");
        assertThat((List<Map<String, Object>>) threads.get(0).get("messages"))
                .extracting(m -> m.get("id"))
                .containsExactly("A", "B");
    }

    @Test
    @DisplayName("Blank mailboxId on threads spans every mailbox")
    void testListThreads_AllMailboxes() {
        when(queryService.getThreads(null, 50)).thenReturn(List.of());

        ResponseEntity<Map<String, Object>> response = controller.listThreads("  ", 50);

        assertThat(response.getBody()).containsEntry("count", 0);
        verify(queryService).getThreads(null, 50);
    }

    @Test
    @DisplayName("Stats endpoint reports message, thread and reply totals")
    void testStats() {
        when(queryService.getStats("user@example.com")).thenReturn(new MessageStats(4L, 1L, 2L));

        ResponseEntity<Map<String, Object>> response = controller.stats("user@example.com");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsEntry("status", "success");
        assertThat(response.getBody().get("stats")).isEqualTo(Map.of(
                "totalMessages", 4L,
                "totalThreads", 1L,
                "totalReplies", 2L));
    }

    @Test
    @DisplayName("List without threadId or mailboxId is rejected")
    void testListMessages_MissingFilter() {
        ResponseEntity<Map<String, Object>> response = controller.listMessages(null, "", 50);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verifyNoInteractions(queryService);
    }

    @Test
    @DisplayName("Unknown message id returns 404")
    void testGetMessage_NotFound() {
        when(queryService.getMessage("missing")).thenReturn(null);

        ResponseEntity<Map<String, Object>> response = controller.getMessage("missing");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }
}
