package com.mailsync.service;

import com.mailsync.config.SyncProperties;
import com.mailsync.domain.AttachmentRef;
import com.mailsync.domain.MailMessage;
import com.mailsync.exception.MessageNotFoundException;
import com.mailsync.exception.TransientProviderException;
import com.mailsync.mapper.AttachmentRefMapper;
import com.mailsync.mapper.MailMessageMapper;
import com.mailsync.provider.AttachmentMeta;
import com.mailsync.provider.MessageDetail;
import com.mailsync.provider.ProviderCallPolicy;
import com.mailsync.provider.ProviderClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * MessageIngester unit tests
 */
@ExtendWith(MockitoExtension.class)
class MessageIngesterTest {

    private static final String MAILBOX = "user@example.com";

    @Mock
    private ProviderClient providerClient;

    @Mock
    private MailMessageMapper messageMapper;

    @Mock
    private AttachmentRefMapper attachmentMapper;

    @Mock
    private PlatformTransactionManager transactionManager;

    private SimpleMeterRegistry meterRegistry;
    private MessageIngester ingester;

    @BeforeEach
    void setUp() {
        SyncProperties properties = new SyncProperties();
        properties.getRetry().setMaxAttempts(2);
        properties.getRetry().setInitialDelayMs(1);
        properties.getRetry().setMaxDelayMs(5);
        meterRegistry = new SimpleMeterRegistry();
        ingester = new MessageIngester(providerClient, new ProviderCallPolicy(properties),
                messageMapper, attachmentMapper, new TransactionTemplate(transactionManager), meterRegistry);
    }

    private static MessageDetail detail(String id) {
        return new MessageDetail(id, "thread-" + id,
                Map.of("From", "alice@example.com", "To", "bob@example.com", "Subject", "Hello " + id),
                "Body of " + id, 1714557600000L);
    }

    @Test
    @DisplayName("Ingesting the same id twice stores exactly one row with the same content")
    void testIngest_Idempotent() {
        Map<String, MailMessage> store = new ConcurrentHashMap<>();
        when(messageMapper.countById(anyString()))
                .thenAnswer(inv -> store.containsKey(inv.<String>getArgument(0)) ? 1 : 0);
        when(messageMapper.insertIfAbsent(any(MailMessage.class)))
                .thenAnswer(inv -> {
                    MailMessage message = inv.getArgument(0);
                    return store.putIfAbsent(message.getId(), message) == null ? 1 : 0;
                });
        when(providerClient.getMessage(MAILBOX, "A")).thenReturn(detail("A"));
        when(providerClient.listAttachments(MAILBOX, "A")).thenReturn(List.of());

        IngestResult first = ingester.ingest(MAILBOX, List.of("A"));
        MailMessage stored = store.get("A");
        IngestResult second = ingester.ingest(MAILBOX, List.of("A"));

        assertThat(first.persisted()).containsExactly("A");
        assertThat(second.persisted()).containsExactly("A");
        assertThat(store).hasSize(1);
        assertThat(store.get("A")).isSameAs(stored);
        assertThat(stored.getSubject()).isEqualTo("Hello A");
        verify(providerClient, times(1)).getMessage(MAILBOX, "A");
        assertThat(meterRegistry.counter("mailsync.messages.ingested").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("One failing message does not stop the batch")
    void testIngest_PartialFailure() {
        when(messageMapper.countById(anyString())).thenReturn(0);
        when(messageMapper.insertIfAbsent(any(MailMessage.class))).thenReturn(1);
        when(providerClient.getMessage(MAILBOX, "C")).thenThrow(new TransientProviderException("503"));
        when(providerClient.getMessage(MAILBOX, "D")).thenReturn(detail("D"));
        when(providerClient.listAttachments(MAILBOX, "D")).thenReturn(List.of());

        IngestResult result = ingester.ingest(MAILBOX, List.of("C", "D"));

        assertThat(result.persisted()).containsExactly("D");
        assertThat(result.failed()).containsExactly("C");
        assertThat(result.isComplete()).isFalse();
        verify(providerClient, times(3)).getMessage(MAILBOX, "C");
        assertThat(meterRegistry.counter("mailsync.messages.failed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Message deleted on the provider is skipped, not failed")
    void testIngest_MessageGone() {
        when(messageMapper.countById("G")).thenReturn(0);
        when(providerClient.getMessage(MAILBOX, "G")).thenThrow(new MessageNotFoundException("G", null));

        IngestResult result = ingester.ingest(MAILBOX, List.of("G"));

        assertThat(result.skipped()).containsExactly("G");
        assertThat(result.isComplete()).isTrue();
        verify(messageMapper, never()).insertIfAbsent(any());
    }

    @Test
    @DisplayName("Attachment refs are written with the message")
    void testIngest_Attachments() {
        when(messageMapper.countById("A")).thenReturn(0);
        when(messageMapper.insertIfAbsent(any(MailMessage.class))).thenReturn(1);
        when(providerClient.getMessage(MAILBOX, "A")).thenReturn(detail("A"));
        when(providerClient.listAttachments(MAILBOX, "A")).thenReturn(List.of(
                new AttachmentMeta("1", "a.pdf", "application/pdf", 10),
                new AttachmentMeta("2", "b.png", "image/png", 20)));

        ingester.ingest(MAILBOX, List.of("A"));

        verify(attachmentMapper, times(2)).insertIfAbsent(any(AttachmentRef.class));
        verify(transactionManager).commit(any());
    }

    @Test
    @DisplayName("Losing an insert race keeps the existing row and skips attachment writes")
    void testIngest_InsertRace() {
        when(messageMapper.countById("A")).thenReturn(0);
        when(messageMapper.insertIfAbsent(any(MailMessage.class))).thenReturn(0);
        when(providerClient.getMessage(MAILBOX, "A")).thenReturn(detail("A"));
        when(providerClient.listAttachments(MAILBOX, "A"))
                .thenReturn(List.of(new AttachmentMeta("1", "a.pdf", "application/pdf", 10)));

        IngestResult result = ingester.ingest(MAILBOX, List.of("A"));

        assertThat(result.persisted()).containsExactly("A");
        verify(attachmentMapper, never()).insertIfAbsent(any());
        assertThat(meterRegistry.counter("mailsync.messages.ingested").count()).isZero();
    }

    @Test
    @DisplayName("Repeated ids within a batch are processed once")
    void testIngest_DuplicateIds() {
        when(messageMapper.countById("A")).thenReturn(1);

        IngestResult result = ingester.ingest(MAILBOX, List.of("A", "A", "A"));

        assertThat(result.persisted()).containsExactly("A");
        verify(messageMapper, times(1)).countById("A");
        verifyNoInteractions(providerClient);
    }

    @Test
    @DisplayName("Reply flag is stored")
    void testIngest_ReplyFlag() {
        when(messageMapper.countById("R")).thenReturn(0);
        when(messageMapper.insertIfAbsent(any(MailMessage.class))).thenReturn(1);
        when(providerClient.getMessage(MAILBOX, "R")).thenReturn(new MessageDetail("R", "t",
                Map.of("Subject", "Re: hello", "In-Reply-To", "<x@example.com>"), "", 0L));
        when(providerClient.listAttachments(MAILBOX, "R")).thenReturn(List.of());

        ingester.ingest(MAILBOX, List.of("R"));

        verify(messageMapper).insertIfAbsent(argThat(MailMessage::isReply));
    }
}
