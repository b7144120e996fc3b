package com.mailsync.service;

import com.mailsync.config.SyncProperties;
import com.mailsync.domain.SyncState;
import com.mailsync.domain.WatchState;
import com.mailsync.exception.StaleCursorException;
import com.mailsync.exception.SyncFailureException;
import com.mailsync.exception.TransientProviderException;
import com.mailsync.provider.HistoryPage;
import com.mailsync.provider.ProviderCallPolicy;
import com.mailsync.provider.ProviderClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * DeltaFetcher unit tests
 */
@ExtendWith(MockitoExtension.class)
class DeltaFetcherTest {

    private static final String MAILBOX = "user@example.com";

    @Mock
    private ProviderClient providerClient;

    @Mock
    private SyncStateStore stateStore;

    private SyncProperties properties;
    private DeltaFetcher deltaFetcher;

    @BeforeEach
    void setUp() {
        properties = new SyncProperties();
        properties.getRetry().setMaxAttempts(2);
        properties.getRetry().setInitialDelayMs(1);
        properties.getRetry().setMaxDelayMs(5);
        properties.getProvider().setTimeoutMs(2000);
        deltaFetcher = new DeltaFetcher(providerClient, new ProviderCallPolicy(properties), stateStore, properties);
    }

    private void storedCursor(Long cursor) {
        when(stateStore.get(MAILBOX)).thenReturn(Optional.of(SyncState.builder()
                .mailboxId(MAILBOX)
                .cursor(cursor)
                .status(WatchState.ACTIVE)
                .build()));
    }

    @Test
    @DisplayName("Ids repeated across pages are returned once in first-seen order")
    void testSync_DedupAcrossPages() {
        storedCursor(100L);
        when(providerClient.listHistorySince(MAILBOX, 100L, null, List.of()))
                .thenReturn(new HistoryPage(List.of("X", "A"), 103L, "p2"));
        when(providerClient.listHistorySince(MAILBOX, 100L, "p2", List.of()))
                .thenReturn(new HistoryPage(List.of("X", "B"), 104L, "p3"));
        when(providerClient.listHistorySince(MAILBOX, 100L, "p3", List.of()))
                .thenReturn(new HistoryPage(List.of("X"), 105L, null));

        DeltaResult result = deltaFetcher.sync(MAILBOX, 105L);

        assertThat(result.messageIds()).containsExactly("X", "A", "B");
        assertThat(result.fromCursor()).isEqualTo(100L);
        assertThat(result.newCursor()).isEqualTo(105L);
        assertThat(result.fullResync()).isFalse();
    }

    @Test
    @DisplayName("newCursor is the highest cursor observed while paging")
    void testSync_HigherCursorFromProvider() {
        storedCursor(100L);
        when(providerClient.listHistorySince(MAILBOX, 100L, null, List.of()))
                .thenReturn(new HistoryPage(List.of("A"), 110L, null));

        DeltaResult result = deltaFetcher.sync(MAILBOX, 105L);

        assertThat(result.newCursor()).isEqualTo(110L);
    }

    @Test
    @DisplayName("Notified cursor not beyond stored cursor makes no provider call")
    void testSync_NoOp() {
        storedCursor(105L);

        DeltaResult result = deltaFetcher.sync(MAILBOX, 105L);

        assertThat(result.messageIds()).isEmpty();
        assertThat(result.newCursor()).isEqualTo(105L);
        verifyNoInteractions(providerClient);
    }

    @Test
    @DisplayName("Stale cursor falls back to a bounded recent-messages resync")
    void testSync_StaleCursorFallback() {
        storedCursor(100L);
        List<String> recent = IntStream.range(0, 50).mapToObj(i -> "m" + i).toList();
        when(providerClient.listHistorySince(MAILBOX, 100L, null, List.of()))
                .thenThrow(new StaleCursorException(100L, null));
        when(providerClient.currentCursor(MAILBOX)).thenReturn(500L);
        when(providerClient.listRecentMessageIds(MAILBOX, 50, List.of())).thenReturn(recent);

        DeltaResult result = deltaFetcher.sync(MAILBOX, 480L);

        assertThat(result.fullResync()).isTrue();
        assertThat(result.messageIds()).hasSize(50).containsExactlyElementsOf(recent);
        assertThat(result.newCursor()).isEqualTo(500L);
        verify(providerClient, times(1)).listHistorySince(anyString(), anyLong(), any(), any());
    }

    @Test
    @DisplayName("First sync without a stored cursor runs a full resync")
    void testSync_FirstSync() {
        storedCursor(null);
        when(providerClient.currentCursor(MAILBOX)).thenReturn(90L);
        when(providerClient.listRecentMessageIds(MAILBOX, 50, List.of())).thenReturn(List.of("A", "B"));

        DeltaResult result = deltaFetcher.sync(MAILBOX, 100L);

        assertThat(result.fullResync()).isTrue();
        assertThat(result.fromCursor()).isNull();
        assertThat(result.newCursor()).isEqualTo(100L);
        verify(providerClient, never()).listHistorySince(anyString(), anyLong(), any(), any());
    }

    @Test
    @DisplayName("Label filter of the stored state is passed to the provider")
    void testSync_LabelFilter() {
        when(stateStore.get(MAILBOX)).thenReturn(Optional.of(SyncState.builder()
                .mailboxId(MAILBOX).cursor(100L).status(WatchState.ACTIVE).labelFilter("INBOX, IMPORTANT").build()));
        when(providerClient.listHistorySince(MAILBOX, 100L, null, List.of("INBOX", "IMPORTANT")))
                .thenReturn(new HistoryPage(List.of("A"), 101L, null));

        assertThat(deltaFetcher.sync(MAILBOX, 101L).messageIds()).containsExactly("A");
    }

    @Test
    @DisplayName("Transient failure is retried and then succeeds")
    void testSync_TransientThenSuccess() {
        storedCursor(100L);
        when(providerClient.listHistorySince(MAILBOX, 100L, null, List.of()))
                .thenThrow(new TransientProviderException("429"))
                .thenReturn(new HistoryPage(List.of("A"), 101L, null));

        DeltaResult result = deltaFetcher.sync(MAILBOX, 101L);

        assertThat(result.messageIds()).containsExactly("A");
        verify(providerClient, times(2)).listHistorySince(MAILBOX, 100L, null, List.of());
    }

    @Test
    @DisplayName("Exhausted retries surface as SyncFailureException")
    void testSync_RetriesExhausted() {
        storedCursor(100L);
        when(providerClient.listHistorySince(MAILBOX, 100L, null, List.of()))
                .thenThrow(new TransientProviderException("503"));

        assertThatThrownBy(() -> deltaFetcher.sync(MAILBOX, 105L))
                .isInstanceOf(SyncFailureException.class)
                .hasCauseInstanceOf(TransientProviderException.class);
        verify(providerClient, times(3)).listHistorySince(MAILBOX, 100L, null, List.of());
    }

    @Test
    @DisplayName("History longer than the page limit fails the cycle")
    void testSync_TooManyPages() {
        properties.getSync().setMaxHistoryPages(2);
        storedCursor(100L);
        when(providerClient.listHistorySince(eq(MAILBOX), eq(100L), any(), eq(List.of())))
                .thenReturn(new HistoryPage(List.of("A"), 101L, "next"));

        assertThatThrownBy(() -> deltaFetcher.sync(MAILBOX, 105L))
                .isInstanceOf(SyncFailureException.class)
                .hasMessageContaining("2 pages");
    }
}
