package com.mailsync.service;

import com.mailsync.config.SyncProperties;
import com.mailsync.domain.SyncState;
import com.mailsync.exception.StaleCursorException;
import com.mailsync.exception.SyncFailureException;
import com.mailsync.exception.TransientProviderException;
import com.mailsync.provider.HistoryPage;
import com.mailsync.provider.ProviderCallPolicy;
import com.mailsync.provider.ProviderClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * History-based delta fetch
 * - Pages provider history from the stored cursor, collecting message-added ids
 * - Deduplicates ids across pages keeping first-seen order
 * - Falls back to a bounded recent-messages resync on a first sync or stale cursor
 * - Never fetches bodies and never writes the cursor
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeltaFetcher {

    private final ProviderClient providerClient;
    private final ProviderCallPolicy callPolicy;
    private final SyncStateStore stateStore;
    private final SyncProperties properties;

    /**
     * Compute the ids added between the stored cursor and {@code notifiedCursor}
     *
     * @throws SyncFailureException when the provider keeps failing after retries
     */
    public DeltaResult sync(String mailboxId, long notifiedCursor) {
        SyncState state = stateStore.get(mailboxId).orElse(null);
        Long from = state != null ? state.getCursor() : null;
        List<String> labels = parseLabels(state != null ? state.getLabelFilter() : null);

        if (from != null && notifiedCursor <= from) {
            log.debug("Notification cursor {} for {} not beyond stored cursor {}", notifiedCursor, mailboxId, from);
            return DeltaResult.unchanged(from);
        }

        try {
            if (from == null) {
                log.info("No stored cursor for {}, running full resync", mailboxId);
                return fullResync(mailboxId, null, notifiedCursor, labels);
            }
            try {
                return walkHistory(mailboxId, from, notifiedCursor, labels);
            } catch (StaleCursorException e) {
                log.warn("Cursor {} for {} expired on the provider, running full resync", from, mailboxId);
                return fullResync(mailboxId, from, notifiedCursor, labels);
            }
        } catch (TransientProviderException e) {
            throw new SyncFailureException(mailboxId,
                    "Delta fetch for " + mailboxId + " gave up after retries: " + e.getMessage(), e);
        }
    }

    private DeltaResult walkHistory(String mailboxId, long from, long notifiedCursor, List<String> labels) {
        Set<String> ids = new LinkedHashSet<>();
        long maxCursor = Math.max(from, notifiedCursor);
        String pageToken = null;
        int pages = 0;
        int maxPages = properties.getSync().getMaxHistoryPages();

        do {
            final String token = pageToken;
            HistoryPage page = callPolicy.call("listHistorySince " + from,
                    () -> providerClient.listHistorySince(mailboxId, from, token, labels));
            ids.addAll(page.addedMessageIds());
            maxCursor = Math.max(maxCursor, page.cursor());
            pageToken = page.hasNext() ? page.nextPageToken() : null;
            pages++;
        } while (pageToken != null && pages < maxPages);

        if (pageToken != null) {
            // Remaining pages are picked up by the next cycle from the unchanged cursor
            throw new SyncFailureException(mailboxId,
                    "History for " + mailboxId + " exceeded " + maxPages + " pages", null);
        }

        log.info("History walk for {}: {} -> {} ({} page(s), {} new id(s))",
                mailboxId, from, maxCursor, pages, ids.size());
        return new DeltaResult(new ArrayList<>(ids), from, maxCursor, false);
    }

    private DeltaResult fullResync(String mailboxId, Long from, long notifiedCursor, List<String> labels) {
        int limit = properties.getSync().getResyncLimit();
        // Read the cursor first so messages arriving during the listing are covered by the next walk
        long current = callPolicy.call("currentCursor", () -> providerClient.currentCursor(mailboxId));
        List<String> recent = callPolicy.call("listRecentMessageIds",
                () -> providerClient.listRecentMessageIds(mailboxId, limit, labels));

        long newCursor = Math.max(current, notifiedCursor);
        if (from != null) {
            newCursor = Math.max(newCursor, from);
        }
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(recent));
        log.info("Full resync for {}: {} recent id(s), cursor -> {}", mailboxId, ids.size(), newCursor);
        return new DeltaResult(ids, from, newCursor, true);
    }

    static List<String> parseLabels(String labelFilter) {
        if (labelFilter == null || labelFilter.isBlank()) {
            return List.of();
        }
        return Arrays.stream(labelFilter.split(","))
                .map(String::trim)
                .filter(label -> !label.isEmpty())
                .toList();
    }
}
