package com.mailsync.provider;

import java.util.List;

/**
 * A page of message-added history events
 *
 * @param addedMessageIds ids in event order; may repeat within and across pages
 * @param cursor          the mailbox cursor the provider reported with this page
 * @param nextPageToken   null on the last page
 */
public record HistoryPage(List<String> addedMessageIds, long cursor, String nextPageToken) {

    public HistoryPage {
        addedMessageIds = addedMessageIds == null ? List.of() : List.copyOf(addedMessageIds);
    }

    public boolean hasNext() {
        return nextPageToken != null && !nextPageToken.isBlank();
    }
}
