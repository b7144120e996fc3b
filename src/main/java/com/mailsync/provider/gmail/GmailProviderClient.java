package com.mailsync.provider.gmail;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.History;
import com.google.api.services.gmail.model.HistoryMessageAdded;
import com.google.api.services.gmail.model.ListHistoryResponse;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import com.google.api.services.gmail.model.WatchRequest;
import com.google.api.services.gmail.model.WatchResponse;
import com.google.auth.http.HttpCredentialsAdapter;
import com.google.auth.oauth2.UserCredentials;
import com.mailsync.config.SyncProperties;
import com.mailsync.exception.ConfigurationException;
import com.mailsync.exception.MessageNotFoundException;
import com.mailsync.exception.ProviderException;
import com.mailsync.exception.StaleCursorException;
import com.mailsync.exception.TransientProviderException;
import com.mailsync.provider.AttachmentMeta;
import com.mailsync.provider.HistoryPage;
import com.mailsync.provider.MessageDetail;
import com.mailsync.provider.ProviderClient;
import com.mailsync.provider.WatchRegistration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigInteger;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Gmail API v1 adapter
 * - users.watch / users.stop for Pub/Sub push registration
 * - users.history.list for message-added deltas
 * - users.messages.get (format=full) for headers, text body and attachment parts
 * The API client is built on first use so the service starts without credentials.
 * A label filter selects messages carrying every listed label, on history walks and resyncs alike.
 */
@Slf4j
@Component
public class GmailProviderClient implements ProviderClient {

    private static final String HISTORY_MESSAGE_ADDED = "messageAdded";
    private static final int FETCHED_CACHE_LIMIT = 64;

    private final SyncProperties properties;

    private volatile Gmail gmail;

    /** Full message kept from getMessage for the listAttachments call that follows it */
    private final ConcurrentMap<String, Message> fetched = new ConcurrentHashMap<>();

    @Autowired
    public GmailProviderClient(SyncProperties properties) {
        this.properties = properties;
    }

    GmailProviderClient(SyncProperties properties, Gmail gmail) {
        this.properties = properties;
        this.gmail = gmail;
    }

    @Override
    public WatchRegistration startWatch(String mailboxId, String notificationTarget, List<String> labelFilter) {
        WatchRequest request = new WatchRequest().setTopicName(notificationTarget);
        if (!labelFilter.isEmpty()) {
            request.setLabelIds(labelFilter);
        }
        try {
            WatchResponse response = client().users().watch(userId(), request).execute();
            log.info("Gmail watch registered for {} on {} (historyId={}, expiration={})",
                    mailboxId, notificationTarget, response.getHistoryId(), response.getExpiration());
            long expiration = response.getExpiration() != null ? response.getExpiration() : 0L;
            return new WatchRegistration(toCursor(response.getHistoryId()), expiration);
        } catch (HttpResponseException e) {
            int status = e.getStatusCode();
            if (status == 400 || status == 401 || status == 403 || status == 404) {
                throw new ConfigurationException("Gmail refused watch on " + notificationTarget + ": " + e.getMessage(), e);
            }
            throw translate("users.watch", e);
        } catch (IOException e) {
            throw translate("users.watch", e);
        }
    }

    @Override
    public void stopWatch(String mailboxId) {
        try {
            client().users().stop(userId()).execute();
            log.info("Gmail watch stopped for {}", mailboxId);
        } catch (IOException e) {
            throw translate("users.stop", e);
        }
    }

    @Override
    public HistoryPage listHistorySince(String mailboxId, long cursor, String pageToken, List<String> labelFilter) {
        try {
            Gmail.Users.History.List request = client().users().history().list(userId())
                    .setStartHistoryId(BigInteger.valueOf(cursor))
                    .setHistoryTypes(List.of(HISTORY_MESSAGE_ADDED))
                    .setPageToken(pageToken);
            // history.list accepts a single label; the full set is checked per message below
            if (!labelFilter.isEmpty()) {
                request.setLabelId(labelFilter.get(0));
            }
            ListHistoryResponse response = request.execute();

            List<String> added = new ArrayList<>();
            if (response.getHistory() != null) {
                for (History history : response.getHistory()) {
                    if (history.getMessagesAdded() == null) {
                        continue;
                    }
                    for (HistoryMessageAdded event : history.getMessagesAdded()) {
                        Message message = event.getMessage();
                        if (message != null && message.getId() != null && hasAllLabels(message, labelFilter)) {
                            added.add(message.getId());
                        }
                    }
                }
            }
            return new HistoryPage(added, toCursor(response.getHistoryId()), response.getNextPageToken());
        } catch (GoogleJsonResponseException e) {
            if (e.getStatusCode() == 404) {
                throw new StaleCursorException(cursor, e);
            }
            throw translate("users.history.list", e);
        } catch (IOException e) {
            throw translate("users.history.list", e);
        }
    }

    @Override
    public MessageDetail getMessage(String mailboxId, String messageId) {
        Message message = fetchFull(messageId);
        if (fetched.size() >= FETCHED_CACHE_LIMIT) {
            fetched.clear();
        }
        fetched.put(cacheKey(mailboxId, messageId), message);
        MessagePart payload = message.getPayload();

        Map<String, String> headers = new LinkedHashMap<>();
        if (payload != null && payload.getHeaders() != null) {
            for (MessagePartHeader header : payload.getHeaders()) {
                if (header.getName() != null && header.getValue() != null) {
                    // First occurrence wins, as with Received-style repeated headers
                    headers.putIfAbsent(header.getName(), header.getValue());
                }
            }
        }
        return new MessageDetail(message.getId(), message.getThreadId(), headers,
                findPlainText(payload), message.getInternalDate());
    }

    @Override
    public List<AttachmentMeta> listAttachments(String mailboxId, String messageId) {
        Message message = fetched.remove(cacheKey(mailboxId, messageId));
        if (message == null) {
            message = fetchFull(messageId);
        }
        List<AttachmentMeta> attachments = new ArrayList<>();
        collectAttachments(message.getPayload(), attachments);
        return attachments;
    }

    @Override
    public List<String> listRecentMessageIds(String mailboxId, int limit, List<String> labelFilter) {
        try {
            Gmail.Users.Messages.List request = client().users().messages().list(userId())
                    .setMaxResults((long) limit);
            if (!labelFilter.isEmpty()) {
                request.setLabelIds(labelFilter);
            }
            ListMessagesResponse response = request.execute();
            List<String> ids = new ArrayList<>();
            if (response.getMessages() != null) {
                for (Message message : response.getMessages()) {
                    ids.add(message.getId());
                }
            }
            return ids;
        } catch (IOException e) {
            throw translate("users.messages.list", e);
        }
    }

    @Override
    public long currentCursor(String mailboxId) {
        try {
            return toCursor(client().users().getProfile(userId()).execute().getHistoryId());
        } catch (IOException e) {
            throw translate("users.getProfile", e);
        }
    }

    private Message fetchFull(String messageId) {
        try {
            return client().users().messages().get(userId(), messageId)
                    .setFormat("full")
                    .execute();
        } catch (GoogleJsonResponseException e) {
            if (e.getStatusCode() == 404) {
                throw new MessageNotFoundException(messageId, e);
            }
            throw translate("users.messages.get", e);
        } catch (IOException e) {
            throw translate("users.messages.get", e);
        }
    }

    private static String findPlainText(MessagePart part) {
        if (part == null) {
            return "";
        }
        boolean attachment = part.getFilename() != null && !part.getFilename().isEmpty();
        if (!attachment && "text/plain".equalsIgnoreCase(part.getMimeType())
                && part.getBody() != null && part.getBody().getData() != null) {
            return new String(part.getBody().decodeData(), StandardCharsets.UTF_8);
        }
        if (part.getParts() != null) {
            for (MessagePart child : part.getParts()) {
                String text = findPlainText(child);
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return "";
    }

    /**
     * Part ids are stable across fetches; Gmail attachment ids are not.
     */
    private static void collectAttachments(MessagePart part, List<AttachmentMeta> out) {
        if (part == null) {
            return;
        }
        if (part.getFilename() != null && !part.getFilename().isEmpty()) {
            Integer size = part.getBody() != null ? part.getBody().getSize() : null;
            out.add(new AttachmentMeta(part.getPartId(), part.getFilename(), part.getMimeType(),
                    size != null ? size : 0L));
        }
        if (part.getParts() != null) {
            for (MessagePart child : part.getParts()) {
                collectAttachments(child, out);
            }
        }
    }

    private static boolean hasAllLabels(Message message, List<String> labelFilter) {
        if (labelFilter.isEmpty()) {
            return true;
        }
        if (message.getLabelIds() == null) {
            // history.list already applied the first label
            return labelFilter.size() == 1;
        }
        return message.getLabelIds().containsAll(labelFilter);
    }

    private static String cacheKey(String mailboxId, String messageId) {
        return mailboxId + "/" + messageId;
    }

    private static long toCursor(BigInteger historyId) {
        if (historyId == null) {
            throw new ProviderException("Gmail response carried no historyId");
        }
        return historyId.longValueExact();
    }

    static ProviderException translate(String operation, IOException e) {
        if (e instanceof SocketTimeoutException) {
            return new TransientProviderException(operation + " timed out", e);
        }
        if (e instanceof HttpResponseException http) {
            int status = http.getStatusCode();
            if (status == 429 || status >= 500) {
                return new TransientProviderException(operation + " returned " + status, e);
            }
            if (status == 403 && String.valueOf(http.getContent()).contains("rateLimitExceeded")) {
                return new TransientProviderException(operation + " rate limited", e);
            }
            return new ProviderException(operation + " returned " + status + ": " + http.getStatusMessage(), e);
        }
        // Connection resets and similar I/O failures
        return new TransientProviderException(operation + " failed: " + e.getMessage(), e);
    }

    private String userId() {
        return properties.getGmail().getUserId();
    }

    private Gmail client() {
        Gmail current = gmail;
        if (current == null) {
            synchronized (this) {
                current = gmail;
                if (current == null) {
                    current = buildClient();
                    gmail = current;
                }
            }
        }
        return current;
    }

    private Gmail buildClient() {
        SyncProperties.Gmail config = properties.getGmail();
        if (isBlank(config.getClientId()) || isBlank(config.getClientSecret()) || isBlank(config.getRefreshToken())) {
            throw new ConfigurationException(
                    "Gmail credentials are not configured (mailsync.gmail.client-id / client-secret / refresh-token)");
        }

        UserCredentials credentials = UserCredentials.newBuilder()
                .setClientId(config.getClientId())
                .setClientSecret(config.getClientSecret())
                .setRefreshToken(config.getRefreshToken())
                .build();
        HttpCredentialsAdapter adapter = new HttpCredentialsAdapter(credentials);
        int timeoutMs = (int) properties.getProvider().getTimeoutMs();
        HttpRequestInitializer initializer = request -> {
            adapter.initialize(request);
            request.setConnectTimeout(timeoutMs);
            request.setReadTimeout(timeoutMs);
        };

        try {
            Gmail client = new Gmail.Builder(GoogleNetHttpTransport.newTrustedTransport(),
                    GsonFactory.getDefaultInstance(), initializer)
                    .setApplicationName(config.getApplicationName())
                    .build();
            log.info("Gmail API client initialized (user: {})", config.getUserId());
            return client;
        } catch (GeneralSecurityException | IOException e) {
            throw new ConfigurationException("Failed to initialize Gmail HTTP transport", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
