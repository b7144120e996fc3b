package com.mailsync.util;

import com.mailsync.domain.AttachmentRef;
import com.mailsync.domain.MailMessage;
import com.mailsync.provider.AttachmentMeta;
import com.mailsync.provider.MessageDetail;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MailDateFormat;
import lombok.extern.slf4j.Slf4j;

import java.text.ParseException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts provider message details into stored messages, using Jakarta Mail for addresses and dates
 */
@Slf4j
public final class MessageParser {

    private static final Pattern REPLY_SUBJECT = Pattern.compile(
            "^\\s*(re|aw|sv|antw|r)\\s*(\\[\\d+])?\\s*:", Pattern.CASE_INSENSITIVE);

    private static final List<String> RECIPIENT_HEADERS = List.of("To", "Cc");

    private MessageParser() {}

    /**
     * Build the stored form of a message and its attachment references
     */
    public static MailMessage toMailMessage(String mailboxId, MessageDetail detail, List<AttachmentMeta> attachments) {
        List<AttachmentRef> refs = new ArrayList<>();
        Set<String> seenAttachmentIds = new LinkedHashSet<>();
        for (AttachmentMeta meta : attachments) {
            if (meta.attachmentId() == null || !seenAttachmentIds.add(meta.attachmentId())) {
                continue;
            }
            refs.add(AttachmentRef.builder()
                    .messageId(detail.id())
                    .attachmentId(meta.attachmentId())
                    .filename(meta.filename() != null ? meta.filename() : "")
                    .mimeType(meta.mimeType())
                    .sizeBytes(Math.max(0L, meta.sizeBytes()))
                    .build());
        }

        return MailMessage.builder()
                .id(detail.id())
                .mailboxId(mailboxId)
                .threadId(detail.threadId())
                .sender(extractSender(detail))
                .recipients(extractRecipients(detail))
                .subject(extractSubject(detail))
                .body(detail.body())
                .receivedAt(extractReceivedAt(detail))
                .reply(isReply(detail))
                .attachmentRefs(refs)
                .build();
    }

    /**
     * Reply when threading headers are present or the subject carries a reply prefix
     */
    public static boolean isReply(MessageDetail detail) {
        if (hasText(detail.header("In-Reply-To")) || hasText(detail.header("References"))) {
            return true;
        }
        String subject = detail.header("Subject");
        return subject != null && REPLY_SUBJECT.matcher(subject).find();
    }

    public static String extractSender(MessageDetail detail) {
        String from = detail.header("From");
        return hasText(from) ? from.trim() : "unknown@unknown";
    }

    public static String extractSubject(MessageDetail detail) {
        String subject = detail.header("Subject");
        return subject != null ? subject : "(No Subject)";
    }

    /**
     * To then Cc, in header order, without repeats
     */
    public static List<String> extractRecipients(MessageDetail detail) {
        Set<String> recipients = new LinkedHashSet<>();
        for (String name : RECIPIENT_HEADERS) {
            String value = detail.header(name);
            if (!hasText(value)) {
                continue;
            }
            try {
                for (InternetAddress address : InternetAddress.parseHeader(value, false)) {
                    recipients.add(address.toUnicodeString());
                }
            } catch (AddressException e) {
                log.debug("Unparseable {} header on {}: {}", name, detail.id(), e.getMessage());
                for (String raw : value.split(",")) {
                    if (hasText(raw)) {
                        recipients.add(raw.trim());
                    }
                }
            }
        }
        return new ArrayList<>(recipients);
    }

    /**
     * Provider receive time, else the Date header, else now
     */
    public static String extractReceivedAt(MessageDetail detail) {
        if (detail.internalDate() != null) {
            return Instant.ofEpochMilli(detail.internalDate()).toString();
        }
        String date = detail.header("Date");
        if (hasText(date)) {
            try {
                Date parsed = new MailDateFormat().parse(date.trim());
                if (parsed != null) {
                    return parsed.toInstant().toString();
                }
            } catch (ParseException e) {
                log.debug("Unparseable Date header on {}: {}", detail.id(), date);
            }
        }
        return Instant.now().toString();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
