package com.mailsync.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Store totals for monitoring
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageStats {

    private long totalMessages;
    private long totalThreads;         // Distinct non-empty thread ids
    private long totalReplies;
}
