package com.mailsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * MailSync configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "mailsync")
public class SyncProperties {

    private Provider provider = new Provider();
    private Retry retry = new Retry();
    private Sync sync = new Sync();
    private Worker worker = new Worker();
    private Queue queue = new Queue();
    private Gmail gmail = new Gmail();

    @Data
    public static class Provider {
        private long timeoutMs = 30000L;      // Per provider call
    }

    @Data
    public static class Retry {
        private int maxAttempts = 4;          // Retries after the first attempt
        private long initialDelayMs = 500L;
        private long maxDelayMs = 8000L;
    }

    @Data
    public static class Sync {
        private int resyncLimit = 50;         // Messages fetched on stale-cursor fallback
        private int maxHistoryPages = 200;
    }

    @Data
    public static class Worker {
        private String concurrency = "1-4";
    }

    @Data
    public static class Queue {
        private String syncDestination = "mailsync.sync.queue";
    }

    @Data
    public static class Gmail {
        private String applicationName = "MailSync";
        private String userId = "me";
        private String clientId;
        private String clientSecret;
        private String refreshToken;
    }
}
