package com.mailsync;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * MailSync push-driven mailbox synchronization
 *
 * Keeps a local message store consistent with a remote mailbox
 * - Provider watch registration and renewal (caller driven)
 * - Push notification webhook with single-flight sync per mailbox
 * - History-based delta fetch with stale-cursor resync
 * - MyBatis + SQLite persistence
 * - ActiveMQ sync job queue
 */
@SpringBootApplication
@MapperScan("com.mailsync.mapper")
@EnableConfigurationProperties
public class MailSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailSyncApplication.class, args);
    }
}
