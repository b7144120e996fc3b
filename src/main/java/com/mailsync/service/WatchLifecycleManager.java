package com.mailsync.service;

import com.mailsync.domain.SyncState;
import com.mailsync.exception.ConfigurationException;
import com.mailsync.provider.ProviderCallPolicy;
import com.mailsync.provider.ProviderClient;
import com.mailsync.provider.WatchRegistration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Provider watch lifecycle
 * - start registers or renews the watch; repeating it only refreshes expiration/cursor
 * - stop cancels the watch and keeps the last cursor
 * - Renewal is driven by an external scheduler reading status()
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WatchLifecycleManager {

    private final ProviderClient providerClient;
    private final ProviderCallPolicy callPolicy;
    private final SyncStateStore stateStore;

    /**
     * Register or renew the watch
     *
     * @param labelFilter comma separated label ids, null or blank for the whole mailbox
     * @throws ConfigurationException registration refused; no state written
     */
    public WatchRegistration start(String mailboxId, String notificationTarget, String labelFilter) {
        if (mailboxId == null || mailboxId.isBlank()) {
            throw new ConfigurationException("mailboxId is required");
        }
        if (notificationTarget == null || notificationTarget.isBlank()) {
            throw new ConfigurationException("notificationTarget is required");
        }
        List<String> labels = DeltaFetcher.parseLabels(labelFilter);
        String normalizedFilter = labels.isEmpty() ? null : String.join(",", labels);

        WatchRegistration registration = callPolicy.call("startWatch " + mailboxId,
                () -> providerClient.startWatch(mailboxId, notificationTarget, labels));

        SyncState state = stateStore.activate(mailboxId, registration.cursor(), registration.expiration(),
                notificationTarget, normalizedFilter);
        log.info("Watch started for {} -> {} (labels: {}, expiration: {})",
                mailboxId, notificationTarget, labels, registration.expiration());
        return new WatchRegistration(state.getCursor(), registration.expiration());
    }

    /**
     * Cancel the watch. Notifications received afterwards are ignored.
     */
    public boolean stop(String mailboxId) {
        // Local state first: even if the provider call fails, later notifications are ignored
        if (!stateStore.markStopped(mailboxId)) {
            log.info("Stopping watch for {} with no stored state", mailboxId);
        }
        callPolicy.run("stopWatch " + mailboxId, () -> providerClient.stopWatch(mailboxId));
        log.info("Watch stopped for {}", mailboxId);
        return true;
    }

    /**
     * Stored status; empty means the mailbox was never watched
     */
    public Optional<WatchStatus> status(String mailboxId) {
        return stateStore.get(mailboxId).map(WatchStatus::of);
    }

    public List<WatchStatus> listWatches() {
        return stateStore.findAll().stream().map(WatchStatus::of).toList();
    }
}
