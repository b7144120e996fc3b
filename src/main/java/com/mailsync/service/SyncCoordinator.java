package com.mailsync.service;

import com.mailsync.domain.SyncState;
import com.mailsync.exception.PartialIngestionException;
import com.mailsync.exception.SyncFailureException;
import com.mailsync.queue.SyncJobProducer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sync cycle orchestration
 * - At most one cycle per mailbox (single flight)
 * - Notifications arriving mid-cycle are coalesced into one follow-up cycle
 * - Cursor committed only when the whole batch is ingested
 */
@Slf4j
@Service
public class SyncCoordinator {

    public enum Admission {
        QUEUED,
        COALESCED
    }

    private final SyncStateStore stateStore;
    private final DeltaFetcher deltaFetcher;
    private final MessageIngester ingester;
    private final SyncJobProducer jobProducer;

    private final Counter cycleCounter;
    private final Counter failureCounter;
    private final Counter coalescedCounter;

    /** Mailboxes with a queued or running cycle, and the highest cursor notified meanwhile */
    private final ConcurrentMap<String, Flight> flights = new ConcurrentHashMap<>();

    public SyncCoordinator(SyncStateStore stateStore,
            DeltaFetcher deltaFetcher,
            MessageIngester ingester,
            SyncJobProducer jobProducer,
            MeterRegistry meterRegistry) {
        this.stateStore = stateStore;
        this.deltaFetcher = deltaFetcher;
        this.ingester = ingester;
        this.jobProducer = jobProducer;
        this.cycleCounter = Counter.builder("mailsync.sync.cycles")
                .description("Completed sync cycles")
                .register(meterRegistry);
        this.failureCounter = Counter.builder("mailsync.sync.failures")
                .description("Sync cycles that ended without committing")
                .register(meterRegistry);
        this.coalescedCounter = Counter.builder("mailsync.notifications.coalesced")
                .description("Notifications folded into an in-flight cycle")
                .register(meterRegistry);
    }

    /**
     * Queue a cycle for the mailbox unless one is already queued or running
     */
    public Admission submit(String mailboxId, long cursor) {
        AtomicBoolean acquired = new AtomicBoolean(false);
        flights.compute(mailboxId, (id, flight) -> {
            if (flight == null) {
                acquired.set(true);
                return new Flight();
            }
            flight.offer(cursor);
            return flight;
        });

        if (!acquired.get()) {
            coalescedCounter.increment();
            log.debug("Cycle for {} in flight, cursor {} coalesced", mailboxId, cursor);
            return Admission.COALESCED;
        }

        try {
            jobProducer.enqueueSync(mailboxId, cursor);
        } catch (RuntimeException e) {
            flights.remove(mailboxId);
            throw e;
        }
        return Admission.QUEUED;
    }

    public boolean isInFlight(String mailboxId) {
        return flights.containsKey(mailboxId);
    }

    /**
     * Run a queued cycle and release the mailbox afterwards. Called on a worker thread.
     */
    public SyncOutcome execute(String mailboxId, long cursor) {
        try {
            SyncOutcome outcome = runCycle(mailboxId, cursor);
            cycleCounter.increment();
            return outcome;
        } catch (RuntimeException e) {
            failureCounter.increment();
            throw e;
        } finally {
            release(mailboxId);
        }
    }

    /**
     * Give up a queued job that cannot run. The mailbox is released as if the cycle had ended.
     */
    public void discard(String mailboxId) {
        log.warn("Queued sync job for {} discarded", mailboxId);
        release(mailboxId);
    }

    /**
     * One sync cycle: delta fetch, ingest, commit
     *
     * @throws SyncFailureException      provider kept failing; cursor untouched
     * @throws PartialIngestionException some ids failed; cursor held at its pre-batch value
     */
    public SyncOutcome runCycle(String mailboxId, long cursor) {
        Optional<SyncState> state = stateStore.get(mailboxId);
        if (state.isEmpty() || !state.get().isActive()) {
            log.info("Mailbox {} is not watched, sync for cursor {} discarded", mailboxId, cursor);
            return SyncOutcome.idle(mailboxId, state.map(SyncState::getCursor).orElse(null));
        }

        DeltaResult delta = deltaFetcher.sync(mailboxId, cursor);
        if (delta.messageIds().isEmpty() && delta.fromCursor() != null
                && delta.newCursor() <= delta.fromCursor()) {
            return SyncOutcome.idle(mailboxId, delta.fromCursor());
        }

        IngestResult ingest = ingester.ingest(mailboxId, delta.messageIds());
        if (!ingest.isComplete()) {
            log.warn("Sync for {} incomplete: {} of {} message(s) failed, cursor held at {}",
                    mailboxId, ingest.failed().size(), delta.messageIds().size(), delta.fromCursor());
            throw new PartialIngestionException(mailboxId, ingest.failed(), delta.fromCursor());
        }

        boolean advanced = stateStore.advanceCursor(mailboxId, delta.newCursor());
        Long committed = stateStore.get(mailboxId).map(SyncState::getCursor).orElse(null);
        log.info("Sync for {} committed: {} message(s), {} skipped, cursor {} -> {}{}",
                mailboxId, ingest.persisted().size(), ingest.skipped().size(),
                delta.fromCursor(), committed, delta.fullResync() ? " (full resync)" : "");
        return new SyncOutcome(mailboxId, ingest.persisted(), ingest.skipped(), committed, advanced,
                delta.fullResync());
    }

    /**
     * Free the mailbox, or hand the slot to a follow-up cycle when newer notifications arrived
     */
    void release(String mailboxId) {
        AtomicReference<Long> pending = new AtomicReference<>();
        flights.computeIfPresent(mailboxId, (id, flight) -> {
            if (flight.pendingCursor == null) {
                return null;
            }
            pending.set(flight.pendingCursor);
            flight.pendingCursor = null;
            return flight;
        });

        Long followUp = pending.get();
        if (followUp == null) {
            return;
        }

        SyncState state = stateStore.get(mailboxId).orElse(null);
        boolean behind = state != null && state.isActive()
                && (state.getCursor() == null || followUp > state.getCursor());
        if (!behind) {
            log.debug("Coalesced cursor {} for {} already covered", followUp, mailboxId);
            release(mailboxId);
            return;
        }

        try {
            jobProducer.enqueueSync(mailboxId, followUp);
            log.debug("Follow-up cycle for {} queued at cursor {}", mailboxId, followUp);
        } catch (RuntimeException e) {
            log.error("Failed to queue follow-up cycle for {}", mailboxId, e);
            flights.remove(mailboxId);
        }
    }

    private static final class Flight {

        private Long pendingCursor;

        void offer(long cursor) {
            pendingCursor = pendingCursor == null ? cursor : Math.max(pendingCursor, cursor);
        }
    }
}
