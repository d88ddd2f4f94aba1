package com.chaincustody.deposit.monitor;

import com.chaincustody.common.RetryPolicy;
import com.chaincustody.config.MonitorProperties;
import com.chaincustody.deposit.fetch.TransactionFetcherDispatcher;
import com.chaincustody.domain.ChainDescriptor;
import com.chaincustody.domain.ChainFamily;
import com.chaincustody.domain.DepositNotice;
import com.chaincustody.domain.MonitorStoppedNotice;
import com.chaincustody.domain.ObservedTransaction;
import com.chaincustody.domain.PersistedTransaction;
import com.chaincustody.domain.TransactionDetail;
import com.chaincustody.domain.TransactionDirection;
import com.chaincustody.domain.TransactionStatus;
import com.chaincustody.domain.TransactionType;
import com.chaincustody.domain.WatchedAddress;
import com.chaincustody.event.EventBroadcaster;
import com.chaincustody.event.EventTopics;
import com.chaincustody.ledger.LedgerGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls one watched address on one chain and drives each incoming hash through
 * UNSEEN, PENDING(k), CONFIRMED, STORED.
 * <p>
 * A hash is credited at most once: it is skipped when in the in-memory processed set or when the durable store
 * already holds a record for (hash, wallet). A hash is marked processed only after the ledger accepted it, so a
 * failed write is retried on the next poll.
 * <p>
 * Errors back off exponentially from the poll interval; after the configured number of consecutive failed cycles
 * the monitor stops itself and publishes {@code monitor.stopped}.
 */
@Slf4j
public class DepositMonitor {

    public enum RunState {
        IDLE,
        RUNNING,
        STOPPED,
        FAILED
    }

    private final WatchedAddress watched;
    private final ChainDescriptor chain;
    private final TransactionFetcherDispatcher fetchers;
    private final LedgerGateway ledger;
    private final EventBroadcaster events;
    private final PollScheduler scheduler;
    private final MonitorProperties properties;
    private final RetryPolicy backoff;
    private final MonitorState state = new MonitorState();
    private final AtomicBoolean inFlight = new AtomicBoolean();

    private volatile RunState runState = RunState.IDLE;
    private volatile PollHandle pending;
    private volatile Instant lastPollAt;
    // cycles scheduled before the latest start/restart are ignored
    private volatile long generation;

    public DepositMonitor(WatchedAddress watched, ChainDescriptor chain, TransactionFetcherDispatcher fetchers,
                          LedgerGateway ledger, EventBroadcaster events, PollScheduler scheduler,
                          MonitorProperties properties) {
        this.watched = watched;
        this.chain = chain;
        this.fetchers = fetchers;
        this.ledger = ledger;
        this.events = events;
        this.scheduler = scheduler;
        this.properties = properties;
        this.backoff = new RetryPolicy(properties.getPollIntervalMs(), 0, Math.max(1, properties.getMaxConsecutiveErrors()),
                properties.getMaxBackoffMs());
    }

    public synchronized void start() {
        if (runState == RunState.RUNNING) {
            return;
        }
        runState = RunState.RUNNING;
        generation++;
        log.info("Starting deposit monitor {} (wallet {})", watched.monitorKey(), watched.getWalletId());
        scheduleNext(Duration.ZERO, generation);
    }

    /** Idempotent. A cycle already running completes but schedules nothing further. */
    public synchronized void stop() {
        if (runState != RunState.RUNNING) {
            return;
        }
        runState = RunState.STOPPED;
        cancelPending();
        log.info("Stopped deposit monitor {}", watched.monitorKey());
    }

    /** Resets the error count and resumes polling, also after a fail-stop. */
    public synchronized void restart() {
        cancelPending();
        state.resetErrors();
        runState = RunState.RUNNING;
        generation++;
        log.info("Restarting deposit monitor {}", watched.monitorKey());
        scheduleNext(Duration.ZERO, generation);
    }

    public MonitorStatus status() {
        return new MonitorStatus(watched.getWalletId(), chain.id(), watched.getAddress(), runState,
                state.getConsecutiveErrorCount(), state.getLastError(), state.processedCount(), lastPollAt);
    }

    public RunState getRunState() {
        return runState;
    }

    /**
     * One scheduled cycle: poll, update the error count, then schedule the next cycle or fail-stop.
     */
    void runCycle(long cycleGeneration) {
        if (runState != RunState.RUNNING || cycleGeneration != generation) {
            return;
        }
        if (!inFlight.compareAndSet(false, true)) {
            scheduleNext(Duration.ofMillis(properties.getPollIntervalMs()), cycleGeneration);
            return;
        }
        Duration next;
        try {
            pollOnce();
            state.recordSuccess();
            next = Duration.ofMillis(properties.getPollIntervalMs());
        } catch (Exception e) {
            int errors = state.recordFailure(messageOf(e));
            if (errors >= properties.getMaxConsecutiveErrors()) {
                failStop(e);
                return;
            }
            next = Duration.ofMillis(backoffDelayMs(errors));
            log.warn("Poll of {} failed ({}/{}), retrying in {} ms: {}", watched.monitorKey(), errors,
                    properties.getMaxConsecutiveErrors(), next.toMillis(), messageOf(e));
        } finally {
            inFlight.set(false);
            lastPollAt = Instant.now();
        }
        scheduleNext(next, cycleGeneration);
    }

    /**
     * Fetches the address's transactions once and advances every incoming hash.
     */
    void pollOnce() {
        List<ObservedTransaction> observed = fetchers.fetch(chain.id(), watched.getAddress());
        for (ObservedTransaction tx : observed) {
            if (tx.direction() != TransactionDirection.INCOMING || state.isProcessed(tx.hash())) {
                continue;
            }
            if (ledger.findTransaction(tx.hash(), watched.getWalletId()).isPresent()) {
                state.markProcessed(tx.hash());
                continue;
            }
            if (tx.confirmations() < chain.requiredConfirmations()) {
                if (state.advancePending(tx.hash(), tx.confirmations())) {
                    events.publish(EventTopics.DEPOSIT_PENDING, notice(tx, chain.toStandardUnits(tx.rawAmount()),
                            tx.confirmations(), TransactionStatus.PENDING));
                }
                continue;
            }
            confirm(tx);
        }
    }

    long backoffDelayMs(int consecutiveErrors) {
        return consecutiveErrors <= 0 ? properties.getPollIntervalMs() : backoff.delayMs(consecutiveErrors - 1);
    }

    // a failed credit leaves the hash unprocessed; it is not a failed cycle
    private void confirm(ObservedTransaction tx) {
        try {
            BigDecimal amount = chain.toStandardUnits(creditedAmount(tx));
            PersistedTransaction deposit = new PersistedTransaction();
            deposit.setTxHash(tx.hash());
            deposit.setWalletId(watched.getWalletId());
            deposit.setType(TransactionType.DEPOSIT);
            deposit.setStatus(TransactionStatus.CONFIRMED);
            deposit.setChain(chain.id());
            deposit.setCurrency(chain.currency());
            deposit.setAmount(amount);
            deposit.setFee(BigDecimal.ZERO);
            deposit.setToAddress(watched.getAddress());
            deposit.putMetadata("confirmations", tx.confirmations());
            if (tx.blockTime() != null) {
                deposit.putMetadata("blockTime", tx.blockTime().toString());
            }
            if (ledger.creditDeposit(deposit)) {
                log.info("Credited deposit {} of {} {} to wallet {}", tx.hash(), amount.toPlainString(),
                        chain.currency(), watched.getWalletId());
                events.publish(EventTopics.DEPOSIT_CONFIRMED, notice(tx, amount, tx.confirmations(),
                        TransactionStatus.CONFIRMED));
            }
            state.markProcessed(tx.hash());
        } catch (DuplicateKeyException e) {
            log.debug("Deposit {} already recorded for wallet {}", tx.hash(), watched.getWalletId());
            state.markProcessed(tx.hash());
        } catch (RuntimeException e) {
            log.warn("Could not store confirmed deposit {} on {}, will retry: {}", tx.hash(), chain.id(), messageOf(e));
        }
    }

    private BigInteger creditedAmount(ObservedTransaction tx) {
        if (chain.family() != ChainFamily.UTXO) {
            return tx.rawAmount();
        }
        Optional<TransactionDetail> detail = fetchers.fetchDetail(chain.id(), tx.hash());
        return detail.map(d -> d.amountPaidTo(watched.getAddress())).orElse(tx.rawAmount());
    }

    private DepositNotice notice(ObservedTransaction tx, BigDecimal amount, int confirmations, TransactionStatus status) {
        return new DepositNotice(watched.getWalletId(), chain.id(), tx.hash(), watched.getAddress(), amount,
                confirmations, chain.requiredConfirmations(), status);
    }

    private synchronized void failStop(Exception cause) {
        runState = RunState.FAILED;
        cancelPending();
        log.error("Deposit monitor {} stopped after {} consecutive errors: {}", watched.monitorKey(),
                state.getConsecutiveErrorCount(), messageOf(cause));
        events.publish(EventTopics.MONITOR_STOPPED, new MonitorStoppedNotice(watched.getWalletId(), chain.id(),
                watched.getAddress(), state.getConsecutiveErrorCount(), state.getLastError()));
    }

    private synchronized void scheduleNext(Duration delay, long cycleGeneration) {
        if (runState != RunState.RUNNING || cycleGeneration != generation) {
            return;
        }
        pending = scheduler.schedule(() -> runCycle(cycleGeneration), delay);
    }

    private void cancelPending() {
        PollHandle handle = pending;
        pending = null;
        if (handle != null) {
            handle.cancel();
        }
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
