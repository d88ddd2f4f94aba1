package com.chaincustody.settlement;

import com.chaincustody.chain.AddressValidator;
import com.chaincustody.chain.ChainRegistry;
import com.chaincustody.config.AsyncConfig;
import com.chaincustody.config.SettlementProperties;
import com.chaincustody.domain.ChainDescriptor;
import com.chaincustody.domain.DepositNotice;
import com.chaincustody.domain.PersistedTransaction;
import com.chaincustody.domain.SettlementErrorCode;
import com.chaincustody.domain.SettlementException;
import com.chaincustody.domain.TokenSettings;
import com.chaincustody.domain.TokenSettingsRepository;
import com.chaincustody.domain.TransactionStatus;
import com.chaincustody.domain.TransactionType;
import com.chaincustody.domain.WatchedAddress;
import com.chaincustody.domain.WatchedAddressRepository;
import com.chaincustody.domain.WithdrawalNotice;
import com.chaincustody.domain.WithdrawalOutcome;
import com.chaincustody.domain.WithdrawalRequest;
import com.chaincustody.event.EventBroadcaster;
import com.chaincustody.event.EventTopics;
import com.chaincustody.ledger.LedgerGateway;
import com.mongodb.MongoException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Settles withdrawals in per-wallet lanes: items of one wallet run strictly one after another, different wallets
 * in parallel on the settlement executor.
 * <p>
 * Per item: validate chain, address, amount and precision; compute the fee; debit the ledger and create the PENDING
 * record in one transaction; then dispatch for broadcast. Domain errors complete the future with a REJECTED
 * outcome. A failed dispatch keeps the debit and the PENDING record ({@code metadata.dispatchError}) for
 * {@link #redispatch(String)}.
 * <p>
 * A destination that is the deposit address of another internal wallet settles as a ledger transfer: no fee,
 * no broadcast, both records CONFIRMED at once.
 */
@Service
@Slf4j
public class WithdrawalQueue {

    static final String DISPATCH_ERROR = "dispatchError";
    static final String INTERNAL_TRANSFER = "internalTransfer";
    private static final String TRANSIENT_TRANSACTION_ERROR = "TransientTransactionError";

    private final ChainRegistry chainRegistry;
    private final AddressValidator addressValidator;
    private final TokenSettingsRepository tokenSettingsRepository;
    private final WatchedAddressRepository watchedAddressRepository;
    private final FeeCalculator feeCalculator;
    private final LedgerGateway ledgerGateway;
    private final List<WithdrawalDispatcher> dispatchers;
    private final EventBroadcaster eventBroadcaster;
    private final SettlementProperties settlementProperties;
    private final Executor executor;

    private final Map<String, CompletableFuture<WithdrawalOutcome>> lanes = new ConcurrentHashMap<>();

    public WithdrawalQueue(ChainRegistry chainRegistry,
                           AddressValidator addressValidator,
                           TokenSettingsRepository tokenSettingsRepository,
                           WatchedAddressRepository watchedAddressRepository,
                           FeeCalculator feeCalculator,
                           LedgerGateway ledgerGateway,
                           List<WithdrawalDispatcher> dispatchers,
                           EventBroadcaster eventBroadcaster,
                           SettlementProperties settlementProperties,
                           @Qualifier(AsyncConfig.SETTLEMENT_EXECUTOR) Executor executor) {
        this.chainRegistry = chainRegistry;
        this.addressValidator = addressValidator;
        this.tokenSettingsRepository = tokenSettingsRepository;
        this.watchedAddressRepository = watchedAddressRepository;
        this.feeCalculator = feeCalculator;
        this.ledgerGateway = ledgerGateway;
        this.dispatchers = dispatchers;
        this.eventBroadcaster = eventBroadcaster;
        this.settlementProperties = settlementProperties;
        this.executor = executor;
    }

    public CompletableFuture<WithdrawalOutcome> submit(WithdrawalRequest request) {
        return enqueue(request.walletId(), () -> settle(request));
    }

    /** Dispatches a PENDING withdrawal again without debiting. Rejected once the withdrawal has a broadcast hash. */
    public CompletableFuture<WithdrawalOutcome> redispatch(String transactionId) {
        return onPendingWithdrawal(transactionId, tx -> {
            if (tx.getBroadcastHash() != null) {
                return alreadyBroadcast(tx);
            }
            return WithdrawalOutcome.settled(dispatch(tx));
        });
    }

    /** Stores the signer's signed payload and dispatches it. */
    public CompletableFuture<WithdrawalOutcome> attachSignedTransaction(String transactionId, String signedTransaction) {
        return onPendingWithdrawal(transactionId, tx -> {
            if (tx.getBroadcastHash() != null) {
                return alreadyBroadcast(tx);
            }
            tx.putMetadata(NodeRawTransactionDispatcher.SIGNED_TRANSACTION, signedTransaction);
            return WithdrawalOutcome.settled(dispatch(ledgerGateway.updateTransaction(tx)));
        });
    }

    /**
     * Records the on-chain hash of a withdrawal the signer broadcast itself. Reporting the recorded hash again is
     * a no-op; a different hash is rejected.
     */
    public CompletableFuture<WithdrawalOutcome> recordBroadcast(String transactionId, String broadcastHash) {
        return onPendingWithdrawal(transactionId, tx -> {
            if (tx.getBroadcastHash() == null) {
                return WithdrawalOutcome.settled(markBroadcast(tx, broadcastHash));
            }
            if (tx.getBroadcastHash().equals(broadcastHash)) {
                return WithdrawalOutcome.settled(tx);
            }
            return alreadyBroadcast(tx);
        });
    }

    private static WithdrawalOutcome alreadyBroadcast(PersistedTransaction tx) {
        return WithdrawalOutcome.rejected(SettlementErrorCode.ALREADY_BROADCAST,
                "Withdrawal " + tx.getId() + " already broadcast as " + tx.getBroadcastHash());
    }

    // the lookup runs on the settlement executor, never on the caller's thread
    private CompletableFuture<WithdrawalOutcome> onPendingWithdrawal(
            String transactionId, Function<PersistedTransaction, WithdrawalOutcome> action) {
        return CompletableFuture.supplyAsync(() -> ledgerGateway.findTransactionById(transactionId)
                        .filter(WithdrawalQueue::isPendingWithdrawal), executor)
                .thenCompose(found -> found
                        .map(tx -> enqueue(tx.getWalletId(), () -> {
                            // re-read inside the lane; a previous item may have changed it
                            PersistedTransaction current = ledgerGateway.findTransactionById(transactionId).orElse(tx);
                            if (!isPendingWithdrawal(current)) {
                                return WithdrawalOutcome.rejected(SettlementErrorCode.TRANSACTION_NOT_FOUND,
                                        "Withdrawal " + transactionId + " is " + current.getStatus());
                            }
                            return action.apply(current);
                        }))
                        .orElseGet(() -> CompletableFuture.completedFuture(WithdrawalOutcome.rejected(
                                SettlementErrorCode.TRANSACTION_NOT_FOUND, "No pending withdrawal " + transactionId))));
    }

    private static boolean isPendingWithdrawal(PersistedTransaction tx) {
        return tx.getType() == TransactionType.WITHDRAW && tx.getStatus() == TransactionStatus.PENDING;
    }

    private CompletableFuture<WithdrawalOutcome> enqueue(String walletId, Supplier<WithdrawalOutcome> work) {
        CompletableFuture<WithdrawalOutcome> next = lanes.compute(walletId, (k, tail) -> {
            CompletableFuture<?> previous = tail != null ? tail : CompletableFuture.completedFuture(null);
            return previous.handle((r, e) -> null).thenApplyAsync(v -> work.get(), executor);
        });
        next.whenComplete((r, e) -> lanes.remove(walletId, next));
        return next;
    }

    WithdrawalOutcome settle(WithdrawalRequest request) {
        try {
            ChainDescriptor chain = validate(request);
            TokenSettings token = tokenSettingsRepository.findByChainAndCurrency(chain.id(), request.currency())
                    .orElseThrow(() -> new SettlementException(SettlementErrorCode.TOKEN_NOT_FOUND,
                            "Token " + request.currency() + " not configured on " + chain.id()));
            int precision = token.effectivePrecision();
            if (AmountPrecision.decimalPlaces(request.amount()) > precision) {
                throw new SettlementException(SettlementErrorCode.PRECISION_EXCEEDED,
                        "Amount has more than " + precision + " decimal places");
            }
            Optional<WatchedAddress> internal =
                    watchedAddressRepository.findByChainAndAddress(chain.id(), request.toAddress());
            if (internal.isPresent()) {
                return WithdrawalOutcome.settled(transferInternal(request, internal.get()));
            }
            FeeBreakdown fee = feeCalculator.computeFee(request.amount(), chain, token, request.toAddress());
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("networkFee", fee.networkFee().toPlainString());
            metadata.put("activationFee", fee.activationFee().toPlainString());
            metadata.put("serviceFee", fee.serviceFee().toPlainString());

            WithdrawalRequest priced = request.withFee(fee.total());
            PersistedTransaction record = withLockRetry(request.walletId(),
                    () -> ledgerGateway.debitAndRecord(priced, metadata));
            eventBroadcaster.publish(EventTopics.WITHDRAWAL_PENDING, WithdrawalNotice.of(record));
            return WithdrawalOutcome.settled(dispatch(record));
        } catch (SettlementException e) {
            log.info("Withdrawal for wallet {} rejected: {} {}", request.walletId(), e.getErrorCode(), e.getMessage());
            return WithdrawalOutcome.rejected(e.getErrorCode(), e.getMessage());
        }
    }

    private ChainDescriptor validate(WithdrawalRequest request) {
        if (request.amount() == null || request.amount().compareTo(BigDecimal.ZERO) <= 0) {
            throw new SettlementException(SettlementErrorCode.INVALID_AMOUNT, "Amount must be positive");
        }
        ChainDescriptor chain = chainRegistry.find(request.chain())
                .orElseThrow(() -> new SettlementException(SettlementErrorCode.UNSUPPORTED_CHAIN,
                        "Unsupported chain: " + request.chain()));
        if (!addressValidator.isValidAddress(chain, request.toAddress())) {
            throw new SettlementException(SettlementErrorCode.INVALID_ADDRESS,
                    "Invalid " + chain.id() + " address: " + request.toAddress());
        }
        return chain;
    }

    private PersistedTransaction transferInternal(WithdrawalRequest request, WatchedAddress recipient) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(INTERNAL_TRANSFER, true);
        WithdrawalRequest unpriced = request.withFee(BigDecimal.ZERO);
        PersistedTransaction record = withLockRetry(request.walletId(),
                () -> ledgerGateway.transferInternal(unpriced, recipient.getWalletId(), metadata));
        String creditedWalletId = String.valueOf(record.getMetadata().get(LedgerGateway.RECIPIENT_WALLET_ID));
        log.info("Withdrawal {} of {} {} settled internally to wallet {}", record.getId(),
                request.amount().toPlainString(), request.currency(), creditedWalletId);
        eventBroadcaster.publish(EventTopics.WITHDRAWAL_CONFIRMED, WithdrawalNotice.of(record));
        eventBroadcaster.publish(EventTopics.DEPOSIT_CONFIRMED, new DepositNotice(creditedWalletId, record.getChain(),
                record.getTxHash(), record.getToAddress(), record.getAmount(), 0, 0, TransactionStatus.CONFIRMED));
        return record;
    }

    private PersistedTransaction withLockRetry(String walletId, Supplier<PersistedTransaction> ledgerWrite) {
        int attempts = Math.max(1, settlementProperties.getLockRetryAttempts());
        for (int attempt = 1; ; attempt++) {
            try {
                return ledgerWrite.get();
            } catch (DataAccessException | TransactionException e) {
                if (!isLockConflict(e) || attempt >= attempts) {
                    throw e;
                }
                log.warn("Ledger conflict debiting wallet {} (attempt {}/{}): {}", walletId, attempt,
                        attempts, e.getMessage());
            }
        }
    }

    static boolean isLockConflict(Throwable e) {
        if (e instanceof ConcurrencyFailureException) {
            return true;
        }
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof MongoException mongo && mongo.hasErrorLabel(TRANSIENT_TRANSACTION_ERROR)) {
                return true;
            }
        }
        return false;
    }

    // never throws: the debit stands and the record stays PENDING for a later redispatch
    private PersistedTransaction dispatch(PersistedTransaction record) {
        ChainDescriptor chain = chainRegistry.resolve(record.getChain());
        try {
            WithdrawalDispatcher dispatcher = dispatchers.stream()
                    .filter(d -> d.supports(chain, record))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No dispatcher for " + chain.id()));
            return dispatcher.dispatch(chain, record)
                    .map(hash -> markBroadcast(record, hash))
                    .orElse(record);
        } catch (RuntimeException e) {
            log.warn("Dispatch of withdrawal {} on {} failed, left PENDING: {}", record.getId(), chain.id(),
                    e.getMessage());
            record.putMetadata(DISPATCH_ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return ledgerGateway.updateTransaction(record);
        }
    }

    private PersistedTransaction markBroadcast(PersistedTransaction record, String hash) {
        record.setBroadcastHash(hash);
        if (record.getMetadata() != null) {
            record.getMetadata().remove(DISPATCH_ERROR);
        }
        PersistedTransaction saved = ledgerGateway.updateTransaction(record);
        eventBroadcaster.publish(EventTopics.WITHDRAWAL_BROADCAST, WithdrawalNotice.of(saved));
        return saved;
    }
}
