package com.chaincustody.ledger;

import com.chaincustody.domain.LedgerWallet;
import com.chaincustody.domain.LedgerWalletRepository;
import com.chaincustody.domain.PersistedTransaction;
import com.chaincustody.domain.PersistedTransactionRepository;
import com.chaincustody.domain.SettlementErrorCode;
import com.chaincustody.domain.SettlementException;
import com.chaincustody.domain.TransactionStatus;
import com.chaincustody.domain.TransactionType;
import com.chaincustody.domain.WithdrawalRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger on MongoDB. Each mutation runs in a multi-document transaction; the wallet's version field makes a
 * concurrent read-check-write fail instead of overdrawing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MongoLedgerGateway implements LedgerGateway {

    static final String WITHDRAWAL_REFERENCE_PREFIX = "wd-";
    static final String INTERNAL_REFERENCE_PREFIX = "it-";

    private final LedgerWalletRepository walletRepository;
    private final PersistedTransactionRepository transactionRepository;

    @Override
    public Optional<PersistedTransaction> findTransaction(String txHash, String walletId) {
        return transactionRepository.findByTxHashAndWalletId(txHash, walletId);
    }

    @Override
    public Optional<PersistedTransaction> findTransactionById(String transactionId) {
        return transactionRepository.findById(transactionId);
    }

    @Override
    @Transactional
    public PersistedTransaction debitAndRecord(WithdrawalRequest request, Map<String, Object> metadata) {
        Instant now = Instant.now();
        BigDecimal total = debit(request, now);
        PersistedTransaction saved = transactionRepository.insert(
                withdrawalRecord(request, WITHDRAWAL_REFERENCE_PREFIX, TransactionStatus.PENDING, metadata, now));
        log.info("Debited {} {} from wallet {} for withdrawal {}", total.toPlainString(), request.currency(),
                request.walletId(), saved.getId());
        return saved;
    }

    @Override
    @Transactional
    public PersistedTransaction transferInternal(WithdrawalRequest request, String recipientWalletId,
                                                 Map<String, Object> metadata) {
        LedgerWallet addressOwner = walletRepository.findById(recipientWalletId)
                .orElseThrow(() -> new SettlementException(SettlementErrorCode.WALLET_NOT_FOUND,
                        "Wallet not found: " + recipientWalletId));
        LedgerWallet recipient = request.currency().equals(addressOwner.getCurrency())
                ? addressOwner
                : walletRepository.findByUserIdAndCurrency(addressOwner.getUserId(), request.currency())
                        .orElseGet(() -> newWallet(addressOwner.getUserId(), request.currency()));
        if (request.walletId().equals(recipient.getId())) {
            throw new SettlementException(SettlementErrorCode.INVALID_ADDRESS,
                    "Destination is the wallet's own deposit address");
        }
        Instant now = Instant.now();
        debit(request, now);
        recipient.setBalance(recipient.getBalance().add(request.amount()));
        recipient.setUpdatedAt(now);
        LedgerWallet credited = walletRepository.save(recipient);

        PersistedTransaction withdrawal =
                withdrawalRecord(request, INTERNAL_REFERENCE_PREFIX, TransactionStatus.CONFIRMED, metadata, now);
        withdrawal.putMetadata(RECIPIENT_WALLET_ID, credited.getId());
        PersistedTransaction saved = transactionRepository.insert(withdrawal);

        PersistedTransaction deposit = new PersistedTransaction();
        deposit.setTxHash(saved.getTxHash());
        deposit.setWalletId(credited.getId());
        deposit.setUserId(credited.getUserId());
        deposit.setType(TransactionType.DEPOSIT);
        deposit.setStatus(TransactionStatus.CONFIRMED);
        deposit.setChain(request.chain());
        deposit.setCurrency(request.currency());
        deposit.setAmount(request.amount());
        deposit.setFee(BigDecimal.ZERO);
        deposit.setToAddress(request.toAddress());
        deposit.putMetadata("senderWalletId", request.walletId());
        deposit.setCreatedAt(now);
        deposit.setUpdatedAt(now);
        transactionRepository.insert(deposit);
        log.info("Transferred {} {} from wallet {} to wallet {} ({})", request.amount().toPlainString(),
                request.currency(), request.walletId(), credited.getId(), saved.getTxHash());
        return saved;
    }

    // check-and-debit; the wallet's version makes a concurrent writer fail on save
    private BigDecimal debit(WithdrawalRequest request, Instant now) {
        LedgerWallet wallet = walletRepository.findById(request.walletId())
                .orElseThrow(() -> new SettlementException(SettlementErrorCode.WALLET_NOT_FOUND,
                        "Wallet not found: " + request.walletId()));
        BigDecimal fee = request.computedFee() != null ? request.computedFee() : BigDecimal.ZERO;
        BigDecimal total = request.amount().add(fee);
        if (wallet.available().compareTo(total) < 0) {
            throw new SettlementException(SettlementErrorCode.INSUFFICIENT_FUNDS,
                    "Insufficient funds: available " + wallet.available().toPlainString()
                            + ", required " + total.toPlainString());
        }
        wallet.setBalance(wallet.getBalance().subtract(total));
        wallet.setUpdatedAt(now);
        walletRepository.save(wallet);
        return total;
    }

    private static PersistedTransaction withdrawalRecord(WithdrawalRequest request, String referencePrefix,
                                                         TransactionStatus status, Map<String, Object> metadata,
                                                         Instant now) {
        PersistedTransaction tx = new PersistedTransaction();
        tx.setTxHash(referencePrefix + UUID.randomUUID());
        tx.setWalletId(request.walletId());
        tx.setUserId(request.userId());
        tx.setType(TransactionType.WITHDRAW);
        tx.setStatus(status);
        tx.setChain(request.chain());
        tx.setCurrency(request.currency());
        tx.setAmount(request.amount());
        tx.setFee(request.computedFee() != null ? request.computedFee() : BigDecimal.ZERO);
        tx.setToAddress(request.toAddress());
        if (metadata != null) {
            metadata.forEach(tx::putMetadata);
        }
        tx.setCreatedAt(now);
        tx.setUpdatedAt(now);
        return tx;
    }

    private static LedgerWallet newWallet(String userId, String currency) {
        LedgerWallet wallet = new LedgerWallet();
        wallet.setUserId(userId);
        wallet.setCurrency(currency);
        return wallet;
    }

    @Override
    @Transactional
    public boolean creditDeposit(PersistedTransaction deposit) {
        if (transactionRepository.existsByTxHashAndWalletId(deposit.getTxHash(), deposit.getWalletId())) {
            return false;
        }
        LedgerWallet wallet = walletRepository.findById(deposit.getWalletId())
                .orElseThrow(() -> new SettlementException(SettlementErrorCode.WALLET_NOT_FOUND,
                        "Wallet not found: " + deposit.getWalletId()));
        Instant now = Instant.now();
        if (deposit.getCreatedAt() == null) {
            deposit.setCreatedAt(now);
        }
        deposit.setUpdatedAt(now);
        transactionRepository.insert(deposit);
        wallet.setBalance(wallet.getBalance().add(deposit.getAmount()));
        wallet.setUpdatedAt(now);
        walletRepository.save(wallet);
        return true;
    }

    @Override
    public PersistedTransaction updateTransaction(PersistedTransaction transaction) {
        transaction.setUpdatedAt(Instant.now());
        return transactionRepository.save(transaction);
    }

    @Override
    public List<PersistedTransaction> findPendingWithdrawals() {
        return transactionRepository.findByTypeAndStatus(TransactionType.WITHDRAW, TransactionStatus.PENDING);
    }

    @Override
    public BigDecimal availableBalance(String walletId) {
        return walletRepository.findById(walletId)
                .map(LedgerWallet::available)
                .orElseThrow(() -> new SettlementException(SettlementErrorCode.WALLET_NOT_FOUND,
                        "Wallet not found: " + walletId));
    }
}
