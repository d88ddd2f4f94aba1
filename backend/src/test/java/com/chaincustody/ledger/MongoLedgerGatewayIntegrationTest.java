package com.chaincustody.ledger;

import com.chaincustody.config.MongoConfig;
import com.chaincustody.domain.LedgerWallet;
import com.chaincustody.domain.LedgerWalletRepository;
import com.chaincustody.domain.PersistedTransaction;
import com.chaincustody.domain.SettlementErrorCode;
import com.chaincustody.domain.SettlementException;
import com.chaincustody.domain.TransactionStatus;
import com.chaincustody.domain.TransactionType;
import com.chaincustody.domain.WithdrawalRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataMongoTest(properties = "spring.data.mongodb.auto-index-creation=true")
@Testcontainers(disabledWithoutDocker = true)
@Import({MongoConfig.class, MongoLedgerGateway.class})
class MongoLedgerGatewayIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    LedgerGateway ledger;
    @Autowired
    LedgerWalletRepository walletRepository;
    @Autowired
    MongoTemplate mongoTemplate;

    @BeforeEach
    void setUp() {
        mongoTemplate.remove(new Query(), PersistedTransaction.class);
        walletRepository.deleteAll();
        walletRepository.save(wallet("w1", "u1", "ETH", "100"));
    }

    private static LedgerWallet wallet(String id, String userId, String currency, String balance) {
        LedgerWallet wallet = new LedgerWallet();
        wallet.setId(id);
        wallet.setUserId(userId);
        wallet.setCurrency(currency);
        wallet.setBalance(new BigDecimal(balance));
        return wallet;
    }

    private static WithdrawalRequest ethWithdrawal(String amount) {
        return new WithdrawalRequest("u1", "w1", "ETH", "ETH", new BigDecimal(amount),
                "0x742d35Cc6634C0532925a3b844Bc454e4438f44e", BigDecimal.ZERO);
    }

    private static PersistedTransaction deposit(String hash, String amount) {
        PersistedTransaction tx = new PersistedTransaction();
        tx.setTxHash(hash);
        tx.setWalletId("w1");
        tx.setType(TransactionType.DEPOSIT);
        tx.setStatus(TransactionStatus.CONFIRMED);
        tx.setChain("ETH");
        tx.setCurrency("ETH");
        tx.setAmount(new BigDecimal(amount));
        tx.setFee(BigDecimal.ZERO);
        return tx;
    }

    @Test
    @DisplayName("debit subtracts amount plus fee and records a PENDING withdrawal")
    void debitAndRecord_sufficientFunds() {
        PersistedTransaction tx = ledger.debitAndRecord(new WithdrawalRequest("u1", "w1", "ETH", "ETH",
                new BigDecimal("10.5"), "0x742d35Cc6634C0532925a3b844Bc454e4438f44e", new BigDecimal("0.25")),
                Map.of("serviceFee", "0.25"));

        assertThat(tx.getId()).isNotNull();
        assertThat(tx.getTxHash()).startsWith("wd-");
        assertThat(ledger.availableBalance("w1")).isEqualByComparingTo("89.25");
        PersistedTransaction stored = ledger.findTransactionById(tx.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(TransactionStatus.PENDING);
        assertThat(stored.getAmount()).isEqualByComparingTo("10.5");
        assertThat(stored.getMetadata()).containsEntry("serviceFee", "0.25");
        assertThat(ledger.findPendingWithdrawals()).hasSize(1);
    }

    @Test
    void debitAndRecord_insufficientFunds_noChanges() {
        assertThatThrownBy(() -> ledger.debitAndRecord(new WithdrawalRequest("u1", "w1", "ETH", "ETH",
                new BigDecimal("100"), "0x742d35Cc6634C0532925a3b844Bc454e4438f44e", new BigDecimal("0.01")), Map.of()))
                .isInstanceOf(SettlementException.class)
                .extracting(e -> ((SettlementException) e).getErrorCode())
                .isEqualTo(SettlementErrorCode.INSUFFICIENT_FUNDS);

        assertThat(ledger.availableBalance("w1")).isEqualByComparingTo("100");
        assertThat(ledger.findPendingWithdrawals()).isEmpty();
    }

    @Test
    @DisplayName("the same deposit hash is credited once")
    void creditDeposit_idempotentPerHashAndWallet() {
        assertThat(ledger.creditDeposit(deposit("0xdep", "2.5"))).isTrue();
        assertThat(ledger.creditDeposit(deposit("0xdep", "2.5"))).isFalse();

        assertThat(ledger.availableBalance("w1")).isEqualByComparingTo("102.5");
        assertThat(ledger.findTransaction("0xdep", "w1")).isPresent();
    }

    @Test
    void creditDeposit_unknownWallet_rejected() {
        PersistedTransaction tx = deposit("0xother", "1");
        tx.setWalletId("missing");

        assertThatThrownBy(() -> ledger.creditDeposit(tx)).isInstanceOf(SettlementException.class);
        assertThat(ledger.findTransaction("0xother", "missing")).isEmpty();
    }

    @Test
    @DisplayName("parallel debits exceeding the balance: one commits, the other fails without a record")
    void debitAndRecord_parallelOverdraw_exactlyOneCommits() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<PersistedTransaction>> futures = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return ledger.debitAndRecord(ethWithdrawal("60"), Map.of());
                }));
            }
            start.countDown();

            int committed = 0;
            List<Throwable> failures = new ArrayList<>();
            for (Future<PersistedTransaction> f : futures) {
                try {
                    f.get(30, TimeUnit.SECONDS);
                    committed++;
                } catch (ExecutionException e) {
                    failures.add(e.getCause());
                }
            }

            assertThat(committed).isEqualTo(1);
            assertThat(failures).singleElement().satisfies(failure -> {
                assertThat(failure).isInstanceOfAny(SettlementException.class, DataAccessException.class,
                        TransactionException.class);
                if (failure instanceof SettlementException settlement) {
                    assertThat(settlement.getErrorCode()).isEqualTo(SettlementErrorCode.INSUFFICIENT_FUNDS);
                }
            });
        } finally {
            pool.shutdownNow();
        }
        assertThat(ledger.availableBalance("w1")).isEqualByComparingTo("40");
        assertThat(ledger.findPendingWithdrawals()).hasSize(1);
    }

    @Test
    @DisplayName("internal transfer moves funds between wallets with two CONFIRMED records")
    void transferInternal_creditsRecipient() {
        walletRepository.save(wallet("w2", "u2", "ETH", "5"));

        PersistedTransaction tx = ledger.transferInternal(ethWithdrawal("10"), "w2", Map.of("internalTransfer", true));

        assertThat(tx.getTxHash()).startsWith("it-");
        assertThat(tx.getStatus()).isEqualTo(TransactionStatus.CONFIRMED);
        assertThat(tx.getMetadata()).containsEntry(LedgerGateway.RECIPIENT_WALLET_ID, "w2");
        assertThat(ledger.availableBalance("w1")).isEqualByComparingTo("90");
        assertThat(ledger.availableBalance("w2")).isEqualByComparingTo("15");
        assertThat(ledger.findTransaction(tx.getTxHash(), "w2"))
                .hasValueSatisfying(d -> {
                    assertThat(d.getType()).isEqualTo(TransactionType.DEPOSIT);
                    assertThat(d.getStatus()).isEqualTo(TransactionStatus.CONFIRMED);
                });
        assertThat(ledger.findPendingWithdrawals()).isEmpty();
    }

    @Test
    void transferInternal_addressOfOtherCurrencyWallet_creditsOwnersWalletForCurrency() {
        walletRepository.save(wallet("w3", "u2", "BTC", "0"));

        PersistedTransaction tx = ledger.transferInternal(ethWithdrawal("10"), "w3", Map.of());

        LedgerWallet credited = walletRepository.findByUserIdAndCurrency("u2", "ETH").orElseThrow();
        assertThat(credited.getBalance()).isEqualByComparingTo("10");
        assertThat(tx.getMetadata()).containsEntry(LedgerGateway.RECIPIENT_WALLET_ID, credited.getId());
        assertThat(ledger.availableBalance("w3")).isEqualByComparingTo("0");
    }

    @Test
    void transferInternal_insufficientFunds_nothingCredited() {
        walletRepository.save(wallet("w2", "u2", "ETH", "5"));

        assertThatThrownBy(() -> ledger.transferInternal(ethWithdrawal("150"), "w2", Map.of()))
                .isInstanceOf(SettlementException.class);

        assertThat(ledger.availableBalance("w1")).isEqualByComparingTo("100");
        assertThat(ledger.availableBalance("w2")).isEqualByComparingTo("5");
    }
}
