package com.example.ocppcentral.integration;

import com.example.ocppcentral.model.AppUser;
import com.example.ocppcentral.model.Charger;
import com.example.ocppcentral.model.ChargingTransaction;
import com.example.ocppcentral.model.Tariff;
import com.example.ocppcentral.model.TransactionStatus;
import com.example.ocppcentral.model.Wallet;
import com.example.ocppcentral.model.WalletTransaction;
import com.example.ocppcentral.model.WalletTransactionType;
import com.example.ocppcentral.repository.AppUserRepository;
import com.example.ocppcentral.repository.ChargerRepository;
import com.example.ocppcentral.repository.ChargingTransactionRepository;
import com.example.ocppcentral.repository.TariffRepository;
import com.example.ocppcentral.repository.WalletRepository;
import com.example.ocppcentral.repository.WalletTransactionRepository;
import com.example.ocppcentral.service.BillingResult;
import com.example.ocppcentral.service.BillingService;
import com.example.ocppcentral.service.ConnectionRegistry;
import com.example.ocppcentral.service.WalletChargeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Failed billing, tariff fix, retry: the wallet is charged exactly once.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class BillingScenarioTest {

    @MockBean
    private ConnectionRegistry connectionRegistry;

    @Autowired
    private BillingService billingService;

    @Autowired
    private WalletChargeService walletChargeService;

    @Autowired
    private ChargingTransactionRepository transactionRepository;

    @Autowired
    private TariffRepository tariffRepository;

    @Autowired
    private WalletRepository walletRepository;

    @Autowired
    private WalletTransactionRepository walletTransactionRepository;

    @Autowired
    private AppUserRepository userRepository;

    @Autowired
    private ChargerRepository chargerRepository;

    private Long transactionId;
    private Long userId;

    @BeforeEach
    void setUp() {
        walletTransactionRepository.deleteAll();
        walletRepository.deleteAll();
        tariffRepository.deleteAll();
        transactionRepository.deleteAll();

        AppUser user = userRepository.save(AppUser.builder()
                .email("driver-" + System.nanoTime() + "@example.com")
                .fullName("Test Driver")
                .active(true)
                .build());
        userId = user.getId();
        Charger charger = chargerRepository.save(Charger.builder()
                .chargePointId("CP-BILL-" + System.nanoTime())
                .createdAt(Instant.now())
                .build());

        walletRepository.save(Wallet.builder()
                .userId(userId)
                .balance(new BigDecimal("50.00"))
                .updatedAt(Instant.now())
                .build());

        ChargingTransaction transaction = transactionRepository.save(ChargingTransaction.builder()
                .userId(userId)
                .chargerId(charger.getId())
                .connectorId(1)
                .idTag("RFID-BILL")
                .startMeterKwh(0.0)
                .endMeterKwh(10.005)
                .energyConsumedKwh(10.005)
                .startTime(Instant.now().minusSeconds(3600))
                .endTime(Instant.now())
                .status(TransactionStatus.COMPLETED)
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build());
        transactionId = transaction.getId();
    }

    @Test
    void testBillingWithoutTariff_FailsThenRetrySucceedsOnce() {
        // Arrange: no tariff configured yet

        // Act
        BillingResult first = billingService.processTransactionBilling(transactionId);

        // Assert
        assertThat(first.getOutcome()).isEqualTo(BillingResult.Outcome.FAILED);
        assertThat(transactionRepository.findById(transactionId).orElseThrow().getStatus())
                .isEqualTo(TransactionStatus.BILLING_FAILED);
        assertThat(walletTransactionRepository.findByChargingTransactionId(transactionId)).isEmpty();

        // Arrange: operator adds a global tariff
        tariffRepository.save(Tariff.builder()
                .ratePerKwh(new BigDecimal("0.35"))
                .global(true)
                .build());

        // Act
        BillingResult retried = billingService.retryFailedBilling(transactionId);

        // Assert
        assertThat(retried.getOutcome()).isEqualTo(BillingResult.Outcome.BILLED);
        assertThat(retried.getAmount()).isEqualByComparingTo("3.50");
        assertThat(transactionRepository.findById(transactionId).orElseThrow().getStatus())
                .isEqualTo(TransactionStatus.COMPLETED);
        assertThat(walletRepository.findByUserId(userId).orElseThrow().getBalance())
                .isEqualByComparingTo("46.50");

        List<WalletTransaction> ledger = walletTransactionRepository.findByChargingTransactionId(transactionId);
        assertThat(ledger).hasSize(1);
        assertThat(ledger.get(0).getType()).isEqualTo(WalletTransactionType.CHARGE_DEDUCT);
        assertThat(ledger.get(0).getAmount()).isEqualByComparingTo("-3.50");

        // A second retry or a late first-time billing must not charge again
        assertThat(billingService.retryFailedBilling(transactionId).getOutcome())
                .isEqualTo(BillingResult.Outcome.NOT_RETRYABLE);
        assertThat(walletChargeService.chargeTransaction(transactionId, false).getOutcome())
                .isEqualTo(BillingResult.Outcome.ALREADY_BILLED);
        assertThat(walletTransactionRepository.findByChargingTransactionId(transactionId)).hasSize(1);
        assertThat(walletRepository.findByUserId(userId).orElseThrow().getBalance())
                .isEqualByComparingTo("46.50");
    }

    @Test
    void testProcessTransactionBilling_TwiceChargesOnce() {
        // Arrange
        tariffRepository.save(Tariff.builder()
                .ratePerKwh(new BigDecimal("0.35"))
                .global(true)
                .build());

        // Act
        BillingResult first = billingService.processTransactionBilling(transactionId);
        BillingResult second = billingService.processTransactionBilling(transactionId);

        // Assert
        assertThat(first.getOutcome()).isEqualTo(BillingResult.Outcome.BILLED);
        assertThat(second.getOutcome()).isEqualTo(BillingResult.Outcome.ALREADY_BILLED);
        assertThat(walletTransactionRepository.findByChargingTransactionId(transactionId))
                .singleElement()
                .satisfies(entry -> assertThat(entry.getType()).isEqualTo(WalletTransactionType.CHARGE_DEDUCT));
        assertThat(walletRepository.findByUserId(userId).orElseThrow().getBalance())
                .isEqualByComparingTo("46.50");
        assertThat(transactionRepository.findById(transactionId).orElseThrow().getStatus())
                .isEqualTo(TransactionStatus.COMPLETED);
    }

    @Test
    void testRetryFailedBilling_UnknownTransaction() {
        BillingResult result = billingService.retryFailedBilling(987654L);

        assertThat(result.getOutcome()).isEqualTo(BillingResult.Outcome.NOT_FOUND);
    }
}
