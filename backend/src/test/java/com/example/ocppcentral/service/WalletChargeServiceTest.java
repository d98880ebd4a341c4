package com.example.ocppcentral.service;

import com.example.ocppcentral.exception.NoTariffConfiguredException;
import com.example.ocppcentral.exception.TransactionNotFoundException;
import com.example.ocppcentral.exception.WalletNotFoundException;
import com.example.ocppcentral.model.ChargingTransaction;
import com.example.ocppcentral.model.Tariff;
import com.example.ocppcentral.model.TransactionStatus;
import com.example.ocppcentral.model.Wallet;
import com.example.ocppcentral.model.WalletTransaction;
import com.example.ocppcentral.model.WalletTransactionType;
import com.example.ocppcentral.repository.ChargingTransactionRepository;
import com.example.ocppcentral.repository.TariffRepository;
import com.example.ocppcentral.repository.WalletRepository;
import com.example.ocppcentral.repository.WalletTransactionRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WalletChargeServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final long TX_ID = 100L;
    private static final long USER_ID = 7L;
    private static final long CHARGER_ID = 3L;

    @Mock
    private ChargingTransactionRepository transactionRepository;

    @Mock
    private TariffRepository tariffRepository;

    @Mock
    private WalletRepository walletRepository;

    @Mock
    private WalletTransactionRepository walletTransactionRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private WalletChargeService walletChargeService;

    @BeforeEach
    void setUp() {
        walletChargeService = new WalletChargeService(transactionRepository, tariffRepository, walletRepository,
                walletTransactionRepository, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testCalculateAmount_RoundsHalfUpToCents() {
        assertThat(WalletChargeService.calculateAmount(10.005, new BigDecimal("0.35")))
                .isEqualByComparingTo("3.50");
        assertThat(WalletChargeService.calculateAmount(1.0, new BigDecimal("0.125")))
                .isEqualByComparingTo("0.13");
        assertThat(WalletChargeService.calculateAmount(0.001, new BigDecimal("0.35")))
                .isEqualByComparingTo("0.00");
    }

    @Test
    void testChargeTransaction_DebitsWalletAndWritesLedger() throws Exception {
        // Arrange
        givenTransaction(TransactionStatus.COMPLETED, 10.005);
        when(tariffRepository.findFirstByChargerIdOrderByIdAsc(CHARGER_ID)).thenReturn(Optional.of(tariff("0.35")));
        Wallet wallet = Wallet.builder().id(9L).userId(USER_ID).balance(new BigDecimal("20.00")).build();
        when(walletRepository.findByUserIdForUpdate(USER_ID)).thenReturn(Optional.of(wallet));

        // Act
        BillingResult result = walletChargeService.chargeTransaction(TX_ID, false);

        // Assert
        assertThat(result.getOutcome()).isEqualTo(BillingResult.Outcome.BILLED);
        assertThat(result.getAmount()).isEqualByComparingTo("3.50");
        assertThat(wallet.getBalance()).isEqualByComparingTo("16.50");
        assertThat(wallet.getUpdatedAt()).isEqualTo(NOW);

        ArgumentCaptor<WalletTransaction> captor = ArgumentCaptor.forClass(WalletTransaction.class);
        verify(walletTransactionRepository).save(captor.capture());
        WalletTransaction entry = captor.getValue();
        assertThat(entry.getAmount()).isEqualByComparingTo("-3.50");
        assertThat(entry.getType()).isEqualTo(WalletTransactionType.CHARGE_DEDUCT);
        assertThat(entry.getWalletId()).isEqualTo(9L);
        assertThat(entry.getChargingTransactionId()).isEqualTo(TX_ID);
        assertThat(entry.getDescription()).isEqualTo("Charging session - 10.005 kWh @ 0.35/kWh");

        JsonNode metadata = objectMapper.readTree(entry.getMetadata());
        assertThat(metadata.get("previous_balance").asText()).isEqualTo("20.00");
        assertThat(metadata.get("new_balance").asText()).isEqualTo("16.50");
        assertThat(metadata.get("calculated_amount").asText()).isEqualTo("3.50");
        verify(transactionRepository, never()).save(any());
    }

    @Test
    void testChargeTransaction_FallsBackToGlobalTariffAndNullBalance() {
        givenTransaction(TransactionStatus.COMPLETED, 2.0);
        when(tariffRepository.findFirstByGlobalTrueOrderByIdAsc()).thenReturn(Optional.of(tariff("0.50")));
        Wallet wallet = Wallet.builder().id(9L).userId(USER_ID).balance(null).build();
        when(walletRepository.findByUserIdForUpdate(USER_ID)).thenReturn(Optional.of(wallet));

        BillingResult result = walletChargeService.chargeTransaction(TX_ID, false);

        assertThat(result.getOutcome()).isEqualTo(BillingResult.Outcome.BILLED);
        assertThat(wallet.getBalance()).isEqualByComparingTo("-1.00");
    }

    @Test
    void testChargeTransaction_AlreadyBilledIsIdempotent() {
        givenTransaction(TransactionStatus.COMPLETED, 10.005);
        when(walletTransactionRepository.existsByChargingTransactionIdAndType(TX_ID, WalletTransactionType.CHARGE_DEDUCT))
                .thenReturn(true);

        BillingResult result = walletChargeService.chargeTransaction(TX_ID, false);

        assertThat(result.getOutcome()).isEqualTo(BillingResult.Outcome.ALREADY_BILLED);
        assertThat(result.isSuccess()).isTrue();
        verify(walletRepository, never()).save(any());
        verify(walletTransactionRepository, never()).save(any());
    }

    @Test
    void testChargeTransaction_NoEnergyIsNotBilled() {
        givenTransaction(TransactionStatus.COMPLETED, null);

        BillingResult result = walletChargeService.chargeTransaction(TX_ID, false);

        assertThat(result.getOutcome()).isEqualTo(BillingResult.Outcome.NO_ENERGY);
        verify(walletRepository, never()).findByUserIdForUpdate(any());
    }

    @Test
    void testChargeTransaction_ZeroAmountIsNotBilled() {
        givenTransaction(TransactionStatus.COMPLETED, 0.001);
        when(tariffRepository.findFirstByChargerIdOrderByIdAsc(CHARGER_ID)).thenReturn(Optional.of(tariff("0.35")));

        BillingResult result = walletChargeService.chargeTransaction(TX_ID, false);

        assertThat(result.getOutcome()).isEqualTo(BillingResult.Outcome.ZERO_AMOUNT);
        verify(walletTransactionRepository, never()).save(any());
    }

    @Test
    void testChargeTransaction_NoTariffThrows() {
        givenTransaction(TransactionStatus.COMPLETED, 10.0);

        assertThatThrownBy(() -> walletChargeService.chargeTransaction(TX_ID, false))
                .isInstanceOf(NoTariffConfiguredException.class);
        verify(walletRepository, never()).save(any());
    }

    @Test
    void testChargeTransaction_MissingWalletThrows() {
        givenTransaction(TransactionStatus.COMPLETED, 10.0);
        when(tariffRepository.findFirstByChargerIdOrderByIdAsc(CHARGER_ID)).thenReturn(Optional.of(tariff("0.35")));

        assertThatThrownBy(() -> walletChargeService.chargeTransaction(TX_ID, false))
                .isInstanceOf(WalletNotFoundException.class);
        verify(walletTransactionRepository, never()).save(any());
    }

    @Test
    void testChargeTransaction_UnknownTransactionThrows() {
        assertThatThrownBy(() -> walletChargeService.chargeTransaction(TX_ID, false))
                .isInstanceOf(TransactionNotFoundException.class);
    }

    @Test
    void testChargeTransaction_RetryCompletesBillingFailedTransaction() {
        // Arrange
        ChargingTransaction transaction = givenTransaction(TransactionStatus.BILLING_FAILED, 4.0);
        when(tariffRepository.findFirstByChargerIdOrderByIdAsc(CHARGER_ID)).thenReturn(Optional.of(tariff("0.25")));
        when(walletRepository.findByUserIdForUpdate(USER_ID)).thenReturn(Optional.of(
                Wallet.builder().id(9L).userId(USER_ID).balance(new BigDecimal("10.00")).build()));

        // Act
        BillingResult result = walletChargeService.chargeTransaction(TX_ID, true);

        // Assert
        assertThat(result.getOutcome()).isEqualTo(BillingResult.Outcome.BILLED);
        assertThat(transaction.getStatus()).isEqualTo(TransactionStatus.COMPLETED);
        assertThat(transaction.getUpdatedAt()).isEqualTo(NOW);
        verify(transactionRepository).save(transaction);
    }

    @Test
    void testChargeTransaction_RetryOfAlreadyBilledStillCompletes() {
        ChargingTransaction transaction = givenTransaction(TransactionStatus.BILLING_FAILED, 4.0);
        when(walletTransactionRepository.existsByChargingTransactionIdAndType(TX_ID, WalletTransactionType.CHARGE_DEDUCT))
                .thenReturn(true);

        BillingResult result = walletChargeService.chargeTransaction(TX_ID, true);

        assertThat(result.getOutcome()).isEqualTo(BillingResult.Outcome.ALREADY_BILLED);
        assertThat(transaction.getStatus()).isEqualTo(TransactionStatus.COMPLETED);
        verify(walletTransactionRepository, never()).save(any());
    }

    @Test
    void testChargeTransaction_RetryRequiresBillingFailed() {
        givenTransaction(TransactionStatus.COMPLETED, 4.0);

        BillingResult result = walletChargeService.chargeTransaction(TX_ID, true);

        assertThat(result.getOutcome()).isEqualTo(BillingResult.Outcome.NOT_RETRYABLE);
        verify(walletRepository, never()).save(any());
    }

    private ChargingTransaction givenTransaction(TransactionStatus status, Double energyKwh) {
        ChargingTransaction transaction = ChargingTransaction.builder()
                .id(TX_ID)
                .userId(USER_ID)
                .chargerId(CHARGER_ID)
                .energyConsumedKwh(energyKwh)
                .status(status)
                .build();
        when(transactionRepository.findByIdForUpdate(TX_ID)).thenReturn(Optional.of(transaction));
        return transaction;
    }

    private static Tariff tariff(String rate) {
        return Tariff.builder().id(1L).ratePerKwh(new BigDecimal(rate)).build();
    }
}
