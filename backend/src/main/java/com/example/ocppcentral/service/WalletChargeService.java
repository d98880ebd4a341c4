package com.example.ocppcentral.service;

import com.example.ocppcentral.exception.BillingException;
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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The atomic part of billing: tariff lookup, wallet debit, ledger insert and,
 * on retry, the BILLING_FAILED -> COMPLETED flip. Any exception rolls all of it back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WalletChargeService {

    private final ChargingTransactionRepository transactionRepository;
    private final TariffRepository tariffRepository;
    private final WalletRepository walletRepository;
    private final WalletTransactionRepository walletTransactionRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @param retry when true the transaction must be BILLING_FAILED and is completed on success
     */
    @Transactional
    public BillingResult chargeTransaction(Long transactionId, boolean retry) {
        ChargingTransaction transaction = transactionRepository.findByIdForUpdate(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException("Transaction " + transactionId + " not found"));

        if (retry && transaction.getStatus() != TransactionStatus.BILLING_FAILED) {
            return BillingResult.of(transactionId, BillingResult.Outcome.NOT_RETRYABLE,
                    "Transaction is " + transaction.getStatus() + ", not BILLING_FAILED");
        }

        if (walletTransactionRepository.existsByChargingTransactionIdAndType(
                transactionId, WalletTransactionType.CHARGE_DEDUCT)) {
            log.info("Transaction {} already billed, skipping", transactionId);
            completeIfRetry(transaction, retry);
            return BillingResult.of(transactionId, BillingResult.Outcome.ALREADY_BILLED, "Already billed");
        }

        Double energy = transaction.getEnergyConsumedKwh();
        if (energy == null || energy <= 0) {
            log.info("No energy consumed for transaction {}, nothing to bill", transactionId);
            completeIfRetry(transaction, retry);
            return BillingResult.of(transactionId, BillingResult.Outcome.NO_ENERGY, "No energy consumed");
        }

        BigDecimal rate = resolveTariff(transaction.getChargerId()).getRatePerKwh();
        BigDecimal amount = calculateAmount(energy, rate);
        if (amount.signum() == 0) {
            log.info("Billing amount rounds to zero for transaction {}", transactionId);
            completeIfRetry(transaction, retry);
            return BillingResult.of(transactionId, BillingResult.Outcome.ZERO_AMOUNT, "Amount rounds to zero");
        }

        Wallet wallet = walletRepository.findByUserIdForUpdate(transaction.getUserId())
                .orElseThrow(() -> new WalletNotFoundException(transaction.getUserId()));
        BigDecimal previousBalance = wallet.getBalance() == null ? BigDecimal.ZERO : wallet.getBalance();
        BigDecimal newBalance = previousBalance.subtract(amount);

        Instant now = clock.instant();
        wallet.setBalance(newBalance);
        wallet.setUpdatedAt(now);
        walletRepository.save(wallet);

        walletTransactionRepository.save(WalletTransaction.builder()
                .walletId(wallet.getId())
                .amount(amount.negate())
                .type(WalletTransactionType.CHARGE_DEDUCT)
                .description("Charging session - " + energy + " kWh @ " + rate.toPlainString() + "/kWh")
                .chargingTransactionId(transactionId)
                .metadata(metadata(energy, rate, amount, previousBalance, newBalance))
                .createdAt(now)
                .build());

        completeIfRetry(transaction, retry);
        log.info("Billed transaction {}: {} (balance {} -> {})",
                transactionId, amount.toPlainString(), previousBalance.toPlainString(), newBalance.toPlainString());
        return BillingResult.billed(transactionId, amount);
    }

    /**
     * energy x rate, rounded half-up to cents.
     */
    public static BigDecimal calculateAmount(double energyKwh, BigDecimal ratePerKwh) {
        return BigDecimal.valueOf(energyKwh).multiply(ratePerKwh).setScale(2, RoundingMode.HALF_UP);
    }

    private Tariff resolveTariff(Long chargerId) {
        return tariffRepository.findFirstByChargerIdOrderByIdAsc(chargerId)
                .or(tariffRepository::findFirstByGlobalTrueOrderByIdAsc)
                .orElseThrow(() -> new NoTariffConfiguredException(chargerId));
    }

    private void completeIfRetry(ChargingTransaction transaction, boolean retry) {
        if (retry) {
            transaction.transitionTo(TransactionStatus.COMPLETED, clock.instant());
            transactionRepository.save(transaction);
        }
    }

    private String metadata(double energy, BigDecimal rate, BigDecimal amount,
                            BigDecimal previousBalance, BigDecimal newBalance) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("energy_consumed_kwh", energy);
        metadata.put("rate_per_kwh", rate.toPlainString());
        metadata.put("calculated_amount", amount.toPlainString());
        metadata.put("previous_balance", previousBalance.toPlainString());
        metadata.put("new_balance", newBalance.toPlainString());
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new BillingException("Cannot serialize billing metadata", e);
        }
    }
}
