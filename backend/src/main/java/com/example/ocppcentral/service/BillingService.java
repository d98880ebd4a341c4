package com.example.ocppcentral.service;

import com.example.ocppcentral.exception.TransactionNotFoundException;
import com.example.ocppcentral.model.ChargingTransaction;
import com.example.ocppcentral.model.TransactionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for billing a finished transaction. A failed debit leaves the
 * transaction BILLING_FAILED for the retry sweep; it never propagates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BillingService {

    private final WalletChargeService walletChargeService;
    private final ChargingTransactionService chargingTransactionService;

    public BillingResult processTransactionBilling(Long transactionId) {
        return bill(transactionId, false);
    }

    /**
     * Bills on the billing executor, after the caller's protocol exchange.
     */
    @Async("billingExecutor")
    public CompletableFuture<BillingResult> processTransactionBillingAsync(Long transactionId) {
        return CompletableFuture.completedFuture(processTransactionBilling(transactionId));
    }

    public BillingResult retryFailedBilling(Long transactionId) {
        Optional<ChargingTransaction> transaction = chargingTransactionService.findById(transactionId);
        if (transaction.isEmpty()) {
            return BillingResult.of(transactionId, BillingResult.Outcome.NOT_FOUND, "Transaction not found");
        }
        if (transaction.get().getStatus() != TransactionStatus.BILLING_FAILED) {
            return BillingResult.of(transactionId, BillingResult.Outcome.NOT_RETRYABLE,
                    "Transaction is " + transaction.get().getStatus() + ", not BILLING_FAILED");
        }
        log.info("Retrying billing for transaction {}", transactionId);
        return bill(transactionId, true);
    }

    private BillingResult bill(Long transactionId, boolean retry) {
        try {
            BillingResult result = walletChargeService.chargeTransaction(transactionId, retry);
            log.info("Billing for transaction {}: {} ({})", transactionId, result.getOutcome(), result.getMessage());
            return result;
        } catch (TransactionNotFoundException e) {
            log.error("Billing requested for unknown transaction {}", transactionId);
            return BillingResult.of(transactionId, BillingResult.Outcome.NOT_FOUND, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Billing failed for transaction {}: {}", transactionId, e.getMessage(), e);
            chargingTransactionService.markBillingFailed(transactionId, e.getMessage());
            return BillingResult.of(transactionId, BillingResult.Outcome.FAILED, e.getMessage());
        }
    }
}
