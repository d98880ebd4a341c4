package com.example.ocppcentral.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Set;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BillingResult {

    public enum Outcome {
        BILLED,
        NO_ENERGY,
        ALREADY_BILLED,
        ZERO_AMOUNT,
        FAILED,
        NOT_FOUND,
        NOT_RETRYABLE
    }

    private static final Set<Outcome> SUCCESSFUL =
            EnumSet.of(Outcome.BILLED, Outcome.NO_ENERGY, Outcome.ALREADY_BILLED, Outcome.ZERO_AMOUNT);

    Long transactionId;
    Outcome outcome;
    BigDecimal amount;
    String message;

    public static BillingResult billed(Long transactionId, BigDecimal amount) {
        return new BillingResult(transactionId, Outcome.BILLED, amount, "Charged " + amount.toPlainString());
    }

    public static BillingResult of(Long transactionId, Outcome outcome, String message) {
        return new BillingResult(transactionId, outcome, null, message);
    }

    public boolean isSuccess() {
        return SUCCESSFUL.contains(outcome);
    }
}
