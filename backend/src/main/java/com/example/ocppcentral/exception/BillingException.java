package com.example.ocppcentral.exception;

/**
 * Raised inside the billing boundary. The whole debit rolls back and the
 * transaction is left BILLING_FAILED for the retry sweep.
 */
public class BillingException extends RuntimeException {

    public BillingException(String message) {
        super(message);
    }

    public BillingException(String message, Throwable cause) {
        super(message, cause);
    }
}
