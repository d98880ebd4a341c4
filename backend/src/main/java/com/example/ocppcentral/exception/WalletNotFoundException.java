package com.example.ocppcentral.exception;

public class WalletNotFoundException extends BillingException {

    public WalletNotFoundException(Long userId) {
        super("Wallet not found for user " + userId);
    }
}
