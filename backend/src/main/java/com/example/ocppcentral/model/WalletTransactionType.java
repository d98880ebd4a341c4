package com.example.ocppcentral.model;

public enum WalletTransactionType {
    TOP_UP,
    CHARGE_DEDUCT
}
