package com.example.ocppcentral.exception;

public class NoTariffConfiguredException extends BillingException {

    public NoTariffConfiguredException(Long chargerId) {
        super("No tariff configured for charger " + chargerId + " and no global tariff found");
    }
}
