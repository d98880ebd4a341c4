package com.example.ocppcentral.controller;

import com.example.ocppcentral.dto.ForceStopRequest;
import com.example.ocppcentral.model.ChargingTransaction;
import com.example.ocppcentral.service.BillingResult;
import com.example.ocppcentral.service.BillingService;
import com.example.ocppcentral.service.ChargePointCommandService;
import com.example.ocppcentral.service.ChargingTransactionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/transactions")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@Tag(name = "Transactions", description = "Billing retries and admin stop")
public class TransactionController {

    private final ChargingTransactionService transactionService;
    private final BillingService billingService;
    private final ChargePointCommandService commandService;

    @GetMapping("/billing-failed")
    @Operation(summary = "Transactions waiting for a billing retry")
    public List<ChargingTransaction> billingFailed() {
        return transactionService.findBillingFailed();
    }

    @PostMapping("/{transactionId}/retry-billing")
    @Operation(summary = "Retry billing for a BILLING_FAILED transaction")
    public ResponseEntity<BillingResult> retryBilling(@PathVariable Long transactionId) {
        BillingResult result = billingService.retryFailedBilling(transactionId);
        switch (result.getOutcome()) {
            case NOT_FOUND:
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
            case NOT_RETRYABLE:
                return ResponseEntity.status(HttpStatus.CONFLICT).body(result);
            case FAILED:
                return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);
            default:
                return ResponseEntity.ok(result);
        }
    }

    @PostMapping("/{transactionId}/stop")
    @Operation(summary = "Force stop an ongoing transaction")
    public ChargingTransaction forceStop(@PathVariable Long transactionId,
                                         @Valid @RequestBody ForceStopRequest request) {
        return commandService.forceStopTransaction(transactionId, request.getReason());
    }
}
