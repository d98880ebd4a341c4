package com.example.ocppcentral.ocpp.handler;

import com.example.ocppcentral.ocpp.OcppAction;
import com.example.ocppcentral.ocpp.OcppRequestHandler;
import com.example.ocppcentral.ocpp.message.AuthorizationStatus;
import com.example.ocppcentral.ocpp.message.IdTagInfo;
import com.example.ocppcentral.ocpp.message.StopTransactionRequest;
import com.example.ocppcentral.ocpp.message.StopTransactionResponse;
import com.example.ocppcentral.service.BillingService;
import com.example.ocppcentral.service.ChargingTransactionService;
import com.example.ocppcentral.service.ChargingTransactionService.StopOutcome;
import com.example.ocppcentral.websocket.ChargePointSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Closes the transaction and answers the charger. Billing is handed to the
 * billing executor so its outcome never changes the reply.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StopTransactionHandler implements OcppRequestHandler<StopTransactionRequest> {

    private final ChargingTransactionService chargingTransactionService;
    private final BillingService billingService;

    @Override
    public OcppAction getAction() {
        return OcppAction.STOP_TRANSACTION;
    }

    @Override
    public Class<StopTransactionRequest> getRequestType() {
        return StopTransactionRequest.class;
    }

    @Override
    public Object handle(ChargePointSession session, StopTransactionRequest request) {
        Long transactionId = request.getTransactionId();
        log.info("StopTransaction from {}: transaction={}, meterStop={}, reason={}", session.getChargePointId(),
                transactionId, request.getMeterStop(), request.getReason());

        if (transactionId == null || request.getMeterStop() == null) {
            return invalid();
        }
        try {
            StopOutcome outcome = chargingTransactionService.stopTransaction(
                    transactionId, request.getMeterStop(), request.getReason());
            switch (outcome) {
                case NOT_FOUND:
                    return invalid();
                case STOPPED:
                    billingService.processTransactionBillingAsync(transactionId);
                    break;
                default:
                    break;
            }
            return new StopTransactionResponse(new IdTagInfo(AuthorizationStatus.ACCEPTED));
        } catch (RuntimeException e) {
            log.error("Error stopping transaction {}", transactionId, e);
            return invalid();
        }
    }

    private static StopTransactionResponse invalid() {
        return new StopTransactionResponse(new IdTagInfo(AuthorizationStatus.INVALID));
    }
}
