package com.example.ocppcentral.ocpp.handler;

import com.example.ocppcentral.ocpp.message.AuthorizationStatus;
import com.example.ocppcentral.ocpp.message.StopTransactionRequest;
import com.example.ocppcentral.ocpp.message.StopTransactionResponse;
import com.example.ocppcentral.service.BillingService;
import com.example.ocppcentral.service.ChargingTransactionService;
import com.example.ocppcentral.service.ChargingTransactionService.StopOutcome;
import com.example.ocppcentral.websocket.ChargePointSession;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StopTransactionHandlerTest {

    @Mock
    private ChargingTransactionService chargingTransactionService;

    @Mock
    private BillingService billingService;

    @Mock
    private ChargePointSession session;

    @InjectMocks
    private StopTransactionHandler handler;

    @Test
    void testHandle_StoppedTransactionIsAcceptedAndBilled() {
        when(chargingTransactionService.stopTransaction(42L, 12000, "Local")).thenReturn(StopOutcome.STOPPED);

        StopTransactionResponse response = (StopTransactionResponse) handler.handle(session, request(42L, 12000));

        assertThat(response.getIdTagInfo().getStatus()).isEqualTo(AuthorizationStatus.ACCEPTED);
        verify(billingService).processTransactionBillingAsync(42L);
    }

    @Test
    void testHandle_DuplicateStopIsAcceptedWithoutBilling() {
        when(chargingTransactionService.stopTransaction(42L, 12000, "Local")).thenReturn(StopOutcome.ALREADY_FINISHED);

        StopTransactionResponse response = (StopTransactionResponse) handler.handle(session, request(42L, 12000));

        assertThat(response.getIdTagInfo().getStatus()).isEqualTo(AuthorizationStatus.ACCEPTED);
        verify(billingService, never()).processTransactionBillingAsync(anyLong());
    }

    @Test
    void testHandle_UnknownTransactionIsInvalid() {
        when(chargingTransactionService.stopTransaction(42L, 12000, "Local")).thenReturn(StopOutcome.NOT_FOUND);

        StopTransactionResponse response = (StopTransactionResponse) handler.handle(session, request(42L, 12000));

        assertThat(response.getIdTagInfo().getStatus()).isEqualTo(AuthorizationStatus.INVALID);
        verify(billingService, never()).processTransactionBillingAsync(anyLong());
    }

    @Test
    void testHandle_MissingMeterStopIsInvalid() {
        StopTransactionResponse response = (StopTransactionResponse) handler.handle(session, request(42L, null));

        assertThat(response.getIdTagInfo().getStatus()).isEqualTo(AuthorizationStatus.INVALID);
    }

    @Test
    void testHandle_StoreFailureIsInvalid() {
        when(chargingTransactionService.stopTransaction(42L, 12000, "Local")).thenThrow(new IllegalStateException("db down"));

        StopTransactionResponse response = (StopTransactionResponse) handler.handle(session, request(42L, 12000));

        assertThat(response.getIdTagInfo().getStatus()).isEqualTo(AuthorizationStatus.INVALID);
    }

    private static StopTransactionRequest request(Long transactionId, Integer meterStop) {
        StopTransactionRequest request = new StopTransactionRequest();
        request.setTransactionId(transactionId);
        request.setMeterStop(meterStop);
        request.setReason("Local");
        return request;
    }
}
