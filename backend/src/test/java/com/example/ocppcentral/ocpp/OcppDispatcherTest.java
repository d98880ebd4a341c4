package com.example.ocppcentral.ocpp;

import com.example.ocppcentral.ocpp.message.HeartbeatRequest;
import com.example.ocppcentral.ocpp.message.StartTransactionRequest;
import com.example.ocppcentral.websocket.ChargePointSession;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(MockitoExtension.class)
class OcppDispatcherTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final OcppCodec codec = new OcppCodec(objectMapper);

    @Mock
    private ChargePointSession session;

    @Test
    void testDispatch_RoutesToHandlerAndWrapsResult() throws Exception {
        OcppDispatcher dispatcher = new OcppDispatcher(codec, List.of(new StubHeartbeatHandler()));

        OcppFrame reply = dispatcher.dispatch(session, call("h1", "Heartbeat", "{}"));

        assertThat(reply).isInstanceOf(CallResult.class);
        assertThat(reply.getUniqueId()).isEqualTo("h1");
        assertThat(((CallResult) reply).getPayload().get("currentTime").asText()).isEqualTo("2024-05-01T12:00:00Z");
    }

    @Test
    void testDispatch_UnknownActionGetsEmptyResult() throws Exception {
        OcppDispatcher dispatcher = new OcppDispatcher(codec, List.of(new StubHeartbeatHandler()));

        OcppFrame reply = dispatcher.dispatch(session, call("x1", "DataTransfer", "{\"vendorId\":\"acme\"}"));

        assertThat(reply).isInstanceOf(CallResult.class);
        assertThat(((CallResult) reply).getPayload().size()).isZero();
    }

    @Test
    void testDispatch_KnownActionWithoutHandlerGetsEmptyResult() throws Exception {
        OcppDispatcher dispatcher = new OcppDispatcher(codec, List.of(new StubHeartbeatHandler()));

        OcppFrame reply = dispatcher.dispatch(session, call("m1", "MeterValues", "{}"));

        assertThat(reply).isInstanceOf(CallResult.class);
    }

    @Test
    void testDispatch_InvalidPayloadIsFormationViolation() throws Exception {
        OcppDispatcher dispatcher = new OcppDispatcher(codec, List.of(new FailingStartHandler()));

        OcppFrame reply = dispatcher.dispatch(session,
                call("s1", "StartTransaction", "{\"connectorId\":\"not-a-number\",\"idTag\":\"RFID\"}"));

        assertThat(reply).isInstanceOf(CallError.class);
        assertThat(((CallError) reply).getErrorCode()).isEqualTo("FormationViolation");
    }

    @Test
    void testDispatch_NullPayloadIsFormationViolation() throws Exception {
        OcppDispatcher dispatcher = new OcppDispatcher(codec, List.of(new StubHeartbeatHandler()));

        OcppFrame reply = dispatcher.dispatch(session, call("h2", "Heartbeat", "null"));

        assertThat(((CallError) reply).getErrorCode()).isEqualTo("FormationViolation");
    }

    @Test
    void testDispatch_HandlerExceptionIsInternalError() throws Exception {
        OcppDispatcher dispatcher = new OcppDispatcher(codec, List.of(new FailingStartHandler()));

        OcppFrame reply = dispatcher.dispatch(session, call("s2", "StartTransaction", "{\"connectorId\":1,\"idTag\":\"RFID\"}"));

        assertThat(reply).isInstanceOf(CallError.class);
        assertThat(((CallError) reply).getErrorCode()).isEqualTo("InternalError");
        assertThat(reply.getUniqueId()).isEqualTo("s2");
    }

    @Test
    void testConstructor_DuplicateHandlersAreRejected() {
        assertThatThrownBy(() -> new OcppDispatcher(codec, List.of(new StubHeartbeatHandler(), new StubHeartbeatHandler())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Heartbeat");
    }

    private Call call(String uniqueId, String action, String payload) throws Exception {
        return new Call(uniqueId, action, objectMapper.readTree(payload));
    }

    static class StubHeartbeatHandler implements OcppRequestHandler<HeartbeatRequest> {

        @Override
        public OcppAction getAction() {
            return OcppAction.HEARTBEAT;
        }

        @Override
        public Class<HeartbeatRequest> getRequestType() {
            return HeartbeatRequest.class;
        }

        @Override
        public Object handle(ChargePointSession session, HeartbeatRequest request) {
            return Map.of("currentTime", "2024-05-01T12:00:00Z");
        }
    }

    static class FailingStartHandler implements OcppRequestHandler<StartTransactionRequest> {

        @Override
        public OcppAction getAction() {
            return OcppAction.START_TRANSACTION;
        }

        @Override
        public Class<StartTransactionRequest> getRequestType() {
            return StartTransactionRequest.class;
        }

        @Override
        public Object handle(ChargePointSession session, StartTransactionRequest request) {
            throw new IllegalStateException("database unavailable");
        }
    }
}
