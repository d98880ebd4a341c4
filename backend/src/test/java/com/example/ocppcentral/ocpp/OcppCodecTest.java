package com.example.ocppcentral.ocpp;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OcppCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final OcppCodec codec = new OcppCodec(objectMapper);

    @Test
    void testDecode_Call() throws Exception {
        OcppFrame frame = codec.decode("[2,\"19223201\",\"BootNotification\",{\"chargePointVendor\":\"VendorX\"}]");

        assertThat(frame).isInstanceOf(Call.class);
        Call call = (Call) frame;
        assertThat(call.getUniqueId()).isEqualTo("19223201");
        assertThat(call.getAction()).isEqualTo("BootNotification");
        assertThat(call.getPayload().get("chargePointVendor").asText()).isEqualTo("VendorX");
    }

    @Test
    void testDecode_CallResult() throws Exception {
        OcppFrame frame = codec.decode("[3,\"42\",{\"status\":\"Accepted\"}]");

        assertThat(frame).isInstanceOf(CallResult.class);
        assertThat(frame.getMessageType()).isEqualTo(MessageType.CALL_RESULT);
        assertThat(((CallResult) frame).getPayload().get("status").asText()).isEqualTo("Accepted");
    }

    @Test
    void testDecode_CallErrorWithoutDescriptionOrDetails() throws Exception {
        OcppFrame frame = codec.decode("[4,\"42\",\"NotImplemented\"]");

        CallError error = (CallError) frame;
        assertThat(error.getErrorCode()).isEqualTo("NotImplemented");
        assertThat(error.getErrorDescription()).isEmpty();
        assertThat(error.getDetails().isObject()).isTrue();
        assertThat(error.getDetails().size()).isZero();
    }

    @Test
    void testDecode_NotAnArray() {
        assertThatThrownBy(() -> codec.decode("{\"hello\":1}"))
                .isInstanceOf(MalformedFrameException.class)
                .satisfies(e -> assertThat(((MalformedFrameException) e).hasUniqueId()).isFalse());
    }

    @Test
    void testDecode_InvalidJson() {
        assertThatThrownBy(() -> codec.decode("[2,\"1\","))
                .isInstanceOf(MalformedFrameException.class);
    }

    @Test
    void testDecode_UnknownMessageTypeKeepsUniqueId() {
        assertThatThrownBy(() -> codec.decode("[7,\"abc\",{}]"))
                .isInstanceOf(MalformedFrameException.class)
                .satisfies(e -> assertThat(((MalformedFrameException) e).getUniqueId()).isEqualTo("abc"));
    }

    @Test
    void testDecode_CallWithoutPayload() {
        assertThatThrownBy(() -> codec.decode("[2,\"abc\",\"Heartbeat\"]"))
                .isInstanceOf(MalformedFrameException.class)
                .satisfies(e -> assertThat(((MalformedFrameException) e).getUniqueId()).isEqualTo("abc"));
    }

    @Test
    void testDecode_NonStringUniqueId() {
        assertThatThrownBy(() -> codec.decode("[2,5,\"Heartbeat\",{}]"))
                .isInstanceOf(MalformedFrameException.class)
                .satisfies(e -> assertThat(((MalformedFrameException) e).hasUniqueId()).isFalse());
    }

    @Test
    void testEncode_CallWithNullPayloadUsesEmptyObject() {
        String raw = codec.encode(new Call("1", "Heartbeat", null));

        assertThat(raw).isEqualTo("[2,\"1\",\"Heartbeat\",{}]");
    }

    @Test
    void testEncodeThenDecode_PreservesCallError() throws Exception {
        CallError original = new CallError("9", "FormationViolation", "bad payload", objectMapper.createObjectNode());

        OcppFrame decoded = codec.decode(codec.encode(original));

        assertThat(decoded).isEqualTo(original);
    }

    @Test
    void testDecodeThenEncode_ReproducesRawFrames() throws Exception {
        String call = "[2,\"19223201\",\"MeterValues\",{\"connectorId\":1,\"transactionId\":10,"
                + "\"meterValue\":[{\"timestamp\":\"2024-05-01T12:00:00Z\",\"sampledValue\":[{\"value\":\"1500\"}]}]}]";
        String callResult = "[3,\"42\",{\"status\":\"Accepted\"}]";
        String arrayPayload = "[3,\"43\",[1,\"two\",{\"three\":3}]]";
        String callError = "[4,\"44\",\"NotSupported\",\"no firmware updates\",{\"reason\":\"x\"}]";

        assertThat(codec.encode(codec.decode(call))).isEqualTo(call);
        assertThat(codec.encode(codec.decode(callResult))).isEqualTo(callResult);
        assertThat(codec.encode(codec.decode(arrayPayload))).isEqualTo(arrayPayload);
        assertThat(codec.encode(codec.decode(callError))).isEqualTo(callError);
    }

    @Test
    void testDecode_CallResultWithArrayPayload() throws Exception {
        CallResult result = (CallResult) codec.decode("[3,\"43\",[1,2]]");

        assertThat(result.getPayload().isArray()).isTrue();
        assertThat(result.getPayload().size()).isEqualTo(2);
    }

    @Test
    void testCorrelationIdOf() {
        assertThat(codec.correlationIdOf("[3,\"77\",{}]")).isEqualTo("77");
        assertThat(codec.correlationIdOf("not json")).isNull();
        assertThat(codec.correlationIdOf("[2]")).isNull();
        assertThat(codec.correlationIdOf(null)).isNull();
    }
}
