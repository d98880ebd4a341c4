package com.example.ocppcentral.websocket;

import com.example.ocppcentral.ocpp.OcppCodec;
import com.example.ocppcentral.ocpp.OcppDispatcher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;

@Component
public class ChargePointSessionFactory {

    private final OcppCodec codec;
    private final OcppDispatcher dispatcher;
    private final MessageAuditSink auditSink;
    private final ScheduledExecutorService timeoutScheduler;
    private final Clock clock;

    @Value("${app.ocpp.call-timeout:10s}")
    private Duration callTimeout;

    public ChargePointSessionFactory(OcppCodec codec,
                                     OcppDispatcher dispatcher,
                                     MessageAuditSink auditSink,
                                     @Qualifier("ocppCallTimeoutScheduler") ScheduledExecutorService timeoutScheduler,
                                     Clock clock) {
        this.codec = codec;
        this.dispatcher = dispatcher;
        this.auditSink = auditSink;
        this.timeoutScheduler = timeoutScheduler;
        this.clock = clock;
    }

    public ChargePointSession create(String chargePointId, OcppTransport transport) {
        return new ChargePointSession(chargePointId, transport, codec, dispatcher, auditSink,
                timeoutScheduler, callTimeout, clock);
    }
}
