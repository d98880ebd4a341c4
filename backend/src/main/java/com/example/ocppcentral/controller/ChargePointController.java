package com.example.ocppcentral.controller;

import com.example.ocppcentral.dto.ChargePointConnection;
import com.example.ocppcentral.dto.RawCommandRequest;
import com.example.ocppcentral.service.ChargePointCommandService;
import com.example.ocppcentral.service.ChargePointSessionManager;
import com.example.ocppcentral.service.ConnectionRegistry;
import com.example.ocppcentral.websocket.ChargePointSession;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/charge-points")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@Tag(name = "Charge points", description = "Connected charge points and raw OCPP requests")
public class ChargePointController {

    private final ConnectionRegistry connectionRegistry;
    private final ChargePointSessionManager sessionManager;
    private final ChargePointCommandService commandService;

    @GetMapping
    @Operation(summary = "List charge points recorded as connected across all instances")
    public List<ChargePointConnection> listConnected() {
        List<ChargePointConnection> connections = new ArrayList<>();
        for (String chargePointId : connectionRegistry.listAll()) {
            Optional<ChargePointSession> session = sessionManager.get(chargePointId);
            connections.add(new ChargePointConnection(
                    chargePointId,
                    connectionRegistry.connectedAt(chargePointId).orElse(null),
                    session.map(ChargePointSession::getLastSeen).orElse(null),
                    session.isPresent()));
        }
        connections.sort(Comparator.comparing(ChargePointConnection::getChargePointId));
        return connections;
    }

    @GetMapping("/{chargePointId}/connected")
    @Operation(summary = "Whether this instance holds an active session for the charge point")
    public Map<String, Object> isConnected(@PathVariable String chargePointId) {
        return Map.of("chargePointId", chargePointId, "connected", sessionManager.isConnected(chargePointId));
    }

    @PostMapping("/{chargePointId}/request")
    @Operation(summary = "Send a raw OCPP call and wait for the reply")
    public CompletableFuture<ResponseEntity<Object>> sendRequest(
            @PathVariable String chargePointId,
            @Valid @RequestBody RawCommandRequest request) {
        return commandService.sendRaw(chargePointId, request.getAction(), request.getPayload())
                .thenApply(CommandResponses::toResponse)
                .exceptionally(CommandResponses::failure);
    }
}
