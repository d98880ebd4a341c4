package com.example.ocppcentral.controller;

import com.example.ocppcentral.model.OcppLog;
import com.example.ocppcentral.service.MessageLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/logs")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@Validated
@Tag(name = "Logs", description = "OCPP message audit log")
public class LogController {

    private final MessageLogService messageLogService;

    @GetMapping
    @Operation(summary = "Most recent frames across all charge points")
    public List<OcppLog> recent(@RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        return messageLogService.recent(limit);
    }

    @GetMapping("/{chargePointId}")
    @Operation(summary = "Most recent frames for one charge point")
    public List<OcppLog> recentForChargePoint(@PathVariable String chargePointId,
                                              @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        return messageLogService.recentForChargePoint(chargePointId, limit);
    }
}
