package com.example.ocppcentral.service;

import com.example.ocppcentral.model.MeterValue;
import com.example.ocppcentral.ocpp.message.MeterValuesRequest;
import com.example.ocppcentral.repository.ChargingTransactionRepository;
import com.example.ocppcentral.repository.MeterValueRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Stores MeterValues samples. One row per sampled timestamp that carries an energy reading.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeterValueService {

    static final String ENERGY = "Energy.Active.Import.Register";
    static final String CURRENT = "Current.Import";
    static final String VOLTAGE = "Voltage";
    static final String POWER = "Power.Active.Import";

    private final MeterValueRepository meterValueRepository;
    private final ChargingTransactionRepository transactionRepository;
    private final Clock clock;

    @Transactional
    public int recordMeterValues(String chargePointId, MeterValuesRequest request) {
        Long transactionId = request.getTransactionId();
        if (transactionId == null) {
            log.warn("MeterValues from {} without transactionId, discarding", chargePointId);
            return 0;
        }
        if (!transactionRepository.existsById(transactionId)) {
            log.error("MeterValues from {} for unknown transaction {}", chargePointId, transactionId);
            return 0;
        }

        int stored = 0;
        for (MeterValuesRequest.MeterValueEntry entry : request.getMeterValue()) {
            MeterValue meterValue = toMeterValue(transactionId, entry);
            if (meterValue == null) {
                log.debug("No energy reading at {} for transaction {}", entry.getTimestamp(), transactionId);
                continue;
            }
            meterValueRepository.save(meterValue);
            stored++;
        }
        log.info("Stored {} meter values for transaction {} from {}", stored, transactionId, chargePointId);
        return stored;
    }

    MeterValue toMeterValue(Long transactionId, MeterValuesRequest.MeterValueEntry entry) {
        Double energyKwh = null;
        Double currentA = null;
        Double voltageV = null;
        Double powerKw = null;

        List<MeterValuesRequest.SampledValue> samples = entry.getSampledValue();
        if (samples != null) {
            for (MeterValuesRequest.SampledValue sample : samples) {
                if (sample.getValue() == null || sample.getValue().isBlank()) {
                    continue;
                }
                String measurand = sample.getMeasurand() == null ? ENERGY : sample.getMeasurand();
                double value;
                try {
                    value = Double.parseDouble(sample.getValue());
                } catch (NumberFormatException e) {
                    log.warn("Invalid {} value '{}' for transaction {}", measurand, sample.getValue(), transactionId);
                    continue;
                }
                switch (measurand) {
                    case ENERGY:
                        energyKwh = scale(value, sample.getUnit(), "Wh", "Wh");
                        break;
                    case CURRENT:
                        currentA = scale(value, sample.getUnit(), "A", "mA");
                        break;
                    case VOLTAGE:
                        voltageV = scale(value, sample.getUnit(), "V", "mV");
                        break;
                    case POWER:
                        powerKw = scale(value, sample.getUnit(), "W", "W");
                        break;
                    default:
                        log.debug("Ignoring measurand {}", measurand);
                }
            }
        }

        if (energyKwh == null) {
            return null;
        }
        return MeterValue.builder()
                .transactionId(transactionId)
                .readingKwh(energyKwh)
                .currentA(currentA)
                .voltageV(voltageV)
                .powerKw(powerKw)
                .createdAt(parseTimestamp(entry.getTimestamp()))
                .build();
    }

    // Wh->kWh, mA->A, mV->V, W->kW; a missing unit means the OCPP default
    private static double scale(double value, String unit, String defaultUnit, String thousandthUnit) {
        String effective = unit == null ? defaultUnit : unit;
        return effective.equals(thousandthUnit) ? value / 1000 : value;
    }

    private Instant parseTimestamp(String timestamp) {
        if (timestamp == null) {
            return clock.instant();
        }
        try {
            return Instant.parse(timestamp);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable meter value timestamp '{}', using server time", timestamp);
            return clock.instant();
        }
    }
}
