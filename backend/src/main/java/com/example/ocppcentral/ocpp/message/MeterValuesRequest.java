package com.example.ocppcentral.ocpp.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MeterValuesRequest {
    private Integer connectorId;
    private Long transactionId;
    private List<MeterValueEntry> meterValue = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MeterValueEntry {
        private String timestamp;
        private List<SampledValue> sampledValue = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SampledValue {
        private String value;
        private String context;
        private String format;
        private String measurand;
        private String phase;
        private String location;
        private String unit;
    }
}
