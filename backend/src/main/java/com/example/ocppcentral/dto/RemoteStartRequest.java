package com.example.ocppcentral.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RemoteStartRequest {

    @PositiveOrZero
    private Integer connectorId;

    @NotBlank(message = "idTag is required")
    private String idTag;
}
