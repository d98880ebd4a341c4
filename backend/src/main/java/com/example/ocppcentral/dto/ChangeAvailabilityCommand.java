package com.example.ocppcentral.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChangeAvailabilityCommand {

    /**
     * 0 addresses the whole charge point.
     */
    @PositiveOrZero
    private int connectorId;

    @NotBlank(message = "type is required")
    private String type;
}
