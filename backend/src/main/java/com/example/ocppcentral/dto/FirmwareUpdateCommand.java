package com.example.ocppcentral.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FirmwareUpdateCommand {

    @NotNull(message = "firmwareFileId is required")
    private Long firmwareFileId;

    @NotBlank(message = "location is required")
    private String location;

    private String version;
}
