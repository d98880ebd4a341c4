package com.example.ocppcentral.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ForceStopRequest {

    @NotBlank(message = "reason is required")
    private String reason;
}
