package com.example.ocppcentral.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RawCommandRequest {

    @NotBlank(message = "action is required")
    private String action;

    private Object payload;
}
