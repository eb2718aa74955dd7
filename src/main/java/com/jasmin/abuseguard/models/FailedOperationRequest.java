package com.jasmin.abuseguard.models;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class FailedOperationRequest {
    @NotBlank
    private String accountId;

    @NotBlank
    private String action;

    private String details;
}
