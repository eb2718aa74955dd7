package com.jasmin.abuseguard.models;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class RateLimitCheckRequest {
    @NotBlank
    private String identifier;

    @NotBlank
    private String action;

    // optional overrides of the configured rule
    @Min(0)
    private Integer limit;

    @Positive
    private Long windowSeconds;
}
