package com.jasmin.abuseguard.models;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ManualBlockRequest {
    @NotBlank
    private String identifier;

    private BlockScope scope;

    @Positive
    private long durationSeconds = 86_400;

    private String note;
}
