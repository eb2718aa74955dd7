package com.jasmin.abuseguard.models;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class LoginEventRequest {
    private String username;

    @NotBlank
    private String networkOrigin;
}
