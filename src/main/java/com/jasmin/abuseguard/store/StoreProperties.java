package com.jasmin.abuseguard.store;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "abuse-guard.store")
public class StoreProperties {

    public enum StoreType { REDIS, MEMORY }

    /** Where counters, penalties and blocks live. MEMORY is for single-process and test runs. */
    @NotNull
    private StoreType type = StoreType.REDIS;

    /** Prefix for every key the engine writes. */
    @NotBlank
    private String keyPrefix = "ag";
}
