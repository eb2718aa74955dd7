package com.jasmin.abuseguard.services;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "abuse-guard.alerts")
public class AlertProperties {

    public enum Channel { REDIS, LOG }

    @NotNull
    private Channel channel = Channel.REDIS;

    /** Redis pub/sub channel alerts are published on. */
    @NotBlank
    private String redisChannel = "security:alerts";
}
