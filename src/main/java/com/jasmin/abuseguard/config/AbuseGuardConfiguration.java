package com.jasmin.abuseguard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jasmin.abuseguard.detectors.DetectorUtils;
import com.jasmin.abuseguard.detectors.bruteforcedetector.AccountResolver;
import com.jasmin.abuseguard.services.AlertDispatcher;
import com.jasmin.abuseguard.services.AlertProperties;
import com.jasmin.abuseguard.services.LoggingAlertDispatcher;
import com.jasmin.abuseguard.services.SecurityAlertPublisher;
import com.jasmin.abuseguard.store.InMemorySecurityStore;
import com.jasmin.abuseguard.store.RedisSecurityStore;
import com.jasmin.abuseguard.store.SecurityStore;
import com.jasmin.abuseguard.store.StoreProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.util.Optional;

@Configuration
public class AbuseGuardConfiguration {

    /** The single time source every component reads "now" from. */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public SecurityStore securityStore(StoreProperties props, ObjectProvider<StringRedisTemplate> redis, Clock clock) {
        return switch (props.getType()) {
            case REDIS -> new RedisSecurityStore(redis.getObject());
            case MEMORY -> new InMemorySecurityStore(clock);
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertDispatcher alertDispatcher(AlertProperties props, ObjectProvider<StringRedisTemplate> redis,
                                           ObjectMapper objectMapper) {
        return switch (props.getChannel()) {
            case REDIS -> new SecurityAlertPublisher(redis.getObject(), objectMapper, props);
            case LOG -> new LoggingAlertDispatcher();
        };
    }

    /**
     * Treats every non-blank login name as its own account id. Host applications with a user
     * directory replace this bean so unknown usernames resolve to empty.
     */
    @Bean
    @ConditionalOnMissingBean
    public AccountResolver accountResolver() {
        return username -> Optional.ofNullable(DetectorUtils.normalizeValue(username));
    }
}
