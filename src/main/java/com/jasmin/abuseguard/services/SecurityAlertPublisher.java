package com.jasmin.abuseguard.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jasmin.abuseguard.models.SecurityAlert;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/** Publishes alerts as JSON on a Redis pub/sub channel. */
@RequiredArgsConstructor
public class SecurityAlertPublisher implements AlertDispatcher {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final AlertProperties props;

    @Override
    public void dispatch(SecurityAlert alert) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", alert.getType());
        payload.put("severity", alert.getSeverity());
        payload.put("subject", alert.getSubject());
        payload.put("details", alert.getDetails());
        payload.put("timestamp", alert.getTimestamp().toString());

        try {
            String alertJson = objectMapper.writeValueAsString(payload);
            redisTemplate.convertAndSend(props.getRedisChannel(), alertJson);
        } catch (JsonProcessingException | DataAccessException e) {
            throw new AlertDeliveryException("Failed to publish alert " + alert.getType(), e);
        }
    }
}
