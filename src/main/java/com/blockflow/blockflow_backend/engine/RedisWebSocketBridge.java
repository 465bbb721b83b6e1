package com.blockflow.blockflow_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Fans editor updates out through Redis Pub/Sub so that a client connected to any instance
 * sees the run, wherever it executes. Registered by {@code RedisWebSocketConfig} only when
 * Redis is available.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisWebSocketBridge implements MessageListener {

    public static final String REDIS_CHANNEL = "blockflow:websocket:topic";

    private final StringRedisTemplate redisTemplate;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;

    public void publish(String destination, Map<String, Object> payload) {
        try {
            String json = objectMapper.writeValueAsString(new RelayedMessage(destination, payload));
            log.debug("Relaying {} via Redis channel {}", destination, REDIS_CHANNEL);
            redisTemplate.convertAndSend(REDIS_CHANNEL, json);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize WebSocket message for {}", destination, e);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        try {
            RelayedMessage relayed = objectMapper.readValue(
                    new String(message.getBody(), StandardCharsets.UTF_8), RelayedMessage.class);
            if (relayed.destination() == null || !relayed.destination().startsWith("/topic/")) {
                log.warn("Dropping relayed message without a topic destination: {}", relayed.destination());
                return;
            }
            messagingTemplate.convertAndSend(relayed.destination(), relayed.payload() != null ? relayed.payload() : Map.of());
        } catch (Exception e) {
            log.error("Failed to forward Redis message to WebSocket", e);
        }
    }

    record RelayedMessage(String destination, Map<String, Object> payload) {}
}
