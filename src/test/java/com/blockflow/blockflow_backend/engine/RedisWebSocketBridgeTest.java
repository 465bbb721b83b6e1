package com.blockflow.blockflow_backend.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisWebSocketBridgeTest {

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private SimpMessagingTemplate messagingTemplate;
    @Mock
    private Message message;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RedisWebSocketBridge bridge;

    @BeforeEach
    void setUp() {
        bridge = new RedisWebSocketBridge(redisTemplate, messagingTemplate, objectMapper);
    }

    @Test
    void publishWrapsDestinationAndPayload() throws Exception {
        bridge.publish("/topic/execution/wf", Map.of("blockId", "b1", "status", "success"));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(redisTemplate).convertAndSend(eq(RedisWebSocketBridge.REDIS_CHANNEL), json.capture());
        RedisWebSocketBridge.RelayedMessage relayed =
                objectMapper.readValue(json.getValue(), RedisWebSocketBridge.RelayedMessage.class);
        assertThat(relayed.destination()).isEqualTo("/topic/execution/wf");
        assertThat(relayed.payload()).containsEntry("blockId", "b1");
    }

    @Test
    void relayedMessageIsForwardedToStomp() {
        when(message.getBody()).thenReturn(
                "{\"destination\":\"/topic/execution/wf\",\"payload\":{\"status\":\"running\"}}"
                        .getBytes(StandardCharsets.UTF_8));

        bridge.onMessage(message, null);

        verify(messagingTemplate).convertAndSend("/topic/execution/wf", (Object) Map.of("status", "running"));
    }

    @Test
    void malformedRelayIsDropped() {
        when(message.getBody()).thenReturn("not json".getBytes(StandardCharsets.UTF_8));

        bridge.onMessage(message, null);

        verify(messagingTemplate, never()).convertAndSend(anyString(), any(Object.class));
    }
}
