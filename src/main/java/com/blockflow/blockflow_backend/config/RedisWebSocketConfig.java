package com.blockflow.blockflow_backend.config;

import com.blockflow.blockflow_backend.engine.RedisWebSocketBridge;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Relays run events between instances over Redis pub/sub. Only wired when
 * {@code spring.data.redis.url} is set; otherwise editors see runs of their own instance only.
 */
@Configuration
@ConditionalOnProperty(prefix = "spring.data.redis", name = "url")
public class RedisWebSocketConfig {

    @Bean
    public RedisWebSocketBridge redisWebSocketBridge(StringRedisTemplate redisTemplate,
                                                     SimpMessagingTemplate messagingTemplate,
                                                     ObjectMapper objectMapper) {
        return new RedisWebSocketBridge(redisTemplate, messagingTemplate, objectMapper);
    }

    @Bean
    public RedisMessageListenerContainer executionRelayListenerContainer(RedisConnectionFactory connectionFactory,
                                                                        RedisWebSocketBridge bridge) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(bridge, ChannelTopic.of(RedisWebSocketBridge.REDIS_CHANNEL));
        return container;
    }
}
