package com.blockflow.blockflow_backend.config;

import com.blockflow.blockflow_backend.engine.RedisWebSocketBridge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Logs at startup whether run updates are relayed through Redis or only delivered to clients
 * of this instance.
 */
@Slf4j
@Component
public class RedisStartupLogger implements ApplicationRunner {

    private final Environment env;
    private final ObjectProvider<RedisWebSocketBridge> bridgeProvider;

    public RedisStartupLogger(Environment env, ObjectProvider<RedisWebSocketBridge> bridgeProvider) {
        this.env = env;
        this.bridgeProvider = bridgeProvider;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (bridgeProvider.getIfAvailable() != null) {
            log.info("Redis available, execution updates relayed on channel {}", RedisWebSocketBridge.REDIS_CHANNEL);
            return;
        }
        String redisUrl = env.getProperty("spring.data.redis.url", "");
        String reason = redisUrl.isEmpty()
                ? "spring.data.redis.url not set"
                : "relay bean missing although a Redis URL is configured";
        log.warn("Execution updates delivered to this instance only. Reason: {}", reason);
    }
}
