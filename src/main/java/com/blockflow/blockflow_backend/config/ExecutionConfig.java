package com.blockflow.blockflow_backend.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Clients for the executor and log endpoints, and the pools behind chat runs. */
@Configuration
public class ExecutionConfig {

    @Bean
    public HttpClient executorHttpClient(BlockflowProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getExecutor().getConnectTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, BlockflowProperties properties) {
        return builder
                .setConnectTimeout(properties.getExecutor().getConnectTimeout())
                .build();
    }

    // A drain task holds its thread until the block's stream closes, so every open stream needs its own
    @Bean(name = "streamDrainExecutor", destroyMethod = "shutdownNow")
    public ExecutorService streamDrainExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("chat-stream-drain-"));
    }

    // Chat runs block on the executor stream while the SSE response stays open
    @Bean(name = "chatRunExecutor", destroyMethod = "shutdownNow")
    public ExecutorService chatRunExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("chat-run-"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
