package com.blockflow.blockflow_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under the {@code blockflow.*} prefix in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "blockflow")
public class BlockflowProperties {

    private Execution execution = new Execution();
    private Executor executor = new Executor();
    private Logs logs = new Logs();
    private Identity identity = new Identity();

    @Data
    public static class Execution {
        /** Safety bound on debug resume steps. */
        private int resumeMaxIterations = 500;
    }

    @Data
    public static class Executor {
        private String baseUrl = "http://localhost:3002";
        private Duration connectTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Logs {
        private String baseUrl = "http://localhost:8080";
    }

    @Data
    public static class Identity {
        private double duplicateOffsetX = 50;
        private double duplicateOffsetY = 50;
        // Paste offsets larger than this inside an existing container are treated as viewport jumps
        private double maxContainedOffset = 200;
    }
}
