package com.blockflow.blockflow_backend.service;

import com.blockflow.blockflow_backend.config.BlockflowProperties;
import com.blockflow.blockflow_backend.engine.TraceSpanBuilder;
import com.blockflow.blockflow_backend.executor.ExecutionResult;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hands a finished run's result to the log endpoint. Fire-and-forget: failures are logged and
 * never reach the run that produced the result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LogPersistenceClient {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final BlockflowProperties properties;

    @Async
    public void persistLogs(String workflowId, String executionId, ExecutionResult result) {
        try {
            TraceSpanBuilder.Trace trace = TraceSpanBuilder.build(result.getLogs());
            Map<String, Object> enriched = new LinkedHashMap<>(objectMapper.convertValue(result, JSON_OBJECT));
            enriched.put("traceSpans", trace.traceSpans());
            enriched.put("totalDuration", trace.totalDuration());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("executionId", executionId);
            body.put("result", enriched);

            String url = properties.getLogs().getBaseUrl() + "/api/workflows/" + workflowId + "/log";
            restTemplate.postForEntity(url, body, Void.class);
            log.debug("Persisted logs of execution {} for workflow {}", executionId, workflowId);
        } catch (RestClientException | IllegalArgumentException e) {
            log.error("Error persisting logs for workflow {} execution {}", workflowId, executionId, e);
        }
    }
}
