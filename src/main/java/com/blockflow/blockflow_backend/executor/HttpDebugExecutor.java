package com.blockflow.blockflow_backend.executor;

import com.blockflow.blockflow_backend.config.BlockflowProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Steps a paused debug session through the executor's continue endpoint. */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpDebugExecutor implements DebugExecutor {

    private final RestTemplate restTemplate;
    private final BlockflowProperties properties;

    @Override
    public ExecutionResult continueExecution(List<String> pendingBlocks, DebugContext context) {
        String url = properties.getExecutor().getBaseUrl()
                + "/api/workflows/" + context.getWorkflowId() + "/debug/continue";

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pendingBlocks", pendingBlocks);
        body.put("context", context);
        try {
            ExecutionResult result = restTemplate.postForObject(url, body, ExecutionResult.class);
            if (result == null) {
                throw new ExecutionTransportException("Executor returned an empty debug result", url, (Integer) null);
            }
            return result;
        } catch (RestClientException e) {
            log.error("Debug continue call to {} failed", url, e);
            throw new ExecutionTransportException("Request to " + url + " failed: " + e.getMessage(), url, e);
        }
    }
}
