package com.blockflow.blockflow_backend.engine;

import com.blockflow.blockflow_backend.engine.state.RunStatus;
import com.blockflow.blockflow_backend.executor.NotificationSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pushes run progress and notifications to the editor over STOMP, through Redis when the
 * bridge is present.
 */
@Slf4j
@Component
public class ExecutionEventPublisher implements NotificationSink {

    // Editor subscribes to /topic/execution/{workflowId} for block status
    private static final String EXECUTION_TOPIC = "/topic/execution/";
    private static final String NOTIFICATION_TOPIC = "/topic/notifications/";

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectProvider<RedisWebSocketBridge> redisBridgeProvider;

    public ExecutionEventPublisher(SimpMessagingTemplate messagingTemplate,
                                   ObjectProvider<RedisWebSocketBridge> redisBridgeProvider) {
        this.messagingTemplate = messagingTemplate;
        this.redisBridgeProvider = redisBridgeProvider;
    }

    public void blockStarted(String workflowId, String executionId, String blockId) {
        publishBlock(workflowId, executionId, blockId, RunStatus.RUNNING, null);
    }

    public void blockCompleted(String workflowId, String executionId, String blockId) {
        publishBlock(workflowId, executionId, blockId, RunStatus.SUCCESS, null);
    }

    public void blockError(String workflowId, String executionId, String blockId, String error) {
        publishBlock(workflowId, executionId, blockId, RunStatus.ERROR, error);
    }

    /** Final state of a run: completed, error or cancelled. */
    public void executionFinished(String workflowId, String executionId, String outcome, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("executionId", executionId != null ? executionId : "");
        payload.put("event", "execution");
        payload.put("status", outcome);
        payload.put("error", error != null ? error : "");
        send(EXECUTION_TOPIC + workflowId, payload);
    }

    @Override
    public void notify(String workflowId, String level, String message) {
        log.info("Notification for workflow {} [{}]: {}", workflowId, level, message);
        send(NOTIFICATION_TOPIC + workflowId, Map.of("level", level, "message", message));
    }

    private void publishBlock(String workflowId, String executionId, String blockId, RunStatus status, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("executionId", executionId != null ? executionId : "");
        payload.put("event", "block");
        payload.put("blockId", blockId);
        payload.put("status", status.json());
        payload.put("error", error != null ? error : "");
        send(EXECUTION_TOPIC + workflowId, payload);
    }

    private void send(String destination, Map<String, Object> payload) {
        RedisWebSocketBridge bridge = redisBridgeProvider.getIfAvailable();
        log.debug("Publishing to {} via {}", destination, bridge != null ? "Redis" : "Direct");
        if (bridge != null) {
            bridge.publish(destination, payload);
        } else {
            messagingTemplate.convertAndSend(destination, payload);
        }
    }
}
