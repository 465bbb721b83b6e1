package com.blockflow.blockflow_backend.executor;

import com.blockflow.blockflow_backend.config.BlockflowProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Talks to the executor over HTTP and reads its answer as a server-sent event stream.
 * One channel per workflow can be open at a time; {@link #cancel(String)} closes it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpExecutionStreamClient implements ExecutionStreamClient {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ExecutionEventDecoder decoder;
    private final BlockflowProperties properties;

    private final Map<String, Channel> openChannels = new ConcurrentHashMap<>();

    @Override
    public void execute(ExecuteRequest request, ExecutionEventListener listener) {
        String url = properties.getExecutor().getBaseUrl() + "/api/workflows/" + request.workflowId() + "/execute";
        stream(request.workflowId(), url, request, listener);
    }

    @Override
    public void executeFromBlock(ExecuteFromBlockRequest request, ExecutionEventListener listener) {
        String url = properties.getExecutor().getBaseUrl() + "/api/workflows/" + request.workflowId() + "/execute-from-block";
        stream(request.workflowId(), url, request, listener);
    }

    @Override
    public void cancel(String workflowId) {
        Channel channel = openChannels.get(workflowId);
        if (channel == null) {
            log.debug("No open execution channel for workflow {}", workflowId);
            return;
        }
        channel.cancelled.set(true);
        Stream<String> lines = channel.lines;
        if (lines != null) {
            lines.close();
        }
        log.info("Closed execution channel for workflow {}", workflowId);
    }

    private void stream(String workflowId, String url, Object body, ExecutionEventListener listener) {
        Channel channel = new Channel();
        openChannels.put(workflowId, channel);
        try {
            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Content-Type", "application/json")
                    .header("Accept", "text/event-stream")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();

            HttpResponse<Stream<String>> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofLines());
            if (response.statusCode() != 200) {
                String detail = readQuietly(response.body());
                log.error("Executor answered HTTP {} for {}", response.statusCode(), url);
                throw new ExecutionTransportException("Executor error " + response.statusCode() + ": " + detail,
                        url, response.statusCode());
            }
            channel.lines = response.body();
            if (channel.cancelled.get()) {
                channel.lines.close();
                throw new ExecutionAbortedException(workflowId);
            }
            readEvents(workflowId, url, channel, listener);
        } catch (JsonProcessingException e) {
            throw new ExecutionTransportException("Could not serialize execute request", url, e);
        } catch (IOException | UncheckedIOException e) {
            if (channel.cancelled.get()) throw new ExecutionAbortedException(workflowId);
            throw new ExecutionTransportException("Request to " + url + " failed: " + e.getMessage(), url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionAbortedException(workflowId);
        } finally {
            openChannels.remove(workflowId, channel);
            if (channel.lines != null) channel.lines.close();
        }
    }

    private void readEvents(String workflowId, String url, Channel channel, ExecutionEventListener listener) {
        Iterator<String> lines = channel.lines.iterator();
        boolean terminal = false;
        while (lines.hasNext()) {
            ExecutionEventDecoder.Outcome outcome = decoder.dispatch(lines.next(), listener);
            if (outcome == ExecutionEventDecoder.Outcome.TERMINAL) terminal = true;
            if (outcome == ExecutionEventDecoder.Outcome.DONE) break;
        }
        if (channel.cancelled.get()) {
            throw new ExecutionAbortedException(workflowId);
        }
        if (!terminal) {
            throw new ExecutionTransportException("Execution stream ended without a terminal event", url, (Integer) null);
        }
    }

    private static String readQuietly(Stream<String> body) {
        try (body) {
            return String.join("\n", body.limit(20).toList());
        } catch (UncheckedIOException e) {
            return e.getMessage();
        }
    }

    private static final class Channel {
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private volatile Stream<String> lines;
    }
}
