package com.blockflow.blockflow_backend.engine;

import com.blockflow.blockflow_backend.config.BlockflowProperties;
import com.blockflow.blockflow_backend.console.ConsoleSink;
import com.blockflow.blockflow_backend.engine.state.ExecutionPhase;
import com.blockflow.blockflow_backend.engine.state.ExecutionStateStore;
import com.blockflow.blockflow_backend.engine.state.WorkflowExecutionState;
import com.blockflow.blockflow_backend.executor.DebugContext;
import com.blockflow.blockflow_backend.executor.DebugExecutor;
import com.blockflow.blockflow_backend.executor.ExecuteFromBlockRequest;
import com.blockflow.blockflow_backend.executor.ExecuteRequest;
import com.blockflow.blockflow_backend.executor.ExecutionAbortedException;
import com.blockflow.blockflow_backend.executor.ExecutionMetadata;
import com.blockflow.blockflow_backend.executor.ExecutionResult;
import com.blockflow.blockflow_backend.executor.ExecutionStreamClient;
import com.blockflow.blockflow_backend.executor.ExecutionTransportException;
import com.blockflow.blockflow_backend.executor.NotificationSink;
import com.blockflow.blockflow_backend.executor.event.ExecutionCompletedEvent;
import com.blockflow.blockflow_backend.executor.event.ExecutionErrorEvent;
import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;
import com.blockflow.blockflow_backend.service.LogPersistenceClient;
import com.blockflow.blockflow_backend.session.ActiveRun;
import com.blockflow.blockflow_backend.session.WorkflowSession;
import com.blockflow.blockflow_backend.session.WorkflowSessionRegistry;
import com.blockflow.blockflow_backend.snapshot.ExecutionSnapshot;
import com.blockflow.blockflow_backend.snapshot.RunAccumulator;
import com.blockflow.blockflow_backend.snapshot.SnapshotMerger;
import com.blockflow.blockflow_backend.trigger.ExecutionMode;
import com.blockflow.blockflow_backend.trigger.StartBlockCandidate;
import com.blockflow.blockflow_backend.trigger.StartBlockClassifier;
import com.blockflow.blockflow_backend.trigger.StartBlockPath;
import com.blockflow.blockflow_backend.trigger.TriggerPayloadBuilder;
import com.blockflow.blockflow_backend.trigger.TriggerResolution;
import com.blockflow.blockflow_backend.trigger.TriggerResolver;
import com.blockflow.blockflow_backend.trigger.WorkflowValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Runs workflows against the executor: full runs, run-until-block, run-from-block, debug step
 * and resume, and cancellation. Owns everything transient about a run and writes the
 * execution snapshot only when a run finalizes successfully.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionOrchestrator {

    static final String WORKFLOW_MODIFIED_MESSAGE =
            "Workflow was modified. Run the workflow again to enable running from block.";
    private static final List<String> STALE_SNAPSHOT_ERRORS =
            List.of("Block not found in workflow", "Upstream dependency not executed");

    private final WorkflowSessionRegistry sessions;
    private final TriggerResolver triggerResolver;
    private final StartBlockClassifier startBlockClassifier;
    private final TriggerPayloadBuilder payloadBuilder;
    private final RunFromBlockGate runFromBlockGate;
    private final ExecutionStateStore stateStore;
    private final ExecutionStateMachine stateMachine;
    private final ExecutionStreamClient streamClient;
    private final DebugExecutor debugExecutor;
    private final BlockEventHandlerFactory handlerFactory;
    private final ExecutionErrorConsole errorConsole;
    private final ConsoleSink consoleSink;
    private final ExecutionEventPublisher publisher;
    private final NotificationSink notifications;
    private final LogPersistenceClient logPersistence;
    private final BlockflowProperties properties;

    // ── Entry points ─────────────────────────────────────────────────────────

    public ExecutionResult run(String workflowId, Object input, ExecutionMode mode, boolean debug) {
        return execute(workflowId, RunOptions.builder().input(input).mode(mode).debug(debug).build());
    }

    /** Runs from the normal start and stops right after {@code blockId} completes. */
    public ExecutionResult runUntilBlock(String workflowId, String blockId, Object input) {
        WorkflowSession session = sessions.session(workflowId);
        session.graph().requireBlock(blockId);
        return execute(workflowId, RunOptions.builder()
                .input(input)
                .mode(ExecutionMode.MANUAL)
                .stopAfterBlockId(blockId)
                .build());
    }

    /**
     * Runs a workflow from its resolved start block.
     *
     * @throws IllegalStateException when a run is already open for the workflow
     */
    public ExecutionResult execute(String workflowId, RunOptions options) {
        WorkflowSession session = sessions.session(workflowId);
        String executionId = options.executionId() != null ? options.executionId() : UUID.randomUUID().toString();
        ActiveRun run = begin(session, executionId, options.debug());
        try {
            long startMillis = System.currentTimeMillis();
            log.info("Starting {} run {} of workflow {}{}", options.mode(), executionId, workflowId,
                    options.debug() ? " in debug mode" : "");

            WorkflowGraph graph = session.executionGraph();
            TriggerResolution resolution;
            try {
                resolution = triggerResolver.resolve(graph, options.mode(), options.input());
            } catch (WorkflowValidationException e) {
                return failBeforeExecution(workflowId, executionId, e);
            }

            RunAccumulator accumulator = new RunAccumulator();
            BlockEventHandler handler = handlerFactory.create(workflowId, executionId, graph.getEdges(), accumulator,
                    BlockEventHandler.Options.builder()
                            .consoleMode(BlockEventHandler.ConsoleMode.UPDATE)
                            .includeStartConsoleEntry(true)
                            .onBlockComplete(options.onBlockComplete())
                            .streamListener(options.streamListener())
                            .build());

            ExecuteRequest request = ExecuteRequest.builder()
                    .workflowId(workflowId)
                    .executionId(executionId)
                    .startBlockId(resolution.startBlockId())
                    .input(resolution.payload())
                    .selectedOutputs(options.selectedOutputs())
                    .triggerType(options.mode().name().toLowerCase(Locale.ROOT))
                    .useDraftState(true)
                    .isClientSession(true)
                    .stopAfterBlockId(options.stopAfterBlockId())
                    .debug(options.debug())
                    .workflowStateOverride(graph)
                    .build();

            String startBlockId = resolution.startBlockId();
            FinishedRun finished = new FinishedRun(workflowId, executionId, run, handler, startMillis,
                    options.beforeFinalize(), false,
                    acc -> {
                        acc.markExecuted(startBlockId);
                        if (options.stopAfterBlockId() == null) {
                            return SnapshotMerger.fromRun(acc);
                        }
                        return SnapshotMerger.merge(stateStore.getLastExecutionSnapshot(workflowId).orElse(null), acc);
                    });
            try {
                streamClient.execute(request, handler);
            } catch (ExecutionAbortedException e) {
                return aborted(workflowId, executionId);
            } catch (ExecutionTransportException e) {
                return failRuntime(finished, ErrorMessages.normalize(e), e);
            }
            return finalizeRun(finished);
        } catch (RuntimeException e) {
            log.error("Run {} of workflow {} failed unexpectedly", executionId, workflowId, e);
            return failBeforeExecution(workflowId, executionId, e);
        } finally {
            session.closeRun(run);
        }
    }

    /**
     * Runs the subgraph reachable from {@code blockId}, substituting upstream outputs from the
     * last snapshot.
     *
     * @throws WorkflowValidationException when the block's dependencies are not satisfied; no
     *                                     run is started in that case
     */
    public ExecutionResult runFromBlock(String workflowId, String blockId, Object input) {
        WorkflowSession session = sessions.session(workflowId);
        WorkflowGraph graph = session.executionGraph();
        ExecutionSnapshot stored = stateStore.getLastExecutionSnapshot(workflowId).orElse(null);

        RunFromBlockGate.Decision decision = runFromBlockGate.evaluate(graph, blockId, stored);
        if (!decision.allowed()) {
            log.warn("Refusing to run workflow {} from block {}: {}", workflowId, blockId, decision.reason());
            Block block = graph.findBlock(blockId).orElse(null);
            if (block == null) {
                throw new WorkflowValidationException(decision.reason());
            }
            throw new WorkflowValidationException(decision.reason(), blockId,
                    block.getType() != null ? block.getType().getKey() : null, block.getName());
        }

        Block target = graph.requireBlock(blockId);
        Object payload = input;
        if (payload == null && decision.triggerTarget()) {
            payload = triggerInput(target);
        }

        String executionId = UUID.randomUUID().toString();
        ActiveRun run = begin(session, executionId, false);
        try {
            long startMillis = System.currentTimeMillis();
            log.info("Running workflow {} from block {} (execution {})", workflowId, blockId, executionId);

            RunAccumulator accumulator = new RunAccumulator();
            BlockEventHandler handler = handlerFactory.create(workflowId, executionId, graph.getEdges(), accumulator,
                    BlockEventHandler.Options.builder()
                            .consoleMode(BlockEventHandler.ConsoleMode.ADD)
                            .includeStartConsoleEntry(false)
                            .build());

            ExecutionSnapshot effective = decision.effectiveSnapshot();
            FinishedRun finished = new FinishedRun(workflowId, executionId, run, handler, startMillis, null, true,
                    acc -> {
                        acc.markExecuted(blockId);
                        return SnapshotMerger.merge(effective, acc);
                    });
            try {
                streamClient.executeFromBlock(ExecuteFromBlockRequest.builder()
                        .workflowId(workflowId)
                        .executionId(executionId)
                        .startBlockId(blockId)
                        .sourceSnapshot(effective)
                        .input(payload)
                        .workflowStateOverride(graph)
                        .build(), handler);
            } catch (ExecutionAbortedException e) {
                return aborted(workflowId, executionId);
            } catch (ExecutionTransportException e) {
                return failRuntime(finished, ErrorMessages.normalize(e), e);
            }
            return finalizeRun(finished);
        } catch (RuntimeException e) {
            log.error("Run {} of workflow {} from block {} failed unexpectedly", executionId, workflowId, blockId, e);
            return failBeforeExecution(workflowId, executionId, e);
        } finally {
            session.closeRun(run);
        }
    }

    /**
     * Executes the pending blocks of a paused debug session once.
     *
     * @throws IllegalStateException when no debug session is paused; debug state is reset first
     */
    public ExecutionResult step(String workflowId) {
        WorkflowExecutionState state = requireDebugState(workflowId, "step");
        WorkflowSession session = sessions.session(workflowId);
        String executionId = executionIdOf(state.getDebugContext());
        ActiveRun run = session.openRun(executionId);
        try {
            stateMachine.beginStep(workflowId);
            ExecutionResult result = state.getExecutor()
                    .continueExecution(state.getPendingBlocks(), state.getDebugContext());
            if (run.isCancelled()) {
                return ExecutionResult.aborted();
            }
            if (result.isPausedDebugSession()) {
                DebugContext next = result.getMetadata().getContext() != null
                        ? result.getMetadata().getContext() : state.getDebugContext();
                stateMachine.pause(workflowId, state.getExecutor(), next, result.getMetadata().getPendingBlocks());
                log.debug("Workflow {} stepped, {} blocks pending", workflowId, result.getMetadata().getPendingBlocks().size());
            } else {
                completeDebugSession(workflowId, executionId, result);
            }
            return result;
        } catch (RuntimeException e) {
            return failDebugSession(workflowId, executionId, state.getDebugContext(), e);
        } finally {
            session.closeRun(run);
        }
    }

    /**
     * Steps until the session stops reporting pending blocks, bounded by
     * {@code blockflow.execution.resume-max-iterations}. The last result is returned even when
     * the bound is hit.
     */
    public ExecutionResult resume(String workflowId) {
        WorkflowExecutionState state = requireDebugState(workflowId, "resume");
        WorkflowSession session = sessions.session(workflowId);
        String executionId = executionIdOf(state.getDebugContext());
        ActiveRun run = session.openRun(executionId);
        int maxIterations = properties.getExecution().getResumeMaxIterations();
        DebugExecutor executor = state.getExecutor();
        DebugContext context = state.getDebugContext();
        List<String> pending = state.getPendingBlocks();
        ExecutionResult current = null;
        int iterations = 0;
        try {
            stateMachine.beginResume(workflowId);
            while (context != null && pending != null && !pending.isEmpty() && iterations < maxIterations) {
                current = executor.continueExecution(pending, context);
                iterations++;
                if (run.isCancelled()) {
                    return ExecutionResult.aborted();
                }
                if (!current.isPausedDebugSession()) break;
                if (current.getMetadata().getContext() != null) {
                    context = current.getMetadata().getContext();
                }
                pending = current.getMetadata().getPendingBlocks();
                stateStore.setDebugContext(workflowId, context);
                stateStore.setPendingBlocks(workflowId, pending);
            }
            if (iterations >= maxIterations && current != null && current.isPausedDebugSession()) {
                log.warn("Resume of workflow {} stopped at the {} iteration ceiling with {} blocks still pending",
                        workflowId, maxIterations, current.getMetadata().getPendingBlocks().size());
            }
            if (current == null) {
                current = ExecutionResult.builder().success(true).logs(context != null ? context.getBlockLogs() : List.of()).build();
            }
            completeDebugSession(workflowId, executionId, current);
            return current;
        } catch (RuntimeException e) {
            return failDebugSession(workflowId, executionId, context, e);
        } finally {
            session.closeRun(run);
        }
    }

    /**
     * Closes the open channel and returns the workflow to idle without writing a snapshot.
     * Valid in any phase; a workflow with nothing open only has its flags reset.
     */
    public void cancel(String workflowId) {
        WorkflowExecutionState state = stateStore.getWorkflowExecution(workflowId);
        sessions.find(workflowId).flatMap(WorkflowSession::activeRun).ifPresent(ActiveRun::cancel);
        streamClient.cancel(workflowId);
        consoleSink.cancelRunningEntries(workflowId);
        if (state.getPhase().isActive()) {
            stateMachine.finish(workflowId, ExecutionPhase.CANCELLED);
            publisher.executionFinished(workflowId, null, "cancelled", null);
            log.info("Cancelled execution of workflow {} (was {})", workflowId, state.getPhase());
        } else {
            stateStore.resetDebugState(workflowId);
        }
    }

    /**
     * Opens the session's run and moves the workflow to executing.
     *
     * @throws IllegalStateException when a run or a paused debug session is already open
     */
    private ActiveRun begin(WorkflowSession session, String executionId, boolean debug) {
        ActiveRun run = session.openRun(executionId);
        try {
            stateMachine.begin(session.workflowId(), debug);
        } catch (IllegalStateException e) {
            session.closeRun(run);
            throw e;
        }
        return run;
    }

    // ── Finalization ─────────────────────────────────────────────────────────

    /** Everything needed to finalize one streamed run. */
    private record FinishedRun(String workflowId,
                               String executionId,
                               ActiveRun run,
                               BlockEventHandler handler,
                               long startMillis,
                               UnaryOperator<ExecutionResult> beforeFinalize,
                               boolean invalidatesStaleSnapshot,
                               SnapshotUpdate snapshotUpdate) {

        RunAccumulator accumulator() {
            return handler.accumulator();
        }

        long elapsed() {
            return System.currentTimeMillis() - startMillis;
        }
    }

    @FunctionalInterface
    private interface SnapshotUpdate {
        ExecutionSnapshot apply(RunAccumulator accumulator);
    }

    private ExecutionResult finalizeRun(FinishedRun finished) {
        String workflowId = finished.workflowId();
        BlockEventHandler handler = finished.handler();
        if (finished.run().isCancelled()) {
            return aborted(workflowId, finished.executionId());
        }
        if (handler.cancelledEvent().isPresent()) {
            Long duration = handler.cancelledEvent().get().duration();
            errorConsole.cancelled(workflowId, finished.executionId(), duration != null ? duration : finished.elapsed());
            stateMachine.finish(workflowId, ExecutionPhase.CANCELLED);
            publisher.executionFinished(workflowId, finished.executionId(), "cancelled", null);
            log.info("Execution {} of workflow {} was cancelled by the executor", finished.executionId(), workflowId);
            return ExecutionResult.cancelled(duration);
        }
        if (handler.errorEvent().isPresent()) {
            ExecutionErrorEvent event = handler.errorEvent().get();
            return failRuntime(finished, ErrorMessages.normalize(event.error()), null);
        }
        if (handler.completedEvent().isPresent()) {
            return complete(finished, handler.completedEvent().get());
        }
        return failRuntime(finished, ErrorMessages.GENERIC, null);
    }

    private ExecutionResult complete(FinishedRun finished, ExecutionCompletedEvent event) {
        String workflowId = finished.workflowId();
        RunAccumulator accumulator = finished.accumulator();
        ExecutionMetadata eventMetadata = event.metadata();
        ExecutionMetadata metadata = (eventMetadata != null ? eventMetadata.toBuilder() : ExecutionMetadata.builder())
                .duration(event.duration() > 0 ? event.duration() : finished.elapsed())
                .startTime(event.startTime() != null ? event.startTime() : Instant.ofEpochMilli(finished.startMillis()))
                .endTime(event.endTime() != null ? event.endTime() : Instant.now())
                .build();
        ExecutionResult result = ExecutionResult.builder()
                .success(event.success())
                .output(event.output() != null ? event.output() : new LinkedHashMap<>())
                .logs(accumulator.blockLogs())
                .metadata(metadata)
                .build();

        if (result.isPausedDebugSession()) {
            DebugContext context = metadata.getContext() != null ? metadata.getContext()
                    : DebugContext.builder().workflowId(workflowId).executionId(finished.executionId())
                            .blockLogs(accumulator.blockLogs()).build();
            stateMachine.pause(workflowId, debugExecutor, context, metadata.getPendingBlocks());
            stateStore.setActiveBlocks(workflowId, List.of());
            log.info("Workflow {} paused for debugging, {} blocks pending", workflowId, metadata.getPendingBlocks().size());
            return result;
        }

        if (finished.beforeFinalize() != null) {
            result = finished.beforeFinalize().apply(result);
        }
        if (result.isSuccess()) {
            stateStore.setLastExecutionSnapshot(workflowId, finished.snapshotUpdate().apply(accumulator));
        }
        logPersistence.persistLogs(workflowId, finished.executionId(), result);
        stateMachine.finish(workflowId, ExecutionPhase.COMPLETED);
        publisher.executionFinished(workflowId, finished.executionId(), "completed", null);
        log.info("Execution {} of workflow {} completed (success={}, {} block logs)",
                finished.executionId(), workflowId, result.isSuccess(), result.getLogs().size());
        return result;
    }

    private ExecutionResult failRuntime(FinishedRun finished, String error, ExecutionTransportException transport) {
        String workflowId = finished.workflowId();
        if (finished.run().isCancelled()) {
            return aborted(workflowId, finished.executionId());
        }
        RunAccumulator accumulator = finished.accumulator();
        long duration = finished.elapsed();
        errorConsole.executionError(workflowId, finished.executionId(), error, duration,
                accumulator.hasLogs(), accumulator.hasBlockError());

        ExecutionResult result = ExecutionResult.failure(error, accumulator.blockLogs());
        result.setMetadata(ExecutionMetadata.builder().duration(duration).build());

        if (finished.invalidatesStaleSnapshot() && STALE_SNAPSHOT_ERRORS.stream().anyMatch(error::contains)) {
            stateStore.clearLastExecutionSnapshot(workflowId);
            notifications.notify(workflowId, "error", WORKFLOW_MODIFIED_MESSAGE);
        } else {
            notifications.notify(workflowId, "error", failureNotice(error, transport));
        }
        logPersistence.persistLogs(workflowId, finished.executionId(), result);
        stateMachine.finish(workflowId, ExecutionPhase.ERRORED);
        publisher.executionFinished(workflowId, finished.executionId(), "error", error);
        log.error("Execution {} of workflow {} failed: {}", finished.executionId(), workflowId, error);
        return result;
    }

    /** The run never reached the executor; nothing is persisted. */
    private ExecutionResult failBeforeExecution(String workflowId, String executionId, RuntimeException cause) {
        String error = ErrorMessages.normalize(cause);
        errorConsole.preparationError(workflowId, executionId, error, cause);
        notifications.notify(workflowId, "error", failureNotice(error, null));
        stateMachine.finish(workflowId, ExecutionPhase.ERRORED);
        publisher.executionFinished(workflowId, executionId, "error", error);
        log.warn("Workflow {} could not be started: {}", workflowId, error);
        return ExecutionResult.failure(error, List.of());
    }

    /** User cancellation: quiet, no error log, no snapshot. */
    private ExecutionResult aborted(String workflowId, String executionId) {
        log.debug("Execution {} of workflow {} aborted by the user", executionId, workflowId);
        if (stateMachine.current(workflowId).getPhase().isActive()) {
            stateMachine.finish(workflowId, ExecutionPhase.CANCELLED);
        } else {
            stateStore.resetDebugState(workflowId);
        }
        return ExecutionResult.aborted();
    }

    // ── Debug sessions ───────────────────────────────────────────────────────

    private WorkflowExecutionState requireDebugState(String workflowId, String action) {
        if (!stateMachine.hasValidDebugState(workflowId)) {
            WorkflowExecutionState state = stateStore.getWorkflowExecution(workflowId);
            log.error("Cannot {} workflow {}: no paused debug session (phase {}, executor {}, pending {})",
                    action, workflowId, state.getPhase(), state.hasExecutor(), state.getPendingBlocks().size());
            if (state.getPhase().isActive()) {
                stateMachine.finish(workflowId, ExecutionPhase.ERRORED);
            } else {
                stateStore.resetDebugState(workflowId);
            }
            throw new IllegalStateException("No paused debug session for workflow " + workflowId);
        }
        return stateStore.getWorkflowExecution(workflowId);
    }

    private void completeDebugSession(String workflowId, String executionId, ExecutionResult result) {
        logPersistence.persistLogs(workflowId, executionId, result);
        stateMachine.finish(workflowId, ExecutionPhase.COMPLETED);
        publisher.executionFinished(workflowId, executionId, "completed", null);
        log.info("Debug session of workflow {} completed (success={})", workflowId, result.isSuccess());
    }

    private ExecutionResult failDebugSession(String workflowId, String executionId, DebugContext context, RuntimeException e) {
        String error = ErrorMessages.normalize(e);
        log.error("Debug session of workflow {} failed", workflowId, e);
        ExecutionResult result = ExecutionResult.failure(error, context != null ? context.getBlockLogs() : List.of());
        logPersistence.persistLogs(workflowId, executionId, result);
        notifications.notify(workflowId, "error", failureNotice(error, null));
        stateMachine.finish(workflowId, ExecutionPhase.ERRORED);
        publisher.executionFinished(workflowId, executionId, "error", error);
        return result;
    }

    private static String executionIdOf(DebugContext context) {
        return context != null && context.getExecutionId() != null ? context.getExecutionId() : UUID.randomUUID().toString();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /** Input for a trigger run directly from the editor: its test payload, mock or input format. */
    private Object triggerInput(Block block) {
        Optional<StartBlockPath> path = startBlockClassifier.classify(block);
        if (path.isPresent()) {
            return payloadBuilder.build(new StartBlockCandidate(block.getId(), block, path.get()));
        }
        return payloadBuilder.mockPayload(block);
    }

    private static String failureNotice(String error, ExecutionTransportException transport) {
        if (transport != null && transport.getStatus() != null) {
            return "Workflow execution failed: Request to " + transport.getUrl()
                    + " failed (Status: " + transport.getStatus() + ")";
        }
        return "Workflow execution failed: " + error;
    }
}
