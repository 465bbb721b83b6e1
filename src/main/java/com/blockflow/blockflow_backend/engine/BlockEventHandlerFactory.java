package com.blockflow.blockflow_backend.engine;

import com.blockflow.blockflow_backend.console.ConsoleSink;
import com.blockflow.blockflow_backend.engine.state.ExecutionStateStore;
import com.blockflow.blockflow_backend.model.domain.Edge;
import com.blockflow.blockflow_backend.snapshot.RunAccumulator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class BlockEventHandlerFactory {

    private final ExecutionStateStore stateStore;
    private final ConsoleSink consoleSink;
    private final ExecutionEventPublisher publisher;

    public BlockEventHandler create(String workflowId, String executionId, List<Edge> edges,
                                    RunAccumulator accumulator, BlockEventHandler.Options options) {
        return new BlockEventHandler(workflowId, executionId, edges, accumulator, options,
                stateStore, consoleSink, publisher);
    }
}
