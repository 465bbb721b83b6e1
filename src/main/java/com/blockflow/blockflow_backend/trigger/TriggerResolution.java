package com.blockflow.blockflow_backend.trigger;

import com.blockflow.blockflow_backend.model.domain.Block;

/**
 * The block a run starts from and the input it receives.
 */
public record TriggerResolution(String startBlockId, Block startBlock, StartBlockPath path, Object payload) {}
