package com.blockflow.blockflow_backend.trigger;

import com.blockflow.blockflow_backend.model.domain.Block;

public record StartBlockCandidate(String blockId, Block block, StartBlockPath path) {}
