package com.blockflow.blockflow_backend.model.graph;

public class BlockNotFoundException extends RuntimeException {

    private final String blockId;

    public BlockNotFoundException(String blockId) {
        super("Block not found in workflow: " + blockId);
        this.blockId = blockId;
    }

    public String getBlockId() {
        return blockId;
    }
}
