package com.blockflow.blockflow_backend.trigger;

import lombok.Getter;

/**
 * A workflow cannot be started as it is. Carries the identity of the offending block so callers
 * can highlight it; workflow-level problems use the {@code validation} placeholder identity.
 */
@Getter
public class WorkflowValidationException extends RuntimeException {

    public static final String WORKFLOW_BLOCK_ID = "validation";
    public static final String WORKFLOW_BLOCK_TYPE = "validation";
    public static final String WORKFLOW_BLOCK_NAME = "Workflow Validation";

    private final String blockId;
    private final String blockType;
    private final String blockName;

    public WorkflowValidationException(String message) {
        this(message, WORKFLOW_BLOCK_ID, WORKFLOW_BLOCK_TYPE, WORKFLOW_BLOCK_NAME);
    }

    public WorkflowValidationException(String message, String blockId, String blockType, String blockName) {
        super(message);
        this.blockId = blockId;
        this.blockType = blockType;
        this.blockName = blockName;
    }
}
