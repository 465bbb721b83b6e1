package com.blockflow.blockflow_backend.document;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed workflow document. Block keys are document-local ids; they become real block ids
 * only through an {@link ImportPolicy}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class YamlWorkflowDocument {

    public static final String CURRENT_VERSION = "1.0";

    private String version = CURRENT_VERSION;

    private Map<String, YamlBlock> blocks = new LinkedHashMap<>();
}
