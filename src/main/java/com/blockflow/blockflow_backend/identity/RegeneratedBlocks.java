package com.blockflow.blockflow_backend.identity;

import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.Container;
import com.blockflow.blockflow_backend.model.domain.Edge;

import java.util.List;
import java.util.Map;

/**
 * Output of a paste/duplicate id regeneration. {@code idMap} maps every source block id to its
 * new id; {@code subBlockValues} is keyed by the new ids.
 */
public record RegeneratedBlocks(
        Map<String, Block> blocks,
        List<Edge> edges,
        Map<String, Container> loops,
        Map<String, Container> parallels,
        Map<String, Map<String, Object>> subBlockValues,
        Map<String, String> idMap
) {}
