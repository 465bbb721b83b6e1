package com.blockflow.blockflow_backend.identity;

import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.BlockType;

import java.util.Collection;

@FunctionalInterface
public interface UniqueNameFunction {

    /** Returns a name for a new block of {@code type} that collides with none of {@code existing}. */
    String uniqueName(String baseName, BlockType type, Collection<Block> existing);
}
