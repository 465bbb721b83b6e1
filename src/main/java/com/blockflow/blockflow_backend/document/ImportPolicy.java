package com.blockflow.blockflow_backend.document;

public enum ImportPolicy {
    FRESH,   // every imported block gets a new id, nothing of the open graph survives
    MERGE    // the open graph's start block keeps its id, everything else is replaced
}
