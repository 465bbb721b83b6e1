package com.blockflow.blockflow_backend.snapshot;

/**
 * Last known output of one block.
 *
 * @param executionTime duration of the run that produced {@code output}, in milliseconds
 */
public record BlockState(Object output, boolean executed, long executionTime) {}
