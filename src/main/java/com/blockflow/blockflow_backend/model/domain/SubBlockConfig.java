package com.blockflow.blockflow_backend.model.domain;

/**
 * Declared parameter of a block type. {@code type} is the editor input kind
 * (short-input, long-input, code, dropdown, input-format, ...).
 */
public record SubBlockConfig(String id, String type) {}
