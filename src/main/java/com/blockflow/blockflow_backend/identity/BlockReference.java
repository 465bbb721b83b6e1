package com.blockflow.blockflow_backend.identity;

/**
 * One {@code <name.path>} token found in a parameter string. {@code start} is the index of the
 * opening angle bracket and {@code end} the index just past the closing one.
 */
public record BlockReference(int start, int end, String name, String path) {

    public String render() {
        return "<" + name + "." + path + ">";
    }

    public BlockReference withName(String newName) {
        return new BlockReference(start, end, newName, path);
    }
}
