package com.blockflow.blockflow_backend.model.graph;

public class InvalidGraphException extends RuntimeException {

    public InvalidGraphException(String message) {
        super(message);
    }
}
