package com.blockflow.blockflow_backend.executor;

import lombok.Getter;

/** The executor could not be reached or answered with something other than an event stream. */
@Getter
public class ExecutionTransportException extends RuntimeException {

    private final String url;
    private final Integer status;

    public ExecutionTransportException(String message, String url, Integer status) {
        super(message);
        this.url = url;
        this.status = status;
    }

    public ExecutionTransportException(String message, String url, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.status = null;
    }
}
