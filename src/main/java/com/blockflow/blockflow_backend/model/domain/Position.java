package com.blockflow.blockflow_backend.model.domain;

/** Canvas position. */
public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0, 0);

    public Position offset(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }

    public Position offset(Position delta) {
        return offset(delta.x(), delta.y());
    }
}
