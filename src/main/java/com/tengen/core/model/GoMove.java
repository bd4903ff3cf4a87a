package com.tengen.core.model;

/**
 * A move that has been applied to a {@link GoGame}. {@code vertex} is {@code null} for pass and resign.
 */
public record GoMove(Type type, GoColor color, Vertex vertex) {

    public enum Type { PLAY, PASS, RESIGN }

    public static GoMove play(GoColor color, Vertex vertex) {
        return new GoMove(Type.PLAY, color, vertex);
    }

    public static GoMove pass(GoColor color) {
        return new GoMove(Type.PASS, color, null);
    }

    public static GoMove resign(GoColor color) {
        return new GoMove(Type.RESIGN, color, null);
    }
}
