package com.tengen.core.load;

import com.tengen.core.model.GoColor;
import com.tengen.core.model.Vertex;

/**
 * One entry of a recovered move list. {@code vertex} is {@code null} for pass and resign.
 */
public record MoveRecord(GoColor color, Kind kind, Vertex vertex) {

    public enum Kind { PLAY, PASS, RESIGN }

    public static MoveRecord play(GoColor color, Vertex vertex) {
        return new MoveRecord(color, Kind.PLAY, vertex);
    }

    public static MoveRecord pass(GoColor color) {
        return new MoveRecord(color, Kind.PASS, null);
    }

    public static MoveRecord resign(GoColor color) {
        return new MoveRecord(color, Kind.RESIGN, null);
    }

    /** The intersection for messages: the vertex, or {@code pass}/{@code resign}. */
    public String target() {
        return switch (kind) {
            case PLAY -> vertex.toGtp();
            case PASS -> "pass";
            case RESIGN -> "resign";
        };
    }
}
