package com.tengen.core.load;

import com.tengen.core.model.GoColor;

/**
 * Why replaying a recovered move list stopped.
 *
 * @param moveNumber 1-based index of the offending move
 * @param message    user-facing description
 */
public record ReplayFailure(int moveNumber, String message) {

    static ReplayFailure illegalMove(int moveNumber, GoColor color, String target, String reason) {
        return new ReplayFailure(moveNumber,
                "Game contains an illegal move: Move %d, played by %s, on intersection %s. Reason: %s."
                        .formatted(moveNumber, colorName(color), target, reason));
    }

    static ReplayFailure invalidMove(int moveNumber, String move, String reason) {
        return new ReplayFailure(moveNumber,
                "Game contains an invalid move: Move %d (%s). Reason: %s.".formatted(moveNumber, move, reason));
    }

    private static String colorName(GoColor color) {
        return color == GoColor.BLACK ? "Black" : "White";
    }
}
