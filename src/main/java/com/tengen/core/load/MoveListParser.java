package com.tengen.core.load;

import com.tengen.core.model.GoColor;
import com.tengen.core.model.Vertex;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the engine's move list, e.g. {@code "B C3, W G7, B pass"} or one move per line.
 */
public final class MoveListParser {

    private MoveListParser() {}

    /**
     * Splits the list into move strings. Blank text yields an empty list.
     */
    public static List<String> split(String moveListText) {
        var moves = new ArrayList<String>();
        if (moveListText == null) {
            return moves;
        }
        for (String part : moveListText.split("[,\\r\\n]+")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                moves.add(trimmed);
            }
        }
        return moves;
    }

    /**
     * Parses one move string of the form {@code <color> <vertex|pass|resign>}.
     *
     * @throws IllegalArgumentException with a user-facing reason if the string is not a valid move
     */
    public static MoveRecord parse(String move, int boardSize) {
        String[] parts = move.trim().split("\\s+");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Move string has invalid format");
        }
        GoColor color = GoColor.fromGtp(parts[0]);
        if (color == null) {
            throw new IllegalArgumentException("Move string has unsupported player color");
        }
        String target = parts[1].toLowerCase();
        if (target.equals("pass")) {
            return MoveRecord.pass(color);
        }
        if (target.equals("resign")) {
            return MoveRecord.resign(color);
        }
        try {
            return MoveRecord.play(color, Vertex.parse(target, boardSize));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Move string has invalid intersection", e);
        }
    }
}
