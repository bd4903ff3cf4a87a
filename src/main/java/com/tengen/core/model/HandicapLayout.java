package com.tengen.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Standard fixed handicap stone placement.
 */
public final class HandicapLayout {

    private HandicapLayout() {}

    /**
     * Returns the handicap vertices for {@code handicap} stones, in placement order.
     * Handicap 0 yields an empty list; handicap 1 is not a valid fixed handicap.
     *
     * @throws IllegalArgumentException if the handicap is out of range for the board size
     */
    public static List<Vertex> verticesFor(int handicap, GoBoardSize boardSize) {
        var vertices = new ArrayList<Vertex>();
        if (handicap == 0) {
            return vertices;
        }
        if (handicap < 2 || handicap > boardSize.maximumHandicap()) {
            throw new IllegalArgumentException(
                    "Handicap " + handicap + " is out of range for board size " + boardSize.dimension());
        }

        int lineClose = boardSize.handicapEdgeDistance();
        int lineFar = boardSize.dimension() - lineClose + 1;
        int lineMiddle = lineClose + (lineFar - lineClose) / 2;

        for (int stone = 1; stone <= handicap; stone++) {
            vertices.add(switch (stone) {
                case 1 -> new Vertex(lineClose, lineClose);
                case 2 -> new Vertex(lineFar, lineFar);
                case 3 -> new Vertex(lineClose, lineFar);
                case 4 -> new Vertex(lineFar, lineClose);
                case 5 -> stone == handicap ? new Vertex(lineMiddle, lineMiddle) : new Vertex(lineClose, lineMiddle);
                case 6 -> new Vertex(lineFar, lineMiddle);
                case 7 -> stone == handicap ? new Vertex(lineMiddle, lineMiddle) : new Vertex(lineMiddle, lineClose);
                case 8 -> new Vertex(lineMiddle, lineFar);
                default -> new Vertex(lineMiddle, lineMiddle);
            });
        }
        return vertices;
    }

    public static String toGtp(List<Vertex> vertices) {
        var joined = new StringBuilder();
        for (Vertex vertex : vertices) {
            if (joined.length() > 0) {
                joined.append(' ');
            }
            joined.append(vertex.toGtp());
        }
        return joined.toString();
    }
}
