package com.tengen.core.model;

/**
 * A board intersection in GTP notation: column letter (A-T, no I) plus row number.
 *
 * @param x 1-based column
 * @param y 1-based row, counted from the bottom edge
 */
public record Vertex(int x, int y) {

    private static final String COLUMNS = "ABCDEFGHJKLMNOPQRST";

    public Vertex {
        if (x < 1 || x > COLUMNS.length() || y < 1 || y > COLUMNS.length()) {
            throw new IllegalArgumentException("Vertex out of range: x=" + x + ", y=" + y);
        }
    }

    /**
     * Parses a vertex such as {@code "C3"} or {@code "q16"} and checks it against the board size.
     *
     * @throws IllegalArgumentException if the text is malformed or lies outside the board
     */
    public static Vertex parse(String text, int boardSize) {
        if (text == null || text.length() < 2) {
            throw new IllegalArgumentException("Malformed vertex: " + text);
        }
        String upper = text.trim().toUpperCase();
        int x = COLUMNS.indexOf(upper.charAt(0)) + 1;
        if (x == 0) {
            throw new IllegalArgumentException("Malformed vertex: " + text);
        }
        int y;
        try {
            y = Integer.parseInt(upper.substring(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed vertex: " + text, e);
        }
        if (x > boardSize || y < 1 || y > boardSize) {
            throw new IllegalArgumentException("Vertex " + text + " is outside a " + boardSize + "x" + boardSize + " board");
        }
        return new Vertex(x, y);
    }

    public String toGtp() {
        return COLUMNS.charAt(x - 1) + Integer.toString(y);
    }

    @Override
    public String toString() {
        return toGtp();
    }
}
