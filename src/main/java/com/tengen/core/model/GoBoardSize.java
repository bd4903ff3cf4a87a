package com.tengen.core.model;

import java.util.Arrays;

public enum GoBoardSize {
    SIZE_7(7, 4, 3),
    SIZE_9(9, 9, 3),
    SIZE_11(11, 9, 3),
    SIZE_13(13, 9, 4),
    SIZE_15(15, 9, 4),
    SIZE_17(17, 9, 4),
    SIZE_19(19, 9, 4);

    public static final GoBoardSize DEFAULT = SIZE_19;

    private final int dimension;
    private final int maximumHandicap;
    private final int handicapEdgeDistance;

    GoBoardSize(int dimension, int maximumHandicap, int handicapEdgeDistance) {
        this.dimension = dimension;
        this.maximumHandicap = maximumHandicap;
        this.handicapEdgeDistance = handicapEdgeDistance;
    }

    public int dimension() { return dimension; }
    public int maximumHandicap() { return maximumHandicap; }
    int handicapEdgeDistance() { return handicapEdgeDistance; }

    /**
     * @throws IllegalArgumentException if {@code dimension} is not a supported board size
     */
    public static GoBoardSize of(int dimension) {
        return Arrays.stream(values())
                .filter(size -> size.dimension == dimension)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("The board size is not supported: " + dimension));
    }

    public static boolean isSupported(int dimension) {
        return Arrays.stream(values()).anyMatch(size -> size.dimension == dimension);
    }
}
