package com.tengen.core.model;

/**
 * Stone colors. GTP spells them {@code B}/{@code W} or {@code black}/{@code white}.
 */
public enum GoColor {
    BLACK("B"),
    WHITE("W");

    private final String gtpLetter;

    GoColor(String gtpLetter) {
        this.gtpLetter = gtpLetter;
    }

    public String gtpLetter() {
        return gtpLetter;
    }

    public GoColor opposite() {
        return this == BLACK ? WHITE : BLACK;
    }

    /**
     * Parses a GTP color token, case-insensitive.
     *
     * @return the color, or {@code null} if the token is not a color
     */
    public static GoColor fromGtp(String token) {
        if (token == null) {
            return null;
        }
        return switch (token.trim().toLowerCase()) {
            case "b", "black" -> BLACK;
            case "w", "white" -> WHITE;
            default -> null;
        };
    }
}
