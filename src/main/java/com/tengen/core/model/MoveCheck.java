package com.tengen.core.model;

/**
 * Outcome of a legality query against the rules engine.
 *
 * @param legal  whether the move may be played
 * @param reason why the move is illegal, {@code null} when legal
 */
public record MoveCheck(boolean legal, IllegalReason reason) {

    private static final MoveCheck LEGAL = new MoveCheck(true, null);

    public static MoveCheck legalMove() {
        return LEGAL;
    }

    public static MoveCheck illegal(IllegalReason reason) {
        return new MoveCheck(false, reason);
    }

    public enum IllegalReason {
        INTERSECTION_OCCUPIED("Intersection is occupied"),
        SUICIDE("Suicide"),
        SIMPLE_KO("Ko"),
        WRONG_COLOR("Not this color's turn"),
        GAME_HAS_ENDED("Game has ended");

        private final String description;

        IllegalReason(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }
}
