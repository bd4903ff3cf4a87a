package com.tengen.gtp;

import java.util.List;

/**
 * Tuning parameters installed into the engine for the computer player.
 *
 * @param maxGames playout limit per move; {@code -1} means unlimited and is sent as
 *                 the engine's unsigned maximum
 */
public record EngineProfile(
    int maxMemoryMb,
    int threads,
    boolean pondering,
    boolean reuseSubtree,
    int maxPonderTimeSeconds,
    int maxThinkingTimeSeconds,
    long maxGames
) {

    /** The GTP commands that install this profile, in order. */
    public List<String> gtpCommands() {
        return List.of(
                "uct_max_memory " + (long) maxMemoryMb * 1_000_000L,
                "uct_param_search number_threads " + threads,
                "uct_param_player reuse_subtree " + flag(reuseSubtree),
                "uct_param_player ponder " + flag(pondering),
                "uct_param_player max_ponder_time " + maxPonderTimeSeconds,
                "go_param timelimit " + maxThinkingTimeSeconds,
                "uct_param_player max_games " + Long.toUnsignedString(maxGames));
    }

    private static int flag(boolean value) {
        return value ? 1 : 0;
    }
}
