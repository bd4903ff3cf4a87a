package com.tengen.core.model;

/**
 * The rules capability that move replay and the computer player drive.
 */
public interface RulesEngine {

    MoveCheck isLegalMove(Vertex vertex, GoColor color);

    void play(Vertex vertex);

    void pass();

    void resign();

    GoColor currentColorToMove();
}
