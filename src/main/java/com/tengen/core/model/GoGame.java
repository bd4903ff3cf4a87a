package com.tengen.core.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * The local game record and a minimal rules implementation: occupancy, captures,
 * suicide, simple ko, alternating turns, pass and resign. Scoring is not modelled.
 * <p>
 * Not thread-safe. A game is mutated by the thread running a game operation inside
 * {@link GameHandle#exclusively}, or by the engine dispatcher when it applies a
 * computer move. A load installs its game before replaying into it, so a reader that
 * does not hold the operation lock may see a partially replayed position.
 */
public class GoGame implements RulesEngine {

    public enum State { IN_PROGRESS, HAS_ENDED }

    public enum EndReason { TWO_PASSES, RESIGNED }

    private final String id = UUID.randomUUID().toString();
    private final GoBoardSize boardSize;
    private final GoGameRules rules;
    private final GoGameType type;
    private final GoPlayer playerBlack;
    private final GoPlayer playerWhite;
    private final GoColor[][] stones;

    private double komi;
    private List<Vertex> handicapPoints = List.of();
    private final List<GoMove> moves = new ArrayList<>();
    private GoColor nextColor = GoColor.BLACK;
    private State state = State.IN_PROGRESS;
    private EndReason endReason;
    private Vertex koPoint;
    private int consecutivePasses;

    public GoGame(GoBoardSize boardSize, GoGameRules rules, GoGameType type,
                  GoPlayer playerBlack, GoPlayer playerWhite) {
        this.boardSize = boardSize;
        this.rules = rules;
        this.type = type;
        this.playerBlack = playerBlack;
        this.playerWhite = playerWhite;
        int dim = boardSize.dimension();
        this.stones = new GoColor[dim + 1][dim + 1];
    }

    public String id() { return id; }
    public GoBoardSize boardSize() { return boardSize; }
    public GoGameRules rules() { return rules; }
    public GoGameType type() { return type; }
    public GoPlayer playerBlack() { return playerBlack; }
    public GoPlayer playerWhite() { return playerWhite; }
    public double komi() { return komi; }
    public List<Vertex> handicapPoints() { return handicapPoints; }
    public List<GoMove> moves() { return Collections.unmodifiableList(moves); }
    public State state() { return state; }
    public EndReason endReason() { return endReason; }

    public void setKomi(double komi) {
        this.komi = komi;
    }

    /**
     * Places black handicap stones. Only allowed before the first move; white moves first
     * when there is a handicap.
     */
    public void setHandicapPoints(List<Vertex> points) {
        if (!moves.isEmpty()) {
            throw new IllegalStateException("Handicap cannot change after moves have been played");
        }
        for (Vertex old : handicapPoints) {
            stones[old.x()][old.y()] = null;
        }
        var unique = new LinkedHashSet<>(points);
        for (Vertex point : unique) {
            checkOnBoard(point);
            stones[point.x()][point.y()] = GoColor.BLACK;
        }
        handicapPoints = List.copyOf(unique);
        nextColor = handicapPoints.isEmpty() ? GoColor.BLACK : GoColor.WHITE;
    }

    public GoColor stoneAt(Vertex vertex) {
        checkOnBoard(vertex);
        return stones[vertex.x()][vertex.y()];
    }

    public GoPlayer nextPlayer() {
        return nextColor == GoColor.BLACK ? playerBlack : playerWhite;
    }

    public boolean isComputerPlayersTurn() {
        return state == State.IN_PROGRESS && nextPlayer().isComputer();
    }

    public GoMove lastMove() {
        return moves.isEmpty() ? null : moves.get(moves.size() - 1);
    }

    /** Vertices played so far, in order, without pass and resign. */
    public List<Vertex> playedPoints() {
        var points = new ArrayList<Vertex>();
        for (GoMove move : moves) {
            if (move.type() == GoMove.Type.PLAY) {
                points.add(move.vertex());
            }
        }
        return points;
    }

    @Override
    public GoColor currentColorToMove() {
        return nextColor;
    }

    @Override
    public MoveCheck isLegalMove(Vertex vertex, GoColor color) {
        checkOnBoard(vertex);
        if (state == State.HAS_ENDED) {
            return MoveCheck.illegal(MoveCheck.IllegalReason.GAME_HAS_ENDED);
        }
        if (color != nextColor) {
            return MoveCheck.illegal(MoveCheck.IllegalReason.WRONG_COLOR);
        }
        if (stones[vertex.x()][vertex.y()] != null) {
            return MoveCheck.illegal(MoveCheck.IllegalReason.INTERSECTION_OCCUPIED);
        }
        if (vertex.equals(koPoint)) {
            return MoveCheck.illegal(MoveCheck.IllegalReason.SIMPLE_KO);
        }

        stones[vertex.x()][vertex.y()] = color;
        try {
            for (Vertex neighbour : neighbours(vertex)) {
                if (stones[neighbour.x()][neighbour.y()] == color.opposite()
                        && liberties(group(neighbour)).isEmpty()) {
                    return MoveCheck.legalMove();
                }
            }
            if (liberties(group(vertex)).isEmpty()) {
                return MoveCheck.illegal(MoveCheck.IllegalReason.SUICIDE);
            }
            return MoveCheck.legalMove();
        } finally {
            stones[vertex.x()][vertex.y()] = null;
        }
    }

    /**
     * @throws IllegalStateException if the move is not legal for the color to move
     */
    @Override
    public void play(Vertex vertex) {
        MoveCheck check = isLegalMove(vertex, nextColor);
        if (!check.legal()) {
            throw new IllegalStateException("Illegal move " + vertex + " by " + nextColor + ": "
                    + check.reason().description());
        }
        GoColor color = nextColor;
        stones[vertex.x()][vertex.y()] = color;

        var captured = new ArrayList<Vertex>();
        for (Vertex neighbour : neighbours(vertex)) {
            if (stones[neighbour.x()][neighbour.y()] == color.opposite()) {
                Set<Vertex> group = group(neighbour);
                if (liberties(group).isEmpty()) {
                    for (Vertex stone : group) {
                        stones[stone.x()][stone.y()] = null;
                        captured.add(stone);
                    }
                }
            }
        }

        Set<Vertex> ownGroup = group(vertex);
        if (captured.size() == 1 && ownGroup.size() == 1 && liberties(ownGroup).size() == 1) {
            koPoint = captured.get(0);
        } else {
            koPoint = null;
        }

        moves.add(GoMove.play(color, vertex));
        consecutivePasses = 0;
        nextColor = color.opposite();
    }

    @Override
    public void pass() {
        requireInProgress();
        moves.add(GoMove.pass(nextColor));
        koPoint = null;
        consecutivePasses++;
        nextColor = nextColor.opposite();
        if (consecutivePasses >= 2) {
            state = State.HAS_ENDED;
            endReason = EndReason.TWO_PASSES;
        }
    }

    @Override
    public void resign() {
        requireInProgress();
        moves.add(GoMove.resign(nextColor));
        state = State.HAS_ENDED;
        endReason = EndReason.RESIGNED;
    }

    /**
     * Resumes a game that ended by two passes so that play can continue.
     */
    public void revertEndedToInProgress() {
        if (state != State.HAS_ENDED || endReason != EndReason.TWO_PASSES) {
            throw new IllegalStateException("Only a game ended by two passes can be resumed");
        }
        state = State.IN_PROGRESS;
        endReason = null;
        consecutivePasses = 0;
    }

    private void requireInProgress() {
        if (state == State.HAS_ENDED) {
            throw new IllegalStateException("Game has already ended (" + endReason + ")");
        }
    }

    private void checkOnBoard(Vertex vertex) {
        if (vertex.x() > boardSize.dimension() || vertex.y() > boardSize.dimension()) {
            throw new IllegalArgumentException("Vertex " + vertex + " is outside the board");
        }
    }

    private List<Vertex> neighbours(Vertex vertex) {
        int dim = boardSize.dimension();
        var result = new ArrayList<Vertex>(4);
        if (vertex.x() > 1) result.add(new Vertex(vertex.x() - 1, vertex.y()));
        if (vertex.x() < dim) result.add(new Vertex(vertex.x() + 1, vertex.y()));
        if (vertex.y() > 1) result.add(new Vertex(vertex.x(), vertex.y() - 1));
        if (vertex.y() < dim) result.add(new Vertex(vertex.x(), vertex.y() + 1));
        return result;
    }

    private Set<Vertex> group(Vertex start) {
        GoColor color = stones[start.x()][start.y()];
        var group = new HashSet<Vertex>();
        var pending = new ArrayDeque<Vertex>();
        pending.push(start);
        while (!pending.isEmpty()) {
            Vertex current = pending.pop();
            if (!group.add(current)) {
                continue;
            }
            for (Vertex neighbour : neighbours(current)) {
                if (stones[neighbour.x()][neighbour.y()] == color && !group.contains(neighbour)) {
                    pending.push(neighbour);
                }
            }
        }
        return group;
    }

    private Set<Vertex> liberties(Set<Vertex> group) {
        var liberties = new HashSet<Vertex>();
        for (Vertex stone : group) {
            for (Vertex neighbour : neighbours(stone)) {
                if (stones[neighbour.x()][neighbour.y()] == null) {
                    liberties.add(neighbour);
                }
            }
        }
        return liberties;
    }

    @Override
    public String toString() {
        return "GoGame(" + id + ", " + boardSize.dimension() + "x" + boardSize.dimension()
                + ", komi=" + komi + ", handicap=" + handicapPoints.size() + ", moves=" + moves.size() + ")";
    }
}
