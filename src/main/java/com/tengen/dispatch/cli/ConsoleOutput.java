package com.tengen.dispatch.cli;

import com.tengen.core.model.GoColor;
import com.tengen.core.model.GoGame;
import com.tengen.core.model.GoMove;
import com.tengen.core.model.Vertex;
import com.tengen.gtp.GtpLogItem;
import picocli.CommandLine;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Tengen CLI.
 */
public class ConsoleOutput {

    private static final String COLUMNS = "ABCDEFGHJKLMNOPQRST";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TENGEN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TENGEN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void progress(double fraction, String label) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [" + String.format(Locale.ROOT, "%3d%%", Math.round(fraction * 100)) + "]|@ " + label));
    }

    public static void gtp(boolean success, String payload) {
        String status = success ? "@|fg(green) =|@" : "@|fg(red) ?|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(status + " " + payload));
    }

    /**
     * Prints the GTP log, oldest entry first.
     */
    public static void gtpLog(List<GtpLogItem> items) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold GTP log|@ (" + items.size() + " entries)"));
        for (GtpLogItem item : items) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) >>|@ " + item.command()));
            if (!item.hasResponse()) {
                System.out.println("   (no response yet)");
                continue;
            }
            long millis = Duration.between(item.sentAt(), item.receivedAt()).toMillis();
            String status = item.success() ? "@|fg(green) <<|@ =" : "@|fg(red) <<|@ ?";
            String[] lines = item.response().split("\\R", -1);
            System.out.println(CommandLine.Help.Ansi.AUTO.string(status + " " + lines[0] + "  (" + millis + " ms)"));
            for (int i = 1; i < lines.length; i++) {
                System.out.println("     " + lines[i]);
            }
        }
    }

    /**
     * Prints a one-line summary followed by the board, black as {@code X}, white as {@code O}.
     */
    public static void game(GoGame game) {
        int size = game.boardSize().dimension();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(Locale.ROOT,
                "@|bold Game|@ %dx%d, komi %.1f, handicap %d, %d move(s), %s to move%s",
                size, size, game.komi(), game.handicapPoints().size(), game.moves().size(),
                colorName(game.currentColorToMove()),
                game.state() == GoGame.State.HAS_ENDED ? " (ended: " + game.endReason() + ")" : "")));
        for (int y = size; y >= 1; y--) {
            var row = new StringBuilder(String.format(Locale.ROOT, "%2d ", y));
            for (int x = 1; x <= size; x++) {
                GoColor stone = game.stoneAt(new Vertex(x, y));
                row.append(stone == null ? '.' : stone == GoColor.BLACK ? 'X' : 'O').append(' ');
            }
            System.out.println(row.toString().stripTrailing());
        }
        var footer = new StringBuilder("   ");
        for (int x = 0; x < size; x++) {
            footer.append(COLUMNS.charAt(x)).append(' ');
        }
        System.out.println(footer.toString().stripTrailing());
    }

    public static void move(GoMove move) {
        String target = switch (move.type()) {
            case PLAY -> move.vertex().toGtp();
            case PASS -> "pass";
            case RESIGN -> "resign";
        };
        info("Computer (" + colorName(move.color()) + ") played " + target);
    }

    private static String colorName(GoColor color) {
        return color == GoColor.BLACK ? "Black" : "White";
    }
}
