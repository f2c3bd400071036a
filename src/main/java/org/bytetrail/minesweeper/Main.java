package org.bytetrail.minesweeper;

import lombok.extern.log4j.Log4j2;
import org.bytetrail.minesweeper.game.BoardLevel;
import org.bytetrail.minesweeper.game.MineField;
import org.bytetrail.minesweeper.game.OutOfBoundsException;
import org.bytetrail.minesweeper.game.Random2DSquareGridMineField;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Random;

/**
 * Text console for the game logic.
 *
 * <pre>
 * Main [easy|medium|difficult | &lt;width&gt; &lt;height&gt;] [seed]
 * </pre>
 */
@Log4j2
public class Main {
    private static final int WIDTH = 10;
    private static final int HEIGHT = 5;

    private static final String HELP = String.join("\n"
            , "Minesweeper CLI"
            , "----------------------------------------"
            , "Commands:"
            , "x       Exit"
            , "r       Restart"
            , "u[x,y]  Uncover a tile at the coordinates"
            , "f[x,y]  Flag a mine at the coordinates"
            , "?[x,y]  Question the tile at the coordinates"
            , "c[x,y]  Clear the mark at the coordinates"
            , "");

    private static final String USAGE = "usage: Main [easy|medium|difficult | <width> <height>] [seed]";

    public static void main(String[] args) throws IOException {
        MineField field;
        try {
            field = createMineField(args);
        } catch (IllegalArgumentException e) {
            log.error("Cannot create field: {}", e.getMessage());
            System.err.println(USAGE);
            System.exit(1);
            return;
        }

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        out.println(HELP);
        play(field, in, out);
    }

    /**
     * Builds the field described by the command line.
     *
     * @param args The command line arguments
     * @return The new field
     * @throws IllegalArgumentException If the arguments cannot be understood,
     * including sizes no field can be generated for.
     */
    static MineField createMineField(String[] args) {
        int seedIndex;
        int width;
        int height;

        if (args.length == 0) {
            width = WIDTH;
            height = HEIGHT;
            seedIndex = 0;
        } else if (isNumber(args[0])) {
            if (args.length < 2) {
                throw new IllegalArgumentException("Missing height");
            }
            width = parseInt(args[0], "width");
            height = parseInt(args[1], "height");
            seedIndex = 2;
        } else {
            BoardLevel level;
            try {
                level = BoardLevel.valueOf(args[0].toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(String.format("Unknown level '%s'", args[0]), e);
            }
            width = level.getWidth();
            height = level.getHeight();
            seedIndex = 1;
        }

        if (args.length > seedIndex + 1) {
            throw new IllegalArgumentException("Too many arguments");
        }

        long seed;
        if (args.length > seedIndex) {
            try {
                seed = Long.parseLong(args[seedIndex]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(String.format("Invalid seed '%s'", args[seedIndex]), e);
            }
        } else {
            seed = new Random().nextLong();
        }

        log.info("Creating {}x{} field, seed: {}", width, height, seed);
        return new Random2DSquareGridMineField(width, height, seed);
    }

    /**
     * Reads commands until <code>x</code> or the end of the input, printing
     * the field before each one.
     *
     * @param field The field to play on
     * @param in The command source
     * @param out The console
     * @throws IOException If reading a command fails
     */
    static void play(MineField field, BufferedReader in, PrintStream out) throws IOException {
        while (true) {
            out.print(field.render());
            out.println(String.format("Mines remaining: %d  State: %s", field.getRemaining(), field.getState()));
            out.print("> ");
            out.flush();

            String line = in.readLine();
            if (line == null) {
                return;
            }

            Command command;
            try {
                command = Command.parse(line);
            } catch (IllegalArgumentException e) {
                log.warn("Ignored '{}': {}", line, e.getMessage());
                out.println(e.getMessage());
                continue;
            }

            if (command.getType() == Command.Type.EXIT) {
                return;
            }

            try {
                command.execute(field);
            } catch (OutOfBoundsException e) {
                log.warn("Ignored '{}': {}", line, e.getMessage());
                out.println(e.getMessage());
            }
        }
    }

    private static boolean isNumber(String arg) {
        return arg.matches("-?\\d+");
    }

    private static int parseInt(String arg, String name) {
        try {
            return Integer.parseInt(arg);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Invalid %s '%s'", name, arg), e);
        }
    }
}
