package org.bytetrail.minesweeper;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.bytetrail.minesweeper.game.GameState;
import org.bytetrail.minesweeper.game.MineField;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A line of the text console, parsed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Command {

    @Getter
    @RequiredArgsConstructor
    public enum Type {
        EXIT('x', false),
        RESET('r', false),
        UNCOVER('u', true),
        FLAG('f', true),
        QUESTION('?', true),
        CLEAR_MARK('c', true);

        private final char key;
        private final boolean targeted;
    }

    private static final Pattern COORDINATES = Pattern.compile("\\[\\s*(-?\\d+)\\s*,\\s*(-?\\d+)\\s*]");

    Type type;
    int x;
    int y;

    /**
     * Parses a command such as <code>x</code>, <code>r</code> or <code>u[3,4]</code>.
     *
     * @param line The input line
     * @return The command
     * @throws IllegalArgumentException If the line is not a valid command
     */
    public static Command parse(@NonNull String line) {
        String input = line.trim();
        if (input.isEmpty()) {
            throw new IllegalArgumentException("Empty command");
        }

        Type type = null;
        for (Type t : Type.values()) {
            if (t.getKey() == Character.toLowerCase(input.charAt(0))) {
                type = t;
            }
        }
        if (type == null) {
            throw new IllegalArgumentException(String.format("Unknown command '%c'", input.charAt(0)));
        }

        String args = input.substring(1).trim();
        if (!type.isTargeted()) {
            if (!args.isEmpty()) {
                throw new IllegalArgumentException(String.format("Command '%c' takes no argument", type.getKey()));
            }
            return new Command(type, 0, 0);
        }

        Matcher matcher = COORDINATES.matcher(args);
        if (!matcher.matches()) {
            throw new IllegalArgumentException(String.format("Expected '%c[x,y]', got '%s'", type.getKey(), input));
        }
        try {
            return new Command(type, Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Invalid coordinates in '%s'", input), e);
        }
    }

    /**
     * Applies the command to a field. A lost uncover reveals every mine.
     * {@link Type#EXIT} does nothing.
     *
     * @param field The field to play on
     * @throws org.bytetrail.minesweeper.game.OutOfBoundsException If the target cell is outside of the field
     */
    public void execute(@NonNull MineField field) {
        switch (type) {
            case RESET:
                field.reset();
                break;
            case UNCOVER:
                if (field.uncover(x, y) == GameState.LOST) {
                    field.showMined();
                }
                break;
            case FLAG:
                field.flag(x, y);
                break;
            case QUESTION:
                field.question(x, y);
                break;
            case CLEAR_MARK:
                field.setUnknown(x, y);
                break;
            default:
                break;
        }
    }
}
