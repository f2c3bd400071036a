package org.bytetrail.minesweeper.game;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * <p>
 *     Visible state of a single cell of a {@link MineField}, wrapping its
 *     ground truth.
 * </p>
 * <p>
 *     Instances are immutable and shared: use the static factories.
 *     {@link Kind#COUNTED} cells are never trapped and carry a count in
 *     [1, 8]; every other kind carries a zero count.
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CellState {

    public enum Kind {
        /** Covered, untouched. */
        UNKNOWN,
        /** Revealed: a detonated mine, or an empty cell without trapped neighbors. */
        KNOWN,
        FLAGGED,
        QUESTIONED,
        /** Revealed, not trapped, with at least one trapped neighbor. */
        COUNTED
    }

    public static final int MAX_COUNT = 8;

    private static final CellState[] SAFE = new CellState[Kind.values().length];
    private static final CellState[] TRAPPED = new CellState[Kind.values().length];
    private static final CellState[] COUNTED = new CellState[MAX_COUNT + 1];

    static {
        for (Kind kind : Kind.values()) {
            if (kind != Kind.COUNTED) {
                SAFE[kind.ordinal()] = new CellState(kind, false, 0);
                TRAPPED[kind.ordinal()] = new CellState(kind, true, 0);
            }
        }
        for (int count = 1; count <= MAX_COUNT; count++) {
            COUNTED[count] = new CellState(Kind.COUNTED, false, count);
        }
    }

    Kind kind;

    /**
     * Ground truth, fixed once the field is generated.
     */
    boolean trapped;

    int count;

    public static CellState unknown(boolean trapped) {
        return of(Kind.UNKNOWN, trapped);
    }

    public static CellState known(boolean trapped) {
        return of(Kind.KNOWN, trapped);
    }

    public static CellState flagged(boolean trapped) {
        return of(Kind.FLAGGED, trapped);
    }

    public static CellState questioned(boolean trapped) {
        return of(Kind.QUESTIONED, trapped);
    }

    /**
     * @param count The number of trapped neighbors
     * @return The shared counted state
     * @throws IllegalArgumentException if <code>count</code> is not in [1, 8]
     */
    public static CellState counted(int count) {
        if (count < 1 || count > MAX_COUNT) {
            throw new IllegalArgumentException(String.format("Count %d out of [1, %d]", count, MAX_COUNT));
        }
        return COUNTED[count];
    }

    private static CellState of(Kind kind, boolean trapped) {
        return trapped ? TRAPPED[kind.ordinal()] : SAFE[kind.ordinal()];
    }

    /**
     * Whether the player can still uncover this cell.
     *
     * @return true for {@link Kind#UNKNOWN}, {@link Kind#FLAGGED} and {@link Kind#QUESTIONED}
     */
    public boolean isCovered() {
        return kind == Kind.UNKNOWN || kind == Kind.FLAGGED || kind == Kind.QUESTIONED;
    }

    /**
     * Whether this wrapper hides or shows a mine, as opposed to a revealed
     * counted or empty cell.
     *
     * @return true if the cell is trapped and covered or detonated
     */
    public boolean isShownAsMine() {
        return trapped && (kind == Kind.UNKNOWN || kind == Kind.KNOWN);
    }

    public char getChar() {
        switch (kind) {
            case UNKNOWN:
                return '■';
            case KNOWN:
                return trapped ? '*' : '□';
            case COUNTED:
                return (char) ('0' + count);
            case FLAGGED:
                return '!';
            case QUESTIONED:
                return '?';
            default:
                throw new IllegalStateException(kind.name());
        }
    }

    @Override
    public String toString() {
        return kind == Kind.COUNTED
                ? String.format("%s(%d)", kind, count)
                : String.format("%s(%b)", kind, trapped);
    }
}
