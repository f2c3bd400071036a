package org.bytetrail.minesweeper.game;

/**
 * <p>
 *     A rectangular grid of cells, some of them trapped, and the bookkeeping
 *     of a single game played on it.
 * </p>
 * <p>
 *     Cells are addressed by <code>x</code> in [0, width) and <code>y</code>
 *     in [0, height). Every operation taking coordinates throws
 *     {@link OutOfBoundsException} for cells outside of the field, except
 *     {@link #uncover(int, int)} once the game is {@link GameState#LOST lost}.
 * </p>
 * <p>
 *     Implementations are not thread-safe. Callers must serialize commands.
 * </p>
 */
public interface MineField {

    int getWidth();

    int getHeight();

    /**
     * The number of mines placed when the field was generated.
     *
     * @return The number of mines placed when the field was generated.
     */
    int getTotalMines();

    /**
     * The player-facing mine counter: the total minus the flags currently
     * set, never below zero. Flagging a safe cell still decrements it.
     *
     * @return The number of mines the player has not flagged yet.
     */
    int getRemaining();

    GameState getState();

    /**
     * The visible state of a cell.
     *
     * @param x The column
     * @param y The row
     * @return The state of the cell
     */
    CellState getCellState(int x, int y);

    /**
     * Whether the cell is currently recognized as a mine: a covered or
     * detonated mine. A flagged or questioned mine reports <code>false</code>,
     * use {@link #isTrapped(int, int)} for the ground truth.
     *
     * @param x The column
     * @param y The row
     * @return Whether the cell is an unmarked or detonated mine
     */
    boolean isMined(int x, int y);

    /**
     * Whether a mine lies under the cell, whatever its visible state.
     *
     * @param x The column
     * @param y The row
     * @return Whether the cell is trapped
     */
    boolean isTrapped(int x, int y);

    /**
     * Count the mines surrounding a cell, marked or not.
     *
     * @param x The column
     * @param y The row
     * @return The number of trapped neighbors, in [0, 8]
     */
    int getSurroundingMinesCount(int x, int y);

    /**
     * <p>Reveals a cell.</p>
     * <p>
     *     A covered mine detonates and the game is lost. A covered safe cell
     *     shows its surrounding mines count; when that count is zero, the
     *     whole connected region of such cells is revealed along with its
     *     counted border. Revealed cells are left untouched. Once lost, the
     *     call does nothing.
     * </p>
     *
     * @param x The column
     * @param y The row
     * @return The resulting game state
     */
    GameState uncover(int x, int y);

    /**
     * Marks a covered or questioned cell as trapped and decrements the
     * remaining counter. Other cells are left untouched.
     *
     * @param x The column
     * @param y The row
     */
    void flag(int x, int y);

    /**
     * Marks a covered or flagged cell as uncertain. Un-flagging increments
     * the remaining counter.
     *
     * @param x The column
     * @param y The row
     */
    void question(int x, int y);

    /**
     * Covers a cell again, dropping any mark. Un-flagging increments the
     * remaining counter.
     *
     * @param x The column
     * @param y The row
     */
    void setUnknown(int x, int y);

    /**
     * Reveals every covered, unmarked mine.
     */
    void showMined();

    /**
     * Wipes the field and places a new set of mines.
     */
    void reset();

    /**
     * Covers every cell and removes all mines, without placing new ones.
     */
    void clear();

    /**
     * One glyph per cell, separated by spaces, one line per row.
     *
     * @return The text view of the field
     */
    String render();
}
