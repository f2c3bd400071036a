package org.bytetrail.minesweeper.game;

/**
 * Coarse state of a {@link MineField}.
 */
public enum GameState {
    /**
     * Freshly generated, cleared or reset; no command issued yet.
     */
    INITIAL,
    PLAYING,
    /**
     * Part of the model for collaborators, never entered by {@link MineField} itself.
     */
    WON,
    /**
     * A mine has been uncovered. {@link MineField#uncover(int, int)} is frozen.
     */
    LOST
}
