package org.bytetrail.minesweeper.game;

import lombok.Getter;

/**
 * Thrown when a {@link MineField} operation receives coordinates outside of the field.
 */
@Getter
public class OutOfBoundsException extends IndexOutOfBoundsException {

    private final int x;
    private final int y;

    public OutOfBoundsException(int x, int y, int width, int height) {
        super(String.format("Cell [%d, %d] outside of %dx%d field", x, y, width, height));
        this.x = x;
        this.y = y;
    }
}
