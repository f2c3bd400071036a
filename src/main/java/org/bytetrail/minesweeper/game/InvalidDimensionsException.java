package org.bytetrail.minesweeper.game;

/**
 * Thrown when a field cannot be generated for the requested size, either
 * because a dimension is not positive or because the density function asks
 * for at least as many mines as there are cells.
 */
public class InvalidDimensionsException extends IllegalArgumentException {

    public InvalidDimensionsException(String message) {
        super(message);
    }
}
