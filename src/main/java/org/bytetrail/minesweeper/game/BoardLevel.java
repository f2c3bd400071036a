package org.bytetrail.minesweeper.game;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.Random;

/**
 * Field sizes offered to the player.
 */
@Getter
@RequiredArgsConstructor
public enum BoardLevel {
    EASY(8, 10),
    MEDIUM(12, 16),
    DIFFICULT(30, 18);

    private final int width;
    private final int height;

    public MineField createMineField(@NonNull Random rng) {
        return new Random2DSquareGridMineField(width, height, rng);
    }
}
