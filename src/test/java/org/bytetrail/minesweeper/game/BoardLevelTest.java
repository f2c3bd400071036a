package org.bytetrail.minesweeper.game;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class BoardLevelTest {

    @Test
    void testCreateMineField() {
        MineField easy = BoardLevel.EASY.createMineField(new Random(1L));
        assertEquals(8, easy.getWidth());
        assertEquals(10, easy.getHeight());
        assertEquals(10, easy.getTotalMines());

        MineField medium = BoardLevel.MEDIUM.createMineField(new Random(1L));
        assertEquals(12, medium.getWidth());
        assertEquals(16, medium.getHeight());
        assertEquals(26, medium.getTotalMines());

        MineField difficult = BoardLevel.DIFFICULT.createMineField(new Random(1L));
        assertEquals(30, difficult.getWidth());
        assertEquals(18, difficult.getHeight());
        assertEquals(110, difficult.getTotalMines());
        assertEquals(GameState.INITIAL, difficult.getState());
    }
}
