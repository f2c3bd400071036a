package org.bytetrail.minesweeper.game;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellStateTest {

    @Test
    void testFactoriesAreShared() {
        assertSame(CellState.unknown(true), CellState.unknown(true));
        assertSame(CellState.counted(3), CellState.counted(3));
        assertNotEquals(CellState.unknown(true), CellState.unknown(false));
        assertNotEquals(CellState.flagged(false), CellState.questioned(false));
    }

    @Test
    void testCountedBounds() {
        assertEquals(1, CellState.counted(1).getCount());
        assertEquals(8, CellState.counted(8).getCount());
        assertFalse(CellState.counted(8).isTrapped());
        assertThrows(IllegalArgumentException.class, () -> CellState.counted(0));
        assertThrows(IllegalArgumentException.class, () -> CellState.counted(9));
    }

    @Test
    void testCovered() {
        assertTrue(CellState.unknown(false).isCovered());
        assertTrue(CellState.flagged(true).isCovered());
        assertTrue(CellState.questioned(false).isCovered());
        assertFalse(CellState.known(false).isCovered());
        assertFalse(CellState.counted(2).isCovered());
    }

    @Test
    void testShownAsMine() {
        assertTrue(CellState.unknown(true).isShownAsMine());
        assertTrue(CellState.known(true).isShownAsMine());
        assertFalse(CellState.flagged(true).isShownAsMine());
        assertFalse(CellState.questioned(true).isShownAsMine());
        assertFalse(CellState.unknown(false).isShownAsMine());
    }

    @Test
    void testGlyphs() {
        // covered cells never give their content away
        assertEquals(CellState.unknown(true).getChar(), CellState.unknown(false).getChar());
        assertEquals('■', CellState.unknown(false).getChar());
        assertEquals('□', CellState.known(false).getChar());
        assertEquals('*', CellState.known(true).getChar());
        assertEquals('5', CellState.counted(5).getChar());
        assertEquals('!', CellState.flagged(false).getChar());
        assertEquals('?', CellState.questioned(true).getChar());
    }

    @Test
    void testToString() {
        assertEquals("FLAGGED(true)", CellState.flagged(true).toString());
        assertEquals("COUNTED(4)", CellState.counted(4).toString());
    }
}
