package org.bytetrail.minesweeper.game;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/**
 * <p>
 *     In-memory, randomly generated implementation of {@link MineField}.
 * </p>
 * <p>
 *     Cells are stored row-major, at index <code>y * width + x</code>. The
 *     mine count comes from a {@link MineDensity} applied to the field area
 *     and mines are placed by drawing cell indexes from the given
 *     {@link Random} until enough distinct cells are trapped. The same
 *     generator is reused by {@link #reset()}, so a seeded generator yields a
 *     reproducible sequence of fields.
 * </p>
 * <p>
 *     Marking commands stay available once the game is lost but never move
 *     the state off {@link GameState#LOST}.
 * </p>
 */
@Log4j2
public class Random2DSquareGridMineField implements MineField {

    @Getter private final int width;
    @Getter private final int height;
    @Getter private final int totalMines;
    @Getter private int remaining;
    @Getter private GameState state = GameState.INITIAL;

    private final CellState[] cells;
    private final Random rng;

    public Random2DSquareGridMineField(int width, int height) {
        this(width, height, new Random());
    }

    public Random2DSquareGridMineField(int width, int height, long seed) {
        this(width, height, new Random(seed));
    }

    public Random2DSquareGridMineField(int width, int height, Random rng) {
        this(width, height, rng, MineDensity.STANDARD);
    }

    /**
     * @param width The number of columns
     * @param height The number of rows
     * @param rng The generator used to place mines, here and on {@link #reset()}
     * @param density The function giving the mine count
     * @throws InvalidDimensionsException If a dimension is not positive, or
     * if the density asks for a negative count or for at least one mine per cell.
     */
    public Random2DSquareGridMineField(int width, int height, @NonNull Random rng, @NonNull MineDensity density) {
        if (width <= 0 || height <= 0) {
            throw new InvalidDimensionsException(String.format("Invalid field size %dx%d", width, height));
        }

        int area;
        try {
            area = Math.multiplyExact(width, height);
        } catch (ArithmeticException e) {
            throw new InvalidDimensionsException(String.format("Field size %dx%d is too large", width, height));
        }

        long mines = density.mines(area);
        if (mines < 0 || mines >= area) {
            throw new InvalidDimensionsException(String.format(
                    "Cannot place %d mines on a %dx%d field", mines, width, height));
        }

        this.width = width;
        this.height = height;
        this.totalMines = (int) mines;
        this.cells = new CellState[area];
        this.rng = rng;

        reset();
    }

    @Override
    public CellState getCellState(int x, int y) {
        return cells[indexOf(x, y)];
    }

    @Override
    public boolean isMined(int x, int y) {
        return cells[indexOf(x, y)].isShownAsMine();
    }

    @Override
    public boolean isTrapped(int x, int y) {
        return cells[indexOf(x, y)].isTrapped();
    }

    @Override
    public int getSurroundingMinesCount(int x, int y) {
        indexOf(x, y);
        return countSurroundingMines(x, y);
    }

    @Override
    public void reset() {
        clear();

        // mine the field
        int placed = 0;
        while (placed < totalMines) {
            int index = rng.nextInt(cells.length);
            if (!cells[index].isTrapped()) {
                cells[index] = CellState.unknown(true);
                placed++;
            }
        }

        remaining = totalMines;
        state = GameState.INITIAL;
        log.debug("Generated {}x{} field with {} mines", width, height, totalMines);
    }

    @Override
    public void clear() {
        Arrays.fill(cells, CellState.unknown(false));
        state = GameState.INITIAL;
    }

    /**
     * Traps a cell, whatever its current state, without touching the counters.
     * Used to lay out fixed fields on top of {@link #clear()}.
     *
     * @param x The column
     * @param y The row
     */
    void plant(int x, int y) {
        cells[indexOf(x, y)] = CellState.unknown(true);
    }

    @Override
    public void flag(int x, int y) {
        int index = indexOf(x, y);
        CellState cell = cells[index];
        switch (cell.getKind()) {
            case UNKNOWN:
            case QUESTIONED:
                cells[index] = CellState.flagged(cell.isTrapped());
                if (remaining > 0) {
                    remaining--;
                }
                break;
            default:
                break;
        }
        play();
    }

    @Override
    public void question(int x, int y) {
        int index = indexOf(x, y);
        CellState cell = cells[index];
        switch (cell.getKind()) {
            case UNKNOWN:
                cells[index] = CellState.questioned(cell.isTrapped());
                break;
            case FLAGGED:
                cells[index] = CellState.questioned(cell.isTrapped());
                remaining++;
                break;
            default:
                break;
        }
        play();
    }

    @Override
    public void setUnknown(int x, int y) {
        int index = indexOf(x, y);
        CellState cell = cells[index];
        switch (cell.getKind()) {
            case FLAGGED:
                cells[index] = CellState.unknown(cell.isTrapped());
                remaining++;
                break;
            case KNOWN:
            case QUESTIONED:
                cells[index] = CellState.unknown(cell.isTrapped());
                break;
            case COUNTED:
                cells[index] = CellState.unknown(false);
                break;
            default:
                break;
        }
    }

    @Override
    public void showMined() {
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] == CellState.unknown(true)) {
                cells[i] = CellState.known(true);
            }
        }
    }

    @Override
    public GameState uncover(int x, int y) {
        if (state == GameState.LOST) {
            return state;
        }

        int index = indexOf(x, y);
        state = GameState.PLAYING;

        CellState cell = cells[index];
        if (cell.isCovered()) {
            if (cell.isTrapped()) {
                cells[index] = CellState.known(true);
                state = GameState.LOST;
                log.debug("Uncovered mine at [{}, {}]", x, y);
            } else {
                int count = countSurroundingMines(x, y);
                if (count != 0) {
                    cells[index] = CellState.counted(count);
                } else {
                    int revealed = floodReveal(x, y);
                    if (log.isTraceEnabled()) {
                        log.trace(String.format("Flood from [%d, %d] revealed %d cells", x, y, revealed));
                    }
                }
            }
        }

        return state;
    }

    /**
     * Reveals the region of zero-count cells containing the given cell, and
     * its counted border. No recursion: neighbors are pushed on a work stack.
     *
     * @param x The column of a safe cell with no trapped neighbor
     * @param y The row of that cell
     * @return The number of cells processed
     */
    private int floodReveal(int x, int y) {
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(y * width + x);

        int processed = 0;
        while (!stack.isEmpty()) {
            int index = stack.pop();
            int cx = index % width;
            int cy = index / width;
            int count = countSurroundingMines(cx, cy);
            if (count == 0) {
                cells[index] = CellState.known(false);
                forEachNeighbor(cx, cy, n -> {
                    if (cells[n] == CellState.unknown(false)) {
                        stack.push(n);
                    }
                });
            } else {
                cells[index] = CellState.counted(count);
            }
            processed++;
        }
        return processed;
    }

    private int countSurroundingMines(int x, int y) {
        AtomicInteger count = new AtomicInteger();
        forEachNeighbor(x, y, n -> {
            CellState cell = cells[n];
            if (cell.isTrapped() && cell.isCovered()) {
                count.incrementAndGet();
            }
        });
        return count.get();
    }

    /**
     * Calls {@link IntConsumer#accept(int) consumer.accept()} with the index
     * of each neighbor of a cell inside the field.
     *
     * @param x The column
     * @param y The row
     * @param consumer The callback
     */
    private void forEachNeighbor(int x, int y, IntConsumer consumer) {
        for (int ny = y - 1; ny <= y + 1; ny++) {
            if (ny >= 0 && ny < height) {
                for (int nx = x - 1; nx <= x + 1; nx++) {
                    if (nx >= 0 && nx < width
                            && (nx != x || ny != y)) {
                        consumer.accept(ny * width + nx);
                    }
                }
            }
        }
    }

    private void play() {
        if (state != GameState.LOST) {
            state = GameState.PLAYING;
        }
    }

    private int indexOf(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new OutOfBoundsException(x, y, width, height);
        }
        return y * width + x;
    }

    @Override
    public String render() {
        StringBuilder res = new StringBuilder();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (x > 0) {
                    res.append(' ');
                }
                res.append(cells[y * width + x].getChar());
            }
            res.append('\n');
        }
        return res.toString();
    }

    @Override
    public String toString() {
        return String.format("MineField@%d[%dx%d, %d/%d mines, %s]"
                , hashCode()
                , width, height
                , remaining, totalMines
                , state);
    }
}
