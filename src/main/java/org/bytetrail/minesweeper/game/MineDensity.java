package org.bytetrail.minesweeper.game;

import lombok.Value;

/**
 * Quadratic density function mapping a field area to its mine count:
 * <code>round(area² * a + area * b + c)</code>.
 */
@Value
public class MineDensity {

    /**
     * The default difficulty curve. A 10x10 field gets 12 mines, a 30x18 field 110.
     */
    public static final MineDensity STANDARD = new MineDensity(0.0002, 0.0938, 0.8937);

    double a;
    double b;
    double c;

    /**
     * @param area The number of cells of the field
     * @return The number of mines to place, possibly negative for odd constants
     */
    public long mines(long area) {
        double size = area;
        return Math.round(size * size * a + size * b + c);
    }
}
