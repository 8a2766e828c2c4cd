package com.empires.grid;

/**
 * Odd-r offset position on the map, as stored and exchanged with clients.
 */
public record GridPosition(int row, int col) {

    public static GridPosition of(int row, int col) {
        return new GridPosition(row, col);
    }
}
