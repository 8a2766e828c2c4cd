package com.empires.model;

import com.empires.grid.GridPosition;

/**
 * An immutable map tile. The id is {@code row * width + col} of the owning map.
 */
public record Tile(int id, GridPosition position, Terrain terrain, String resourceType, int resourceAmount) {

    public int row() {
        return position.row();
    }

    public int col() {
        return position.col();
    }
}
