package com.empires.grid;

/**
 * A hexagon in cube coordinates. The three axes always sum to zero.
 */
public record CubeCoord(int x, int y, int z) {

    public CubeCoord {
        if (x + y + z != 0) {
            throw new IllegalArgumentException("Cube coordinates must sum to zero: " + x + ", " + y + ", " + z);
        }
    }

    public CubeCoord plus(CubeCoord other) {
        return new CubeCoord(x + other.x, y + other.y, z + other.z);
    }

    @Override
    public String toString() {
        return "Cube(" + x + ", " + y + ", " + z + ")";
    }
}
