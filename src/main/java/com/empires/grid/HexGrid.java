package com.empires.grid;

import java.util.ArrayList;
import java.util.List;

/**
 * Geometry of the "odd-r" hex layout: odd rows are shoved right by half a hex.
 * Storage and bounds checks use offset positions, distance and adjacency use cube coordinates.
 */
public final class HexGrid {

    /**
     * The six unit directions, in the order neighbours are always enumerated.
     */
    public static final List<CubeCoord> DIRECTIONS = List.of(
            new CubeCoord(1, 0, -1), new CubeCoord(1, -1, 0), new CubeCoord(0, -1, 1),
            new CubeCoord(-1, 0, 1), new CubeCoord(-1, 1, 0), new CubeCoord(0, 1, -1));

    private HexGrid() {
    }

    public static CubeCoord offsetToCube(int col, int row) {
        int x = col - (row - (row & 1)) / 2;
        int z = row;
        return new CubeCoord(x, -x - z, z);
    }

    public static CubeCoord offsetToCube(GridPosition position) {
        return offsetToCube(position.col(), position.row());
    }

    public static GridPosition cubeToOffset(CubeCoord cube) {
        int col = cube.x() + (cube.z() - (cube.z() & 1)) / 2;
        return new GridPosition(cube.z(), col);
    }

    public static List<CubeCoord> neighbors(CubeCoord cube) {
        List<CubeCoord> result = new ArrayList<>(DIRECTIONS.size());
        for (CubeCoord direction : DIRECTIONS) {
            result.add(cube.plus(direction));
        }
        return result;
    }

    public static int distance(CubeCoord a, CubeCoord b) {
        return (Math.abs(a.x() - b.x()) + Math.abs(a.y() - b.y()) + Math.abs(a.z() - b.z())) / 2;
    }

    public static int distance(GridPosition a, GridPosition b) {
        return distance(offsetToCube(a), offsetToCube(b));
    }

    public static boolean isInBounds(GridPosition position, int width, int height) {
        return position.row() >= 0 && position.row() < height
                && position.col() >= 0 && position.col() < width;
    }

    /**
     * In-bounds neighbours of an offset position, in {@link #DIRECTIONS} order.
     */
    public static List<GridPosition> adjacentPositions(GridPosition position, int width, int height) {
        List<GridPosition> result = new ArrayList<>(DIRECTIONS.size());
        for (CubeCoord neighbor : neighbors(offsetToCube(position))) {
            GridPosition candidate = cubeToOffset(neighbor);
            if (isInBounds(candidate, width, height)) {
                result.add(candidate);
            }
        }
        return result;
    }
}
